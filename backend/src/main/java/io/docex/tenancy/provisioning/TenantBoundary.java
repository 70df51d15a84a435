package io.docex.tenancy.provisioning;

import io.docex.tenancy.multitenancy.IsolationStrategy;
import io.docex.tenancy.multitenancy.TenantRecord;
import java.nio.file.Path;

/**
 * Physical location of one tenant's tables. Schema-based strategies carry a schema name, the
 * database strategy carries a file path.
 */
public record TenantBoundary(
    String tenantId, IsolationStrategy strategy, String schemaName, Path databasePath) {

  public TenantBoundary {
    if (strategy == IsolationStrategy.DATABASE && databasePath == null) {
      throw new IllegalArgumentException("Database boundary for " + tenantId + " needs a path");
    }
    if (strategy != IsolationStrategy.DATABASE && (schemaName == null || schemaName.isBlank())) {
      throw new IllegalArgumentException("Schema boundary for " + tenantId + " needs a schema");
    }
  }

  /** Rebuilds the boundary from the names stored on the registry row. */
  public static TenantBoundary of(TenantRecord record) {
    return new TenantBoundary(
        record.tenantId(),
        record.isolationStrategy(),
        record.schemaName(),
        record.databasePath() == null ? null : Path.of(record.databasePath()));
  }

  public String location() {
    return strategy == IsolationStrategy.DATABASE ? databasePath.toString() : schemaName;
  }
}
