package io.docex.tenancy.provisioning;

import com.zaxxer.hikari.HikariDataSource;
import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.multitenancy.IsolationStrategy;
import io.docex.tenancy.pathing.PathResolver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * All row-level tenants share one schema. Separation relies on the {@code tenant_id} column that
 * every basket and document query filters on.
 */
@Component
public class RowLevelBoundaryManager extends SchemaBoundaryManager {

  public RowLevelBoundaryManager(
      @Qualifier("adminDataSource") HikariDataSource adminDataSource,
      MultiTenancyProperties properties,
      PathResolver pathResolver) {
    super(adminDataSource, properties, pathResolver);
  }

  @Override
  public IsolationStrategy strategy() {
    return IsolationStrategy.ROW_LEVEL;
  }

  @Override
  public TenantBoundary resolve(String tenantId) {
    return new TenantBoundary(
        tenantId, IsolationStrategy.ROW_LEVEL, properties.naming().sharedSchema(), null);
  }
}
