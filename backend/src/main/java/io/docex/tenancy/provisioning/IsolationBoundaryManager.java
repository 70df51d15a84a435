package io.docex.tenancy.provisioning;

import com.zaxxer.hikari.HikariDataSource;
import io.docex.tenancy.multitenancy.IsolationStrategy;

/**
 * Creates, inspects and connects to isolation boundaries of one {@link IsolationStrategy}.
 *
 * <p>{@link #exists} and {@link #tableExists} never create anything. {@link #createIfAbsent} and
 * {@link #migrate} may be repeated any number of times; a provisioning run that failed half-way
 * converges when it is simply run again.
 */
public interface IsolationBoundaryManager {

  String TENANT_MIGRATIONS = "classpath:db/migration/tenant";
  String BOOTSTRAP_MIGRATIONS = "classpath:db/migration/bootstrap";

  IsolationStrategy strategy();

  /** Derives the boundary names for a business tenant. Pure. */
  TenantBoundary resolve(String tenantId);

  boolean exists(TenantBoundary boundary);

  boolean tableExists(TenantBoundary boundary, String tableName);

  void createIfAbsent(TenantBoundary boundary);

  /**
   * Applies the tenant migrations, plus the registry migrations when {@code includeRegistry} is
   * set (bootstrap boundary only).
   */
  void migrate(TenantBoundary boundary, boolean includeRegistry);

  /** Opens a pool bound to the boundary. The pool never creates a missing boundary. */
  HikariDataSource openDataSource(TenantBoundary boundary, String poolName);

  static String[] migrationLocations(boolean includeRegistry) {
    return includeRegistry
        ? new String[] {TENANT_MIGRATIONS, BOOTSTRAP_MIGRATIONS}
        : new String[] {TENANT_MIGRATIONS};
  }
}
