package io.docex.tenancy.multitenancy;

import java.time.Instant;

/**
 * One row of the tenant registry. Everything except {@code status} (and its audit columns) is
 * written once at provisioning time and never changes afterwards.
 */
public record TenantRecord(
    String tenantId,
    String displayName,
    boolean system,
    IsolationStrategy isolationStrategy,
    String schemaName,
    String databasePath,
    TenantStatus status,
    String createdBy,
    Instant createdAt,
    Instant lastUpdatedAt,
    String lastUpdatedBy) {

  public static TenantRecord create(
      String tenantId,
      String displayName,
      boolean system,
      IsolationStrategy isolationStrategy,
      String schemaName,
      String databasePath,
      String createdBy) {
    var now = Instant.now();
    return new TenantRecord(
        tenantId,
        displayName,
        system,
        isolationStrategy,
        schemaName,
        databasePath,
        TenantStatus.ACTIVE,
        createdBy,
        now,
        now,
        createdBy);
  }

  public boolean isActive() {
    return status == TenantStatus.ACTIVE;
  }
}
