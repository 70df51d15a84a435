package io.docex.tenancy.multitenancy;

/**
 * How a tenant's data is physically separated. Chosen once when the tenant is provisioned and
 * stored on its {@link TenantRecord}; routing reads the stored value and never re-derives it.
 */
public enum IsolationStrategy {
  /** One schema per tenant inside the shared database. */
  SCHEMA,
  /** One database file per tenant. */
  DATABASE,
  /** All tenants share one schema; rows are discriminated by {@code tenant_id}. */
  ROW_LEVEL;

  public static IsolationStrategy fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Isolation strategy must not be blank");
    }
    String normalized = value.trim().toUpperCase().replace('-', '_');
    return switch (normalized) {
      case "SCHEMA", "SCHEMA_PER_TENANT" -> SCHEMA;
      case "DATABASE", "DATABASE_PER_TENANT" -> DATABASE;
      case "ROW_LEVEL", "ROW" -> ROW_LEVEL;
      default -> throw new IllegalArgumentException("Unknown isolation strategy: " + value);
    };
  }
}
