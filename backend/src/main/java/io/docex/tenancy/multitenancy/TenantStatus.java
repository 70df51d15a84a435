package io.docex.tenancy.multitenancy;

public enum TenantStatus {
  ACTIVE,
  SUSPENDED
}
