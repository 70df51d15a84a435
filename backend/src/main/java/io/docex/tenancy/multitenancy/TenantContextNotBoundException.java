package io.docex.tenancy.multitenancy;

public class TenantContextNotBoundException extends RuntimeException {

  public TenantContextNotBoundException() {
    super("Tenant context not available: bind a UserContext before calling this operation");
  }
}
