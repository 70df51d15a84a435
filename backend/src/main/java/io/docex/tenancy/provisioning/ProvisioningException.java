package io.docex.tenancy.provisioning;

/** A provisioning step failed part-way. Every step is idempotent, so the call can be repeated. */
public class ProvisioningException extends RuntimeException {

  public ProvisioningException(String message) {
    super(message);
  }

  public ProvisioningException(String message, Throwable cause) {
    super(message, cause);
  }
}
