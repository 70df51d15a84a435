package io.docex.tenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A session bound to one tenant was asked to act for another. The session must be closed (or
 * reset) before it can be bound again.
 */
public class TenantSwitchException extends ErrorResponseException {

  private final String boundTenantId;
  private final String requestedTenantId;

  public TenantSwitchException(String boundTenantId, String requestedTenantId) {
    super(HttpStatus.CONFLICT, createProblem(boundTenantId, requestedTenantId), null);
    this.boundTenantId = boundTenantId;
    this.requestedTenantId = requestedTenantId;
  }

  public String getBoundTenantId() {
    return boundTenantId;
  }

  public String getRequestedTenantId() {
    return requestedTenantId;
  }

  private static ProblemDetail createProblem(String boundTenantId, String requestedTenantId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Tenant switch without reset");
    problem.setDetail(
        "Cannot switch tenant from '"
            + boundTenantId
            + "' to '"
            + requestedTenantId
            + "'. Call close() or reset() first, then bind the new tenant.");
    return problem;
  }
}
