package io.docex.tenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class TenantExistsException extends ErrorResponseException {

  private final String tenantId;

  public TenantExistsException(String tenantId) {
    this(tenantId, null);
  }

  public TenantExistsException(String tenantId, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(tenantId), cause);
    this.tenantId = tenantId;
  }

  public String getTenantId() {
    return tenantId;
  }

  private static ProblemDetail createProblem(String tenantId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Tenant already exists");
    problem.setDetail("Tenant '" + tenantId + "' is already provisioned");
    problem.setProperty("tenantId", tenantId);
    return problem;
  }
}
