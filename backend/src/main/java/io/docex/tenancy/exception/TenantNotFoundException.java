package io.docex.tenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class TenantNotFoundException extends ErrorResponseException {

  private final String tenantId;

  public TenantNotFoundException(String tenantId) {
    super(HttpStatus.NOT_FOUND, createProblem(tenantId), null);
    this.tenantId = tenantId;
  }

  public String getTenantId() {
    return tenantId;
  }

  private static ProblemDetail createProblem(String tenantId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Tenant not found");
    problem.setDetail(
        "Tenant '" + tenantId + "' is not in the tenant registry. Provision it before use.");
    problem.setProperty("tenantId", tenantId);
    return problem;
  }
}
