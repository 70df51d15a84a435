package io.docex.tenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Malformed or reserved tenant id. Never retried. */
public class InvalidTenantIdException extends ErrorResponseException {

  private final String tenantId;

  public InvalidTenantIdException(String tenantId, String reason) {
    super(HttpStatus.BAD_REQUEST, createProblem(reason), null);
    this.tenantId = tenantId;
  }

  public String getTenantId() {
    return tenantId;
  }

  private static ProblemDetail createProblem(String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid tenant id");
    problem.setDetail(reason);
    return problem;
  }
}
