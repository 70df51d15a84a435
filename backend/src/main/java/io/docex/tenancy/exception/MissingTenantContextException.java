package io.docex.tenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class MissingTenantContextException extends ErrorResponseException {

  public MissingTenantContextException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Missing tenant context");
    problem.setDetail(detail);
    return problem;
  }
}
