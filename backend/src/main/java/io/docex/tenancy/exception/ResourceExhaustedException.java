package io.docex.tenancy.exception;

import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** No pooled connection became available for a tenant within the configured timeout. */
public class ResourceExhaustedException extends ErrorResponseException {

  private final String tenantId;

  public ResourceExhaustedException(String tenantId, Duration timeout, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(tenantId, timeout), cause);
    this.tenantId = tenantId;
  }

  public String getTenantId() {
    return tenantId;
  }

  private static ProblemDetail createProblem(String tenantId, Duration timeout) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Connection pool exhausted");
    problem.setDetail(
        "No connection for tenant '"
            + tenantId
            + "' became available within "
            + timeout.toMillis()
            + " ms. Retry with backoff.");
    return problem;
  }
}
