package io.docex.tenancy.exception;

import io.docex.tenancy.multitenancy.TenantContextNotBoundException;
import io.docex.tenancy.provisioning.ProvisioningException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Domain exceptions carry their own {@link ProblemDetail} and are rendered by the base class. The
 * handlers here cover the plain runtime exceptions of the tenancy layer.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(TenantContextNotBoundException.class)
  public ResponseEntity<ProblemDetail> handleTenantContextNotBound(
      TenantContextNotBoundException ex) {
    log.error("Tenant context invariant violation: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Tenant context not available");
    problem.setDetail("No tenant is bound to this session");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @ExceptionHandler(ProvisioningException.class)
  public ResponseEntity<ProblemDetail> handleProvisioning(
      ProvisioningException ex, HttpServletRequest request) {
    log.error(
        "Provisioning failed: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Provisioning failed");
    problem.setDetail(ex.getMessage() + ". The request is safe to retry.");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Rejected request: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }
}
