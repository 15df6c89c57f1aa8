package io.b2mash.b2b.dealroom.exception;

import io.b2mash.b2b.dealroom.audit.AuditEventBuilder;
import io.b2mash.b2b.dealroom.audit.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final AuditService auditService;

  public GlobalExceptionHandler(AuditService auditService) {
    this.auditService = auditService;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());
    recordAccessDenied(request, "insufficient_role");

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    problem.setProperty("code", "FORBIDDEN");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    String reason = ex.getBody().getDetail();
    log.warn(
        "Forbidden: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        reason);
    recordAccessDenied(request, reason != null ? reason : "forbidden");

    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    log.debug("Request body failed validation: {}", ex.getBindingResult().getFieldErrors());
    return withValidationCode(super.handleMethodArgumentNotValid(ex, headers, status, request));
  }

  /** Malformed JSON or values that cannot be converted, e.g. an unparsable deadline. */
  @Override
  protected ResponseEntity<Object> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    log.debug("Unreadable request body: {}", ex.getMessage());
    var response = super.handleHttpMessageNotReadable(ex, headers, status, request);
    if (response != null && response.getBody() instanceof ProblemDetail problem) {
      problem.setDetail("Request body is malformed or contains a value of the wrong format");
    }
    return withValidationCode(response);
  }

  private static ResponseEntity<Object> withValidationCode(ResponseEntity<Object> response) {
    if (response != null && response.getBody() instanceof ProblemDetail problem) {
      problem.setProperty("code", "VALIDATION_ERROR");
    }
    return response;
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    return conflict("Concurrent modification", "Resource was modified concurrently. Please retry.");
  }

  @ExceptionHandler(PessimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handlePessimisticLock(
      PessimisticLockingFailureException ex) {
    log.warn("Pessimistic locking failure: {}", ex.getMessage());
    return conflict("Concurrent modification", "Resource is locked by another operation.");
  }

  /** Unique index violations, e.g. a second open negotiation racing past the existence check. */
  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrityViolation(
      DataIntegrityViolationException ex) {
    log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
    return conflict("Conflicting write", "The change conflicts with existing data.");
  }

  private ResponseEntity<ProblemDetail> conflict(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", "CONFLICT");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  private void recordAccessDenied(HttpServletRequest request, String reason) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("security.access_denied")
            .entityType("security")
            .entityId(UUID.randomUUID())
            .details(
                Map.of(
                    "path", request.getRequestURI(),
                    "method", request.getMethod(),
                    "reason", reason))
            .build());
  }
}
