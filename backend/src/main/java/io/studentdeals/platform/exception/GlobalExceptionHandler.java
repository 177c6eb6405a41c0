package io.studentdeals.platform.exception;

import io.studentdeals.platform.audit.AuditActions;
import io.studentdeals.platform.audit.AuditProperties;
import io.studentdeals.platform.audit.AuditService;
import io.studentdeals.platform.security.ActorResolver;
import io.studentdeals.platform.security.CurrentActor;
import io.studentdeals.platform.security.RequestOriginResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final AuditService auditService;
  private final ActorResolver actorResolver;
  private final AuditProperties auditProperties;

  public GlobalExceptionHandler(
      AuditService auditService, ActorResolver actorResolver, AuditProperties auditProperties) {
    this.auditService = auditService;
    this.actorResolver = actorResolver;
    this.auditProperties = auditProperties;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());

    var origin = RequestOriginResolver.resolve(request, auditProperties.maxUserAgentLength());
    auditService.logAction(
        AuditActions.ACCESS_DENIED,
        "security",
        null,
        Map.of(
            "path", request.getRequestURI(),
            "method", request.getMethod(),
            "reason", "insufficient_role"),
        actorResolver.currentActor().map(CurrentActor::id).orElse(null),
        origin.ipAddress(),
        origin.userAgent());

    var problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.FORBIDDEN, "Insufficient permissions for this operation");
    problem.setTitle("Access denied");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }
}
