package com.tenantguard.workspace.infrastructure.web;

import com.tenantguard.guard.InternalOperationException;
import com.tenantguard.observability.CorrelationContextHolder;
import com.tenantguard.quota.RateLimitDecision;
import com.tenantguard.quota.RateLimitedException;
import com.tenantguard.security.AccountInactiveException;
import com.tenantguard.security.CrossTenantAccessException;
import com.tenantguard.security.NotFoundException;
import com.tenantguard.security.OperationRejectedException;
import com.tenantguard.security.PermissionDeniedException;
import com.tenantguard.security.UnauthenticatedException;
import com.tenantguard.workspace.config.WorkspaceServiceProperties;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps guard rejections and other failures to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://tenantguard.io/errors/rate-limited",
 *   "title": "Too Many Requests",
 *   "status": 429,
 *   "detail": "Rate limit exceeded for 'mutation.create'. Retry in 12 seconds",
 *   "reason": "rate_limited",
 *   "timestamp": "2026-03-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Cross-tenant access is reported as 404 unless
 * {@link WorkspaceServiceProperties#crossTenantAsNotFound()} is off; the audit trail records it
 * under its own reason either way.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://tenantguard.io/errors/";

    private final boolean crossTenantAsNotFound;

    public GlobalExceptionHandler(WorkspaceServiceProperties properties) {
        this.crossTenantAsNotFound = properties.crossTenantAsNotFound();
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ProblemDetail handleUnauthenticated(UnauthenticatedException ex) {
        return rejection(HttpStatus.UNAUTHORIZED, "unauthenticated", ex);
    }

    @ExceptionHandler({AccountInactiveException.class, PermissionDeniedException.class})
    public ProblemDetail handleForbidden(OperationRejectedException ex) {
        return rejection(HttpStatus.FORBIDDEN, "forbidden", ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        return rejection(HttpStatus.NOT_FOUND, "not-found", ex);
    }

    @ExceptionHandler(CrossTenantAccessException.class)
    public ProblemDetail handleCrossTenant(CrossTenantAccessException ex) {
        if (crossTenantAsNotFound) {
            return handleNotFound(NotFoundException.forReference(ex.resource()));
        }
        return rejection(HttpStatus.FORBIDDEN, "cross-tenant-access", ex);
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ProblemDetail> handleRateLimited(RateLimitedException ex) {
        ProblemDetail problem = rejection(HttpStatus.TOO_MANY_REQUESTS, "rate-limited", ex);
        problem.setProperty("retryAfterSeconds", ex.resetInSeconds());
        problem.setProperty("blocked", ex.decisionReason() == RateLimitDecision.Reason.BLOCKED);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.resetInSeconds()))
                .body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(InternalOperationException.class)
    public ProblemDetail handleInternalOperation(InternalOperationException ex) {
        // Already logged with its cause by the guard.
        return internalError();
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return internalError();
    }

    private ProblemDetail rejection(HttpStatus status, String type, OperationRejectedException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("reason", ex.reason().code());
        enrichWithCorrelation(problem);
        return problem;
    }

    private ProblemDetail internalError() {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
