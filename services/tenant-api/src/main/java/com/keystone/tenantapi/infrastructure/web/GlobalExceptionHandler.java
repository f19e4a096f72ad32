package com.keystone.tenantapi.infrastructure.web;

import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.persistence.DuplicateRecordException;
import com.keystone.persistence.OptimisticConflictException;
import com.keystone.persistence.RecordNotFoundException;
import com.keystone.persistence.TenantScopeViolationException;
import com.keystone.persistence.UnavailableException;
import com.keystone.security.AccessDeniedException;
import com.keystone.security.DenialReason;
import com.keystone.security.InvalidCredentialException;
import com.keystone.security.TenantMismatchException;
import com.keystone.security.tenant.TenantLookupException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://keystone.dev/errors/access-denied",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "Missing permission users:delete",
 *   "reason": "insufficient_permission",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "requestId": "abc-123"
 * }
 * </pre>
 *
 * <p>Access denials keep their reason code: 401 when the caller must authenticate or name a tenant,
 * 403 when the caller is known but not allowed. A persistence layer that could not answer is 503,
 * never a denial.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://keystone.dev/errors/";

    @ExceptionHandler(InvalidCredentialException.class)
    public ProblemDetail handleInvalidCredential(InvalidCredentialException ex) {
        log.info("Rejected credential: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.UNAUTHORIZED, "invalid-credential", ex.getMessage());
        problem.setProperty("reason", DenialReason.UNAUTHENTICATED.code());
        return problem;
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Tenant mismatch: principal tenant {}, requested tenant {}",
                ex.principalTenantId(), ex.requestedTenantId());
        ProblemDetail problem = problem(HttpStatus.FORBIDDEN, "tenant-mismatch",
                "The credential does not belong to the requested tenant");
        problem.setProperty("reason", ex.reason().code());
        return problem;
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        HttpStatus status = statusFor(ex.reason());
        log.info("Access denied ({}): {}", ex.reason().code(), ex.getMessage());
        ProblemDetail problem = problem(status, "access-denied", ex.getMessage());
        problem.setProperty("reason", ex.reason().code());
        return problem;
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ProblemDetail handleNotFound(RecordNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "not-found", ex.getMessage());
    }

    @ExceptionHandler(OptimisticConflictException.class)
    public ProblemDetail handleConflict(OptimisticConflictException ex) {
        log.info("Concurrent modification: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "version-conflict", ex.getMessage());
        problem.setProperty("currentVersion", ex.actualVersion());
        return problem;
    }

    @ExceptionHandler(DuplicateRecordException.class)
    public ProblemDetail handleDuplicate(DuplicateRecordException ex) {
        log.info("Duplicate: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "duplicate", ex.getMessage());
    }

    @ExceptionHandler({UnavailableException.class, TenantLookupException.class})
    public ProblemDetail handleUnavailable(RuntimeException ex) {
        log.error("Dependency unavailable: {}", ex.getMessage(), ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "unavailable",
                "The service cannot complete the request right now");
    }

    @ExceptionHandler(TenantScopeViolationException.class)
    public ProblemDetail handleScopeViolation(TenantScopeViolationException ex) {
        log.error("Tenant scope violation on {}", ex.recordType(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "An unexpected error occurred");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "validation", detail);
        problem.setTitle("Validation Error");
        return problem;
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, TypeMismatchException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", "Malformed request");
    }

    @ExceptionHandler({
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class,
        MissingServletRequestParameterException.class,
        ErrorResponseException.class
    })
    public ProblemDetail handleErrorResponse(Exception ex) {
        HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
        log.debug("{}: {}", status, ex.getMessage());
        HttpStatus known = HttpStatus.resolve(status.value());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ((ErrorResponse) ex).getBody().getDetail());
        problem.setTitle(known != null ? known.getReasonPhrase() : "Error");
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "An unexpected error occurred");
    }

    static HttpStatus statusFor(DenialReason reason) {
        return switch (reason) {
            case UNAUTHENTICATED, TENANT_REQUIRED -> HttpStatus.UNAUTHORIZED;
            case TENANT_INACTIVE, TENANT_MISMATCH, INSUFFICIENT_ROLE, INSUFFICIENT_PERMISSION -> HttpStatus.FORBIDDEN;
        };
    }

    private static ProblemDetail problem(HttpStatus status, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        enrich(problem);
        return problem;
    }

    private static void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        RequestContextHolder.get(ContextKey.REQUEST_ID)
                .ifPresent(requestId -> problem.setProperty("requestId", requestId));
    }
}
