package com.leasehold.service.infrastructure.web;

import com.leasehold.access.DelegationException;
import com.leasehold.observability.CorrelationContextHolder;
import com.leasehold.policy.ErrorCategory;
import com.leasehold.policy.LeaseholdException;
import com.leasehold.policy.PolicyViolationException;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <p>Leasehold failures map by {@link ErrorCategory}:
 *
 * <pre>
 * NOT_FOUND                 404
 * AUTHORIZATION             403
 * LEASE_EXPIRED, DELEGATION 401
 * POLICY_VIOLATION          422  (policy rejection reason is the detail, verbatim)
 * ENTITY_STATE              409
 * CONFIGURATION             400
 * EXECUTION                 502
 * </pre>
 *
 * <p>Every response carries a timestamp and, when one is active, the correlation ID.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://leasehold.io/errors/";

    @ExceptionHandler(LeaseholdException.class)
    public ProblemDetail handleLeasehold(LeaseholdException ex) {
        HttpStatus status = statusFor(ex.category());
        if (status.is5xxServerError()) {
            log.error("{} failure: {}", ex.category(), ex.getMessage());
        } else {
            log.warn("{} failure: {}", ex.category(), ex.getMessage());
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(titleFor(ex.category()));
        problem.setType(URI.create(ERROR_TYPE_BASE + slug(ex.category())));
        problem.setProperty("category", ex.category().name());
        if (ex instanceof PolicyViolationException violation) {
            problem.setProperty("policyType", violation.policyType());
        }
        if (ex instanceof DelegationException delegation) {
            problem.setProperty("reason", delegation.reason().name());
        }
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return badRequest(ex.getMessage(), "Bad Request", "bad-request");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ProblemDetail handleMissingHeader(MissingRequestHeaderException ex) {
        log.warn("Missing header: {}", ex.getHeaderName());
        return badRequest("Required header '" + ex.getHeaderName() + "' is missing", "Bad Request",
                "bad-request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return badRequest("Request body is missing or malformed", "Bad Request", "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return badRequest(detail, "Validation Error", "validation");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case LEASE_EXPIRED, DELEGATION -> HttpStatus.UNAUTHORIZED;
            case POLICY_VIOLATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case ENTITY_STATE -> HttpStatus.CONFLICT;
            case CONFIGURATION -> HttpStatus.BAD_REQUEST;
            case EXECUTION -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static String titleFor(ErrorCategory category) {
        return switch (category) {
            case NOT_FOUND -> "Entity Not Found";
            case AUTHORIZATION -> "Not Authorized";
            case LEASE_EXPIRED -> "Lease Expired";
            case DELEGATION -> "Delegation Invalid";
            case POLICY_VIOLATION -> "Policy Violation";
            case ENTITY_STATE -> "Entity Not Operational";
            case CONFIGURATION -> "Invalid Configuration";
            case EXECUTION -> "Execution Failed";
        };
    }

    private static String slug(ErrorCategory category) {
        return category.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private ProblemDetail badRequest(String detail, String title, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
