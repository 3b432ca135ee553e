package com.bastion.authgateway.infrastructure.web;

import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.auth.AuthenticationException;
import com.bastion.security.authz.AccessDeniedException;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses carrying a timestamp and the
 * correlation id.
 *
 * <pre>
 * {
 *   "type": "https://bastion.dev/errors/invalid-credentials",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Invalid username or password.",
 *   "timestamp": "2026-10-17T09:00:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Authentication failures keep the user-facing message of their {@code AuthFailure}; unknown
 * login and wrong password are indistinguishable here as well. Messages of other exceptions are
 * logged only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://bastion.dev/errors/";

    @ExceptionHandler(AuthenticationException.class)
    public ProblemDetail handleAuthentication(AuthenticationException ex) {
        HttpStatus status =
                switch (ex.failure()) {
                    case INVALID_CREDENTIALS -> HttpStatus.UNAUTHORIZED;
                    case ACCOUNT_DISABLED -> HttpStatus.FORBIDDEN;
                    case FEATURE_NOT_LICENSED -> HttpStatus.PAYMENT_REQUIRED;
                    case PASSWORD_REUSE -> HttpStatus.BAD_REQUEST;
                };
        log.info("Authentication failed: {}", ex.failure());
        String type = ex.failure().name().toLowerCase(Locale.ROOT).replace('_', '-');
        return problem(status, ex.getMessage(), type);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: actor={} actions={}", ex.actorId(), ex.actions());
        return problem(HttpStatus.FORBIDDEN, "Access denied", "access-denied");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, detail, "validation");
        problem.setTitle("Validation Error");
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed request body", "bad-request");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "internal");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
