package com.tally.tracker.infrastructure.web;

import com.tally.ledger.InvalidQuantityException;
import com.tally.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Every response carries a {@code timestamp} and, when a request context exists, the
 * {@code correlationId}:
 *
 * <pre>
 * {
 *   "type": "https://tally.dev/errors/invalid-quantity",
 *   "title": "Invalid Quantity",
 *   "status": 422,
 *   "detail": "quantity must be a positive integer, got 0",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final List<String> AVAILABLE_ENDPOINTS =
            List.of(
                    "GET /",
                    "GET /api/v1/info",
                    "POST /api/v1/buy",
                    "POST /api/v1/visit",
                    "GET /api/v1/stats",
                    "GET /api/v1/health",
                    "GET /actuator/health");

    @ExceptionHandler(InvalidQuantityException.class)
    public ProblemDetail handleInvalidQuantity(InvalidQuantityException ex) {
        log.warn("Rejected event: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        problem.setTitle("Invalid Quantity");
        problem.setType(URI.create("https://tally.dev/errors/invalid-quantity"));
        problem.setProperty("quantity", ex.quantity());
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return badRequest("Bad Request", ex.getMessage(), "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .sorted()
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return badRequest("Validation Error", detail, "validation");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad parameter {}: {}", ex.getName(), ex.getValue());
        return badRequest(
                "Bad Request", ex.getName() + " has an invalid value: " + ex.getValue(), "bad-request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return badRequest("Bad Request", "Request body is missing or malformed", "bad-request");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNotFound(NoResourceFoundException ex) {
        String resource = ex.getResourcePath();
        String path = resource.startsWith("/") ? resource : "/" + resource;
        log.debug("No handler for {}", path);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.NOT_FOUND, "The requested path '" + path + "' was not found");
        problem.setTitle("Not Found");
        problem.setType(URI.create("https://tally.dev/errors/not-found"));
        problem.setProperty("availableEndpoints", AVAILABLE_ENDPOINTS);
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ProblemDetail handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        log.debug("Method not supported: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage());
        problem.setTitle("Method Not Allowed");
        problem.setType(URI.create("https://tally.dev/errors/method-not-allowed"));
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create("https://tally.dev/errors/internal"));
        enrich(problem);
        return problem;
    }

    private ProblemDetail badRequest(String title, String detail, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://tally.dev/errors/" + type));
        enrich(problem);
        return problem;
    }

    private void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.correlationId()
                .ifPresent(id -> problem.setProperty("correlationId", id));
    }
}
