package com.cityhive.service.infrastructure.web;

import com.cityhive.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions raised at the HTTP boundary to RFC 7807 ProblemDetail responses.
 *
 * <p>Business failures never reach this class: controllers turn them into responses directly.
 * What arrives here is malformed input (unparseable JSON, schema violations, bad path variables)
 * and unexpected errors. Malformed input always reports the same fixed detail; a 500 never
 * includes exception text.
 *
 * <pre>
 * {
 *   "type": "https://cityhive.dev/errors/invalid-input",
 *   "title": "Bad Request",
 *   "status": 400,
 *   "detail": "Invalid input data",
 *   "success": false,
 *   "error": "Invalid input data",
 *   "timestamp": "2025-06-07T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    public static final String INVALID_INPUT = "Invalid input data";
    public static final String INTERNAL_ERROR = "Internal server error";

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        return invalidInput();
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: fields={}", ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .toList());
        return invalidInput();
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid path or query parameter: {}", ex.getName());
        return invalidInput();
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ProblemDetail handleMediaType(HttpMediaTypeNotSupportedException ex) {
        log.warn("Unsupported content type: {}", ex.getContentType());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Content type must be application/json");
        problem.setType(URI.create("https://cityhive.dev/errors/unsupported-media-type"));
        return enrich(problem);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        // Framework exceptions such as unknown paths or methods already carry their status.
        if (ex instanceof ErrorResponse errorResponse && !errorResponse.getStatusCode().is5xxServerError()) {
            log.warn("Request rejected: status={}, errorType={}",
                    errorResponse.getStatusCode().value(), ex.getClass().getSimpleName());
            return enrich(errorResponse.getBody());
        }
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create("https://cityhive.dev/errors/internal"));
        return enrich(problem);
    }

    /**
     * Builds a problem for a business failure reported by a creation service.
     */
    public static ProblemDetail forFailure(int status, String message) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.valueOf(status), message);
        problem.setType(URI.create("https://cityhive.dev/errors/" + typeSlug(status)));
        return enrich(problem);
    }

    private static ProblemDetail invalidInput() {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, INVALID_INPUT);
        problem.setType(URI.create("https://cityhive.dev/errors/invalid-input"));
        return enrich(problem);
    }

    /**
     * Adds the response envelope fields, the timestamp and the correlation ID.
     */
    private static ProblemDetail enrich(ProblemDetail problem) {
        problem.setProperty("success", false);
        problem.setProperty("error", problem.getDetail());
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }

    private static String typeSlug(int status) {
        return switch (status) {
            case 404 -> "not-found";
            case 409 -> "conflict";
            case 400 -> "invalid-input";
            default -> "internal";
        };
    }
}
