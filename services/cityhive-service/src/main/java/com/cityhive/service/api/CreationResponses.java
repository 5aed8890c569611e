package com.cityhive.service.api;

import com.cityhive.service.domain.creation.CreationResult;
import com.cityhive.service.domain.creation.EntityType;
import com.cityhive.service.infrastructure.web.GlobalExceptionHandler;
import java.util.function.Function;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

/**
 * Turns a {@link CreationResult} into an HTTP response. The status for a failure comes from
 * {@link EntityType#httpStatus}, never from the service.
 */
final class CreationResponses {

    private CreationResponses() {
    }

    static <E> ResponseEntity<Object> toResponse(
            EntityType type, CreationResult<E> result, Function<E, Object> body) {
        if (result.success()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(body.apply(result.entity()));
        }
        int status = type.httpStatus(result.errorKind());
        ProblemDetail problem = GlobalExceptionHandler.forFailure(status, result.message());
        return ResponseEntity.status(status).body(problem);
    }

    static ResponseEntity<Object> notFound(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(GlobalExceptionHandler.forFailure(HttpStatus.NOT_FOUND.value(), message));
    }
}
