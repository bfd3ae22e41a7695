package com.williamcallahan.videochat.web;

import com.williamcallahan.videochat.domain.errors.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Common response helpers for the REST controllers. Failures are mapped by {@link ApiExceptionHandler}.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Wraps a newly stored resource in a 201 response.
     *
     * @param body wire form of the resource
     * @param <T> body type
     * @return 201 response carrying {@code body}
     */
    protected <T> ResponseEntity<T> created(T body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    protected ResponseEntity<ApiResponse> createSuccessResponse(String message) {
        return exceptionBuilder.buildSuccessResponse(message);
    }
}
