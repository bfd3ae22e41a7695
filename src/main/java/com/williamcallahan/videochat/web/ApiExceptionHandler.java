package com.williamcallahan.videochat.web;

import com.williamcallahan.videochat.domain.errors.ApiErrorResponse;
import com.williamcallahan.videochat.domain.errors.ApiResponse;
import com.williamcallahan.videochat.service.EmbeddingServiceUnavailableException;
import com.williamcallahan.videochat.service.VideoNotFoundException;
import com.williamcallahan.videochat.service.generation.SessionNotFoundException;
import com.williamcallahan.videochat.service.ingestion.InvalidMediaReferenceException;
import com.williamcallahan.videochat.service.ingestion.MediaDownloadException;
import com.williamcallahan.videochat.service.ingestion.TranscriptionException;
import com.williamcallahan.videochat.service.quiz.QuizGenerationException;
import jakarta.validation.ConstraintViolationException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps domain exceptions raised by JSON endpoints to {@link ApiResponse} payloads.
 *
 * Streaming endpoints never reach this advice for in-stream failures; those become {@code error}
 * events.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final ExceptionResponseBuilder exceptionBuilder;

    public ApiExceptionHandler(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler({InvalidMediaReferenceException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiResponse> handleBadRequest(RuntimeException exception) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, exception.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleInvalidBody(MethodArgumentNotValidException exception) {
        String details = exception.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest()
                .body(ApiErrorResponse.error(
                        "Request validation failed", details));
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public ResponseEntity<ApiResponse> handleConstraintViolation(Exception exception) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.BAD_REQUEST, "Request validation failed", exception);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse> handleUnreadableRequest(Exception exception) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request", exception);
    }

    @ExceptionHandler({VideoNotFoundException.class, SessionNotFoundException.class})
    public ResponseEntity<ApiResponse> handleNotFound(RuntimeException exception) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, exception.getMessage());
    }

    @ExceptionHandler({
        MediaDownloadException.class,
        TranscriptionException.class,
        EmbeddingServiceUnavailableException.class,
        QuizGenerationException.class
    })
    public ResponseEntity<ApiResponse> handleUpstreamFailure(RuntimeException exception) {
        log.warn("Upstream failure: {}", exception.getMessage(), exception);
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_GATEWAY, exception.getMessage());
    }
}
