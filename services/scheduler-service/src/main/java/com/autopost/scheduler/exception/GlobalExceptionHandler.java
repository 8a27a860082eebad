package com.autopost.scheduler.exception;

import com.autopost.scheduler.client.GenerationServiceException;
import com.autopost.scheduler.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Turns failures into {@code {success:false, kind, message}} responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AutopostException.class)
    public ResponseEntity<ErrorResponse> handleAutopostException(AutopostException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Request failed ({}): {}", e.getKind(), e.getMessage());
        } else {
            log.warn("Request rejected ({}): {}", e.getKind(), e.getMessage());
        }
        return respond(status, e.getKind(), e.getMessage());
    }

    @ExceptionHandler(GenerationServiceException.class)
    public ResponseEntity<ErrorResponse> handleGenerationServiceException(GenerationServiceException e) {
        log.error("Generation service call failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ErrorKind.UPSTREAM_ERROR, e.getMessage());
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentModification(OptimisticLockingFailureException e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorKind.INVALID_TRANSITION, "The post was modified concurrently, retry the request");
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, "Malformed request: " + e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL, "Internal error");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorKind kind, String message) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.builder()
                        .success(false)
                        .kind(kind.name())
                        .message(message)
                        .build());
    }

    private HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION, TIMING_VIOLATION -> HttpStatus.CONFLICT;
            case QUOTA_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case HARD_PUBLISH_FAILURE, UPSTREAM_ERROR -> HttpStatus.BAD_GATEWAY;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
