package com.williamcallahan.tutormemory.web;

import com.williamcallahan.tutormemory.domain.errors.FactNotFoundException;
import com.williamcallahan.tutormemory.domain.errors.FactPersistenceException;
import com.williamcallahan.tutormemory.domain.errors.UnsupportedConflictStrategyException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain and request errors to the standard error envelope.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final ExceptionResponseBuilder exceptionBuilder;

    public ApiExceptionHandler(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(FactNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(FactNotFoundException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, UnsupportedConflictStrategyException.class})
    public ResponseEntity<ApiErrorResponse> handleBadRequest(RuntimeException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiErrorResponse.error("Request validation failed", details));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiErrorResponse> handleUnreadableRequest(Exception e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request", e);
    }

    @ExceptionHandler(FactPersistenceException.class)
    public ResponseEntity<ApiErrorResponse> handlePersistenceFailure(FactPersistenceException e) {
        log.error("Fact persistence failed", e);
        return exceptionBuilder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to persist facts", e);
    }
}
