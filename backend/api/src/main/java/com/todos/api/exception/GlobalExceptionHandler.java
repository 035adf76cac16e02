package com.todos.api.exception;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Backstop for anything that escapes the controllers. Every body has the
 * {@code {"error": "..."}} shape used by the todo endpoints.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(
        HttpMessageNotReadableException ex
    ) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return errorBody(HttpStatus.BAD_REQUEST, "Request body is not valid JSON");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(
        Exception ex
    ) {
        // Framework errors (405, 415, unknown path) already know their status
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
            return errorBody(status, describe(ex));
        }

        log.error("Unexpected exception occurred: {}", ex.getMessage(), ex);
        return errorBody(HttpStatus.INTERNAL_SERVER_ERROR, describe(ex));
    }

    private static String describe(Exception ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private ResponseEntity<Map<String, Object>> errorBody(
        HttpStatusCode status,
        String message
    ) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
