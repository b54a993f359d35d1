package com.cbcluster.orchestrator.exception;

import com.cbcluster.common.exception.TopologyValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownResourceException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownResource(UnknownResourceException e) {
        log.debug("Unknown resource: {}", e.getMessage());
        return errorResponse(HttpStatus.NOT_FOUND, "Not Found", e.getMessage());
    }

    @ExceptionHandler({TopologyValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(RuntimeException e) {
        log.warn("Invalid request: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException e) {
        log.warn("Conflicting request: {}", e.getMessage());
        return errorResponse(HttpStatus.CONFLICT, "Conflict", e.getMessage());
    }

    @ExceptionHandler(ManagementApiException.class)
    public ResponseEntity<Map<String, Object>> handleManagementApiException(ManagementApiException e) {
        log.error("Management API error: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.BAD_GATEWAY, "Management API Error", e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleRuntimeException(RuntimeException e) {
        log.error("Runtime error: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error, String message) {
        Map<String, Object> body = Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message == null ? "" : message
        );
        return ResponseEntity.status(status).body(body);
    }
}
