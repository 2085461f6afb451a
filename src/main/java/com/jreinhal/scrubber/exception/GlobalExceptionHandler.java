package com.jreinhal.scrubber.exception;

import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to HTTP statuses. Messages returned to clients are sanitized;
 * the full message stays in the server log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        return error(HttpStatus.BAD_REQUEST, sanitizeExceptionMessage(ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(ReceiptNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ReceiptNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "Receipt not found");
    }

    @ExceptionHandler(ReceiptConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ReceiptConflictException ex) {
        log.error("Receipt conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "Receipt already exists");
    }

    @ExceptionHandler(PolicyConfigException.class)
    public ResponseEntity<Map<String, Object>> handlePolicy(PolicyConfigException ex) {
        log.error("Policy configuration error: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Policy configuration unavailable for requested tier");
    }

    @ExceptionHandler(EncryptionUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleEncryption(EncryptionUnavailableException ex) {
        log.error("Receipt encryption unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Receipt encryption unavailable");
    }

    @ExceptionHandler(ChainIntegrityException.class)
    public ResponseEntity<Map<String, Object>> handleChainIntegrity(ChainIntegrityException ex) {
        log.error("Audit chain integrity failure at position {}: {}", ex.getPosition(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Audit ledger integrity hold");
    }

    @ExceptionHandler(ScrubFailedException.class)
    public ResponseEntity<Map<String, Object>> handleScrubFailed(ScrubFailedException ex) {
        log.error("Scrub failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Scrub failed");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, sanitizeExceptionMessage(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    static String sanitizeExceptionMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Invalid request";
        }
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return "Invalid request";
        }
        return message;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message, "timestamp", Instant.now().toString()));
    }
}
