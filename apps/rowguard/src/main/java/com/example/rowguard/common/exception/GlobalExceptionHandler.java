package com.example.rowguard.common.exception;

import com.example.rowguard.authz.exception.AccessDeniedException;
import com.example.rowguard.common.util.StringSanitizer;
import com.example.rowguard.security.exception.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.Map;

/**
 * Maps access control and storage failures of controllers built on this library to error
 * responses that do not leak policy or query details.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;

    @ExceptionHandler(AccessDeniedException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAccessDenied(@NonNull AccessDeniedException ex) {
        LOG.warn("Access denied: principal={}, resource={}",
                StringSanitizer.forLog(ex.getPrincipal()),
                StringSanitizer.forLog(ex.getResource(), MAX_LOG_MESSAGE_LENGTH));
        return error(HttpStatus.FORBIDDEN, "access_denied", "Access denied");
    }

    @ExceptionHandler(AuthenticationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAuthentication(@NonNull AuthenticationException ex) {
        LOG.warn("Authentication failed: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return error(HttpStatus.UNAUTHORIZED, "unauthenticated", "Authentication required");
    }

    /**
     * Handles malformed request body or type conversion errors.
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInputException(@NonNull ServerWebInputException ex) {
        LOG.warn("Input error: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return error(HttpStatus.BAD_REQUEST, "invalid_request", "Invalid request format");
    }

    /**
     * Handles caller errors such as a missing where clause or an unknown sort direction.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(@NonNull IllegalArgumentException ex) {
        LOG.warn("Illegal argument: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", "Invalid request parameter");
    }

    @ExceptionHandler(DataAccessException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleDataAccess(@NonNull DataAccessException ex) {
        LOG.error("Storage error: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "storage_error", "An unexpected error occurred");
    }

    /**
     * Handles all unhandled exceptions.
     */
    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred");
    }

    @NonNull
    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", code,
                        "message", message,
                        "timestamp", Instant.now().toString()
                ));
    }
}
