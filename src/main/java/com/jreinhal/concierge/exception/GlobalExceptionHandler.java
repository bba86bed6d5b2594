package com.jreinhal.concierge.exception;

import com.jreinhal.concierge.hitl.AlreadyClaimedException;
import com.jreinhal.concierge.hitl.InvalidRequestStateException;
import com.jreinhal.concierge.hitl.NotAssigneeException;
import com.jreinhal.concierge.hitl.RequestExpiredException;
import com.jreinhal.concierge.playbook.PlaybookNotActiveException;
import com.jreinhal.concierge.tenant.QuotaExceededException;
import com.jreinhal.concierge.tenant.TenantMismatchException;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, ex.getMessage(), ex.getReason());
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Tenant mismatch: {}", ex.getMessage());
        return body(HttpStatus.FORBIDDEN, "Access denied", ex.getReason());
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<Map<String, Object>> handleQuota(QuotaExceededException ex) {
        return body(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), ex.getReason());
    }

    @ExceptionHandler({AlreadyClaimedException.class, NotAssigneeException.class, RequestExpiredException.class,
            InvalidRequestStateException.class, PlaybookNotActiveException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(ConciergeException ex) {
        log.debug("Request conflict ({}): {}", ex.getReason(), ex.getMessage());
        return body(HttpStatus.CONFLICT, ex.getMessage(), ex.getReason());
    }

    @ExceptionHandler(BackingStoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(BackingStoreUnavailableException ex) {
        log.debug("Backing store unavailable: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable", ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", sanitizeExceptionMessage(ex.getMessage()), "timestamp", Instant.now().toString()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Internal server error", "timestamp", Instant.now().toString()));
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, String reason) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message, "reason", reason, "timestamp", Instant.now().toString()));
    }

    static String sanitizeExceptionMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Invalid request";
        }
        // Class names, paths and stack-trace fragments stay server-side
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return "Invalid request";
        }
        return message;
    }
}
