package com.automaker.dispatch.api;

import com.automaker.core.model.AutoModeAlreadyRunningException;
import com.automaker.core.model.FeatureAlreadyRunningException;
import com.automaker.core.model.FeatureNotFoundException;
import com.automaker.core.model.InvalidTransitionException;
import com.automaker.core.provider.ProviderConfigurationException;
import com.automaker.core.worktree.WorktreeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to {@code {success:false, error}} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({FeatureAlreadyRunningException.class, AutoModeAlreadyRunningException.class,
            InvalidTransitionException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(RuntimeException ex) {
        log.info("Rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorBody(ex.getMessage(), null));
    }

    @ExceptionHandler(FeatureNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(FeatureNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody(ex.getMessage(), null));
    }

    @ExceptionHandler(ProviderConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleProviderConfiguration(ProviderConfigurationException ex) {
        log.warn("Provider configuration error: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(errorBody(ex.getMessage(), ex.getErrorType()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(errorBody(ex.getMessage(), null));
    }

    @ExceptionHandler(WorktreeException.class)
    public ResponseEntity<Map<String, Object>> handleWorktree(WorktreeException ex) {
        log.error("Git operation failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorBody(ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("An unexpected error occurred", null));
    }

    static Map<String, Object> errorBody(String message, String errorType) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message != null ? message : "Unknown error");
        if (errorType != null) {
            body.put("errorType", errorType);
        }
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
