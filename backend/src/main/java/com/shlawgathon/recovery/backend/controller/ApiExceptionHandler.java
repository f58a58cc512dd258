package com.shlawgathon.recovery.backend.controller;

import com.shlawgathon.recovery.backend.recovery.FailureNotFoundException;
import com.shlawgathon.recovery.backend.recovery.RecoveryInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(FailureNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(FailureNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(RecoveryInProgressException.class)
    public ResponseEntity<Map<String, String>> handleConflict(RecoveryInProgressException ex) {
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, String>> handleStorage(DataAccessException ex) {
        log.error("[API] Storage unavailable", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", status.getReasonPhrase(), "message", message != null ? message : ""));
    }
}
