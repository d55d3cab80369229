package com.cx.anomaly.controller;

import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps {@link DetectorException} kinds to HTTP statuses: caller mistakes are 400, an empty or
 * incomplete registry is 503, everything else is 500.
 */
@RestControllerAdvice
public class DetectorExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(DetectorExceptionHandler.class);

    @ExceptionHandler(DetectorException.class)
    public ResponseEntity<Map<String, String>> handleDetectorException(DetectorException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", e.getKind(), e.getMessage());
        } else {
            log.warn("Rejected request ({}): {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(Map.of("error", e.getMessage(), "kind", e.getKind().name()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Rejected unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(Map.of("error", "Malformed request body", "kind", ErrorKind.SCHEMA.name()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        if (kind.isClientError()) {
            return HttpStatus.BAD_REQUEST;
        }
        return switch (kind) {
            case NOT_LOADED, MODEL_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
