package com.tazifor.elevations.controller;

import com.tazifor.elevations.model.RequestError;
import com.tazifor.elevations.service.ElevationStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps failures that escape the engine to HTTP responses.
 *
 * Unreadable bodies (wrong JSON types, non-numeric coordinates) are caller
 * errors and share the MALFORMED_REQUEST kind with the engine's own checks.
 */
@Slf4j
@RestControllerAdvice
public class ElevationExceptionHandler {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadableBody(HttpMessageNotReadableException e) {
        log.debug("Unreadable elevation request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
            "error", RequestError.Kind.MALFORMED_REQUEST.name(),
            "message", "Request body is not a valid elevation request: " + e.getMostSpecificCause().getMessage()
        ));
    }

    @ExceptionHandler(ElevationStoreException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(ElevationStoreException e) {
        log.error("Elevation store lookup failed", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
            "error", "DEPENDENCY_FAILURE",
            "message", "Elevation store is unavailable, try again later"
        ));
    }
}
