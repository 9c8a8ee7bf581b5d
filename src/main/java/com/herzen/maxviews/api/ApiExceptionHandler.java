package com.herzen.maxviews.api;

import com.herzen.maxviews.availability.AvailabilityFormatException;
import com.herzen.maxviews.domain.ModuleNotFoundException;
import com.herzen.maxviews.overrides.InvalidOverrideException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ModuleNotFoundException.class)
    public ResponseEntity<ApiError> handleModuleNotFound(ModuleNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(InvalidOverrideException.class)
    public ResponseEntity<ApiError> handleInvalidOverride(InvalidOverrideException ex) {
        return ResponseEntity.badRequest().body(new ApiError("INVALID_OVERRIDE", ex.getMessage()));
    }

    @ExceptionHandler(AvailabilityFormatException.class)
    public ResponseEntity<ApiError> handleMalformedAvailability(AvailabilityFormatException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ApiError("MALFORMED_AVAILABILITY", ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleDataAccess(DataAccessException ex) {
        log.warn("Data access failed", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError("DATA_ACCESS", "Views could not be computed"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("INTERNAL_ERROR", "Internal server error"));
    }

    public record ApiError(String code, String message) {}
}
