package com.platform.driftengine.controller;

import com.platform.driftengine.domain.ConfigIssue;
import com.platform.driftengine.dto.Dtos.ApiError;
import com.platform.driftengine.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<ApiError> handleConfig(ConfigException ex) {
        log.warn("Rejected drift config: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), ex.getIssues());
    }

    @ExceptionHandler(InsufficientReferenceDataException.class)
    public ResponseEntity<ApiError> handleInsufficientReference(InsufficientReferenceDataException ex) {
        log.warn("Insufficient reference data: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(DataFetchException.class)
    public ResponseEntity<ApiError> handleFetch(DataFetchException ex) {
        log.warn("Data fetch failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex.getErrorCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(BaselineNotFoundException.class)
    public ResponseEntity<ApiError> handleBaselineNotFound(BaselineNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), null);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null);
    }

    @ExceptionHandler(DriftEngineException.class)
    public ResponseEntity<ApiError> handleEngine(DriftEngineException ex) {
        log.error("Drift engine error [{}]", ex.getErrorCode(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", null);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message,
                                                  List<ConfigIssue> issues) {
        return ResponseEntity.status(status)
                .body(new ApiError(status.value(), code, message, issues, Instant.now()));
    }
}
