package com.quantops.worker.web;

import com.quantops.core.exception.ArtifactValidationException;
import com.quantops.core.exception.InvalidStateTransitionException;
import com.quantops.core.exception.NoWorkerAvailableException;
import com.quantops.core.exception.NotFoundException;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.exception.OptimisticLockException;
import com.quantops.core.exception.QuantOpsException;
import com.quantops.core.exception.WorkerDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Renders errors of the worker and orchestrator HTTP surfaces as
 * {@code {error_code, message}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(NotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({
        OperationConflictException.class,
        InvalidStateTransitionException.class,
        OptimisticLockException.class
    })
    public ResponseEntity<Map<String, String>> handleConflict(QuantOpsException e) {
        log.debug("Conflict: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(ArtifactValidationException.class)
    public ResponseEntity<Map<String, String>> handleArtifactValidation(ArtifactValidationException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(NoWorkerAvailableException.class)
    public ResponseEntity<Map<String, String>> handleNoWorker(NoWorkerAvailableException e) {
        log.warn("{}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(WorkerDispatchException.class)
    public ResponseEntity<Map<String, String>> handleDispatch(WorkerDispatchException e) {
        log.warn("{}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(body(INVALID_REQUEST, e instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(QuantOpsException.class)
    public ResponseEntity<Map<String, String>> handleOther(QuantOpsException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(RuntimeException e) {
        log.error("Unexpected error", e);
        return ResponseEntity.internalServerError().body(body(INTERNAL_ERROR, "Internal error"));
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, QuantOpsException e) {
        return ResponseEntity.status(status).body(body(e.getErrorCode(), e.getMessage()));
    }

    private static Map<String, String> body(String errorCode, String message) {
        return Map.of("error_code", errorCode, "message", message != null ? message : "");
    }
}
