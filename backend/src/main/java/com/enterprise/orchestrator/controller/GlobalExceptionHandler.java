package com.enterprise.orchestrator.controller;

import com.enterprise.orchestrator.core.exception.AlreadyExistsException;
import com.enterprise.orchestrator.core.exception.BlobUnavailableException;
import com.enterprise.orchestrator.core.exception.DocumentNotFoundException;
import com.enterprise.orchestrator.core.exception.OrchestratorException;
import com.enterprise.orchestrator.core.exception.StoreUnavailableException;
import com.enterprise.orchestrator.service.ResultNotAvailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({DocumentNotFoundException.class, ResultNotAvailableException.class})
    public ResponseEntity<Map<String, String>> handleNotFound(OrchestratorException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({IllegalStateException.class, AlreadyExistsException.class})
    public ResponseEntity<Map<String, String>> handleConflict(RuntimeException e) {
        log.warn("Request conflicts with current state: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleTooLarge(MaxUploadSizeExceededException e) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "File exceeds the maximum upload size");
    }

    @ExceptionHandler({StoreUnavailableException.class, BlobUnavailableException.class})
    public ResponseEntity<Map<String, String>> handleUnavailable(OrchestratorException e) {
        log.error("Backing store unavailable", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<Map<String, String>> handleOrchestrator(OrchestratorException e) {
        log.error("Request failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
