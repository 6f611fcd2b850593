package dev.jobtracker.api;

import dev.jobtracker.service.DuplicateSourceException;
import dev.jobtracker.service.PipelineAlreadyRunningException;
import dev.jobtracker.service.SourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class TrackerExceptionHandler {

    @ExceptionHandler(PipelineAlreadyRunningException.class)
    public ResponseEntity<Map<String, String>> handleAlreadyRunning(PipelineAlreadyRunningException ex) {
        return error(HttpStatus.CONFLICT, "already_running", ex.getMessage());
    }

    @ExceptionHandler(DuplicateSourceException.class)
    public ResponseEntity<Map<String, String>> handleDuplicateSource(DuplicateSourceException ex) {
        return error(HttpStatus.CONFLICT, "duplicate_source", ex.getMessage());
    }

    /**
     * Unique constraint hit by a concurrent write, e.g. two adds of the same URL racing past the
     * duplicate check.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, String>> handleConstraintViolation(DataIntegrityViolationException ex) {
        log.warn("Write rejected by a database constraint: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.CONFLICT, "conflict", "Request conflicts with stored data");
    }

    @ExceptionHandler(SourceNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(SourceNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "source_not_found", ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, String>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "invalid_request", message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, String>> handleInput(ServerWebInputException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", code, "message", message != null ? message : status.getReasonPhrase()));
    }
}
