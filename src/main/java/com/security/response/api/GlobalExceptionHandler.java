package com.security.response.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine errors to JSON {@code {error, message}} bodies and status codes.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (first, second) -> first));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", errors));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "BAD_REQUEST", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(InsufficientEvidenceException.class)
    public ResponseEntity<Map<String, String>> handleInsufficientEvidence(InsufficientEvidenceException ex) {
        return ResponseEntity
                .status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("error", "INSUFFICIENT_EVIDENCE", "message", ex.getMessage(),
                        "target", String.valueOf(ex.getTarget())));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, String>> handleInvalidTransition(InvalidTransitionException ex) {
        log.info("Rejected transition: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(Map.of("error", "INVALID_TRANSITION", "message", ex.getMessage(),
                        "currentStatus", String.valueOf(ex.getActualStatus()),
                        "requestedStatus", String.valueOf(ex.getRequestedStatus())));
    }

    @ExceptionHandler(ExecutionFailureException.class)
    public ResponseEntity<Map<String, Object>> handleExecutionFailure(ExecutionFailureException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", ex.isTimeout() ? "EXECUTION_TIMEOUT" : "EXECUTION_FAILED",
                        "message", ex.getMessage(),
                        "proposalId", String.valueOf(ex.getProposalId()),
                        "timeout", ex.isTimeout()));
    }

    @ExceptionHandler(DuplicateTargetException.class)
    public ResponseEntity<Map<String, String>> handleDuplicateTarget(DuplicateTargetException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(Map.of("error", "DUPLICATE_TARGET", "message", ex.getMessage(),
                        "existingProposalId", ex.getExistingProposalId()));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfiguration(ConfigurationException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "CONFIGURATION_ERROR", "message", ex.getMessage()));
    }

    @ExceptionHandler(ProposalNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ProposalNotFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "NOT_FOUND", "message", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", getMessageOrCause(ex)));
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
