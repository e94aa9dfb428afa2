package com.flagship.fund_ledger.ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger outcomes to HTTP responses.
 *
 * Business errors are expected and logged at WARN. Inconsistencies and unknown
 * failures are logged at ERROR with the stack trace.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "MISSING_HEADER",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Request validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request", null);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleLedgerValidation(ValidationException e) {
        log.warn("Rejected intent: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.warn("Lookup failed: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException e) {
        log.warn("Insufficient funds: requested={}, available={}", e.getRequested(), e.getAvailable());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("requested", e.getRequested().toString());
        details.put("available", e.getAvailable().toString());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorCode(), e.getMessage(), details);
    }

    @ExceptionHandler(AllocationMismatchException.class)
    public ResponseEntity<ErrorResponse> handleAllocationMismatch(AllocationMismatchException e) {
        log.warn("Allocation mismatch: allocated={}, expected={}", e.getAllocated(), e.getExpected());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("allocated", e.getAllocated().toString());
        details.put("expected", e.getExpected().toString());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorCode(), e.getMessage(), details);
    }

    @ExceptionHandler(ConcurrentBalanceModificationException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentModification(ConcurrentBalanceModificationException e) {
        log.warn("Lost balance race on account {}", e.getAccountId());
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage(),
                Map.of("retryable", "true"));
    }

    /**
     * Deadlock victims and lock timeouts on account rows. Nothing was committed.
     */
    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleLockFailure(PessimisticLockingFailureException e) {
        log.warn("Lost account lock: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "CONCURRENT_MODIFICATION",
                "Accounts were locked by a concurrent operation, retry the operation",
                Map.of("retryable", "true"));
    }

    @ExceptionHandler(InconsistentLedgerException.class)
    public ResponseEntity<ErrorResponse> handleInconsistent(InconsistentLedgerException e) {
        log.error("Ledger invariant violated", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(),
                "Ledger state is inconsistent, the operation was aborted", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
