package com.flagship.invoice_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger failures onto HTTP responses.
 *
 * Validation failures (stock included) are 422 with the structured details,
 * unknown identifiers 404, constraint violations 409 and other storage
 * failures 500. Malformed requests are 400.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(StockInsufficientException.class)
    public ResponseEntity<ApiError> handleStockInsufficient(StockInsufficientException e) {
        log.warn("Stock shortfall: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Stock", e);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        log.warn("Rejected: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getEntity() + " Not Found", e);
    }

    @ExceptionHandler(StorageFailureException.class)
    public ResponseEntity<ApiError> handleStorageFailure(StorageFailureException e) {
        if (e.isConstraintViolation()) {
            log.warn("Constraint violation: {}", e.getMessage());
            return respond(HttpStatus.CONFLICT, "Conflict", e);
        }
        log.error("Storage failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Failure", e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException e) {
        log.warn("Request validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ApiError error = ApiError.builder()
            .error("Invalid Request")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error("Invalid Request")
            .message("Malformed request")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String title, LedgerException e) {
        ApiError error = ApiError.builder()
            .error(title)
            .message(e.getMessage())
            .details(e.getDetails())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
    }
}
