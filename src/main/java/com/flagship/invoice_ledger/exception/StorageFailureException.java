package com.flagship.invoice_ledger.exception;

import lombok.Getter;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * The underlying store refused or failed a write: an I/O problem, a constraint
 * violation such as a duplicate invoice number, or a failed migration.
 */
@Getter
public class StorageFailureException extends LedgerException {

    private final boolean constraintViolation;

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
        this.constraintViolation = cause instanceof DataIntegrityViolationException;
    }

    public static StorageFailureException wrap(String operation, DataAccessException cause) {
        String reason = cause.getMostSpecificCause().getMessage();
        return new StorageFailureException(operation + " failed: " + reason, cause);
    }
}
