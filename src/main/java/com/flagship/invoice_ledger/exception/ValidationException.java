package com.flagship.invoice_ledger.exception;

/**
 * Input was rejected before anything was written.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message);
    }
}
