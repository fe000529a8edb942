package com.flagship.invoice_ledger.exception;

import java.util.Map;

/**
 * Root of every failure the engine reports to its caller.
 *
 * All subclasses are recoverable from the caller's point of view: the
 * operation that raised them left persisted state exactly as it found it.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Structured context for the UI, e.g. which product ran out of stock.
     */
    public Map<String, String> getDetails() {
        return Map.of();
    }
}
