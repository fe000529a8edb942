package com.flagship.invoice_ledger.exception;

import lombok.Getter;

import java.util.Map;

/**
 * An operation named an identifier that does not exist.
 */
@Getter
public class NotFoundException extends LedgerException {

    private final String entity;
    private final long id;

    public NotFoundException(String entity, long id) {
        super(entity + " not found: " + id);
        this.entity = entity;
        this.id = id;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("entity", entity, "id", String.valueOf(id));
    }
}
