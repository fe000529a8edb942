package com.flagship.invoice_ledger.exception;

public class ProductNotFoundException extends NotFoundException {

    public ProductNotFoundException(long id) {
        super("Product", id);
    }
}
