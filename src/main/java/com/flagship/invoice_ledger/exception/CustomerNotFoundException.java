package com.flagship.invoice_ledger.exception;

public class CustomerNotFoundException extends NotFoundException {

    public CustomerNotFoundException(long id) {
        super("Customer", id);
    }
}
