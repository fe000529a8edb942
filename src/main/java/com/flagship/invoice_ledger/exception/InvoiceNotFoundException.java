package com.flagship.invoice_ledger.exception;

public class InvoiceNotFoundException extends NotFoundException {

    public InvoiceNotFoundException(long id) {
        super("Invoice", id);
    }
}
