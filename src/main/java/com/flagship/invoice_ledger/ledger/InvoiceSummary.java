package com.flagship.invoice_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Invoice list row with the customer's name resolved.
 */
@Value
public class InvoiceSummary {
    long id;
    String invoiceNumber;
    Long customerId;
    String customerName;
    LocalDate invoiceDate;
    LocalDate dueDate;
    BigDecimal totalAmount;
    String status;
}
