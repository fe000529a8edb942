package com.flagship.invoice_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Header fields supplied on create and update.
 *
 * The total is computed by the caller; the ledger stores it as given.
 */
@Value
@Builder
public class InvoiceHeader {

    public static final String DEFAULT_STATUS = "Draft";

    String invoiceNumber;
    Long customerId;
    LocalDate invoiceDate;
    LocalDate dueDate;
    BigDecimal totalAmount;
    String status;
}
