package com.flagship.invoice_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A persisted invoice header.
 */
@Value
public class Invoice {
    long id;
    String invoiceNumber;
    Long customerId;
    LocalDate invoiceDate;
    LocalDate dueDate;
    BigDecimal totalAmount;
    String status;
    LocalDateTime createdAt;
}
