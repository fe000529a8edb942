package com.flagship.invoice_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A persisted invoice line. {@code productId} is null for ad-hoc lines.
 */
@Value
public class InvoiceItem {
    long id;
    long invoiceId;
    Long productId;
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal discount;
    BigDecimal lineTotal;
}
