package com.flagship.invoice_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything needed to print an invoice: the header, the customer's display
 * fields and the lines with product names resolved.
 *
 * Customer fields are null when the invoice has no customer.
 */
@Value
@Builder
public class InvoiceDetail {
    Invoice invoice;
    String customerName;
    String customerEmail;
    String customerPhone;
    String customerAddress;
    String customerTaxNumber;
    List<Line> items;

    @Value
    public static class Line {
        long id;
        Long productId;
        String productName;
        String description;
        BigDecimal quantity;
        BigDecimal unitPrice;
        BigDecimal discount;
        BigDecimal lineTotal;
    }
}
