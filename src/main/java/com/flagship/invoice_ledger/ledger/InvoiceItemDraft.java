package com.flagship.invoice_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of an invoice as supplied by the caller.
 *
 * A null {@code productId} marks an ad-hoc line that does not touch stock.
 * When {@code lineTotal} is absent it is quantity times unit price; any
 * discount has to be applied by the caller before passing a total.
 */
@Value
@Builder
public class InvoiceItemDraft {
    Long productId;
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal discountPercent;
    BigDecimal lineTotal;

    public boolean isStocked() {
        return productId != null;
    }

    BigDecimal effectiveLineTotal() {
        if (lineTotal != null) {
            return lineTotal;
        }
        return quantityOrZero().multiply(unitPriceOrZero());
    }

    BigDecimal quantityOrZero() {
        return quantity != null ? quantity : BigDecimal.ZERO;
    }

    BigDecimal unitPriceOrZero() {
        return unitPrice != null ? unitPrice : BigDecimal.ZERO;
    }

    BigDecimal discountOrZero() {
        return discountPercent != null ? discountPercent : BigDecimal.ZERO;
    }
}
