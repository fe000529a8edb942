package com.flagship.invoice_ledger.catalog;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Mutable product fields as supplied by the caller on create and update.
 *
 * When both prices are given the sale price wins; when only the unit price is
 * given it becomes the sale price too.
 */
@Value
@Builder
public class ProductDraft {
    String name;
    String description;
    BigDecimal unitPrice;
    BigDecimal costPrice;
    BigDecimal salePrice;
    Integer stock;
    String unit;

    BigDecimal effectiveSalePrice() {
        if (salePrice != null) {
            return salePrice;
        }
        return unitPrice != null ? unitPrice : BigDecimal.ZERO;
    }
}
