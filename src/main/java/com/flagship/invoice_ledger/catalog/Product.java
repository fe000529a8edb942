package com.flagship.invoice_ledger.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A sellable product or service.
 *
 * {@code unitPrice} mirrors {@code salePrice}; older stores only had the
 * former. {@code stock} never drops below zero.
 */
@Value
public class Product {
    long id;
    String name;
    String description;
    BigDecimal unitPrice;
    BigDecimal costPrice;
    BigDecimal salePrice;
    int stock;
    String unit;
    LocalDateTime createdAt;
}
