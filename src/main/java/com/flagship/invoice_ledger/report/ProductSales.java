package com.flagship.invoice_ledger.report;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class ProductSales {
    String productName;
    BigDecimal quantity;
    BigDecimal revenue;
}
