package com.flagship.invoice_ledger.report;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Income for one period.
 *
 * {@code net} is gross minus the cost of stocked goods sold minus discounts.
 */
@Value
public class IncomeBucket {
    String period;
    BigDecimal gross;
    BigDecimal net;
}
