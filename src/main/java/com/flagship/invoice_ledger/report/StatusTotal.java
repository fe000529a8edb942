package com.flagship.invoice_ledger.report;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class StatusTotal {
    String status;
    long invoiceCount;
    BigDecimal amount;
}
