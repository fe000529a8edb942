package com.flagship.invoice_ledger.report;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Dashboard headline figures.
 */
@Value
public class TotalsSummary {
    long customerCount;
    long invoiceCount;
    BigDecimal revenue;
    List<StatusTotal> revenueByStatus;
}
