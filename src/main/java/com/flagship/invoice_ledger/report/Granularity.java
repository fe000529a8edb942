package com.flagship.invoice_ledger.report;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Time bucket size for income reports.
 */
public enum Granularity {
    DAILY("yyyy-MM-dd"),
    MONTHLY("yyyy-MM"),
    YEARLY("yyyy");

    private final DateTimeFormatter formatter;

    Granularity(String pattern) {
        this.formatter = DateTimeFormatter.ofPattern(pattern);
    }

    public String bucketOf(LocalDate date) {
        return date.format(formatter);
    }
}
