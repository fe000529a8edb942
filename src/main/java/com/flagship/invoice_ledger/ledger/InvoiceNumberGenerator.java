package com.flagship.invoice_ledger.ledger;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Suggests invoice numbers of the form {@code INV-yyyyMMdd-HHmmss}.
 *
 * Suggestions are not reserved; uniqueness is enforced when the invoice is
 * written.
 */
@Component
public class InvoiceNumberGenerator {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Clock clock;

    public InvoiceNumberGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        return "INV-" + LocalDateTime.now(clock).format(FORMAT);
    }
}
