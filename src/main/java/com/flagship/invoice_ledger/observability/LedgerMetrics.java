package com.flagship.invoice_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.invoice.operations: invoice verbs tagged by operation and outcome
 * - ledger.invoice.latency: time per invoice verb, tagged by operation
 * - ledger.stock.rejections: invoice verbs refused for lack of stock
 */
@Component
public class LedgerMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_REJECTED = "rejected";
    public static final String OUTCOME_NOT_FOUND = "not_found";
    public static final String OUTCOME_FAILED = "failed";

    private final MeterRegistry registry;

    private final Counter stockRejections;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.stockRejections = Counter.builder("ledger.stock.rejections")
                .description("Invoice operations rejected because stock was insufficient")
                .register(registry);
    }

    /**
     * Records the outcome of an invoice verb.
     * Uses registry.counter() for meter lookup/creation.
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.invoice.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void incrementStockRejections() {
        stockRejections.increment();
    }

    /**
     * Times an invoice verb.
     */
    public <T> T timeOperation(String operation, Supplier<T> body) {
        Timer timer = Timer.builder("ledger.invoice.latency")
                .description("Time taken by an invoice operation")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        return timer.record(body);
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
