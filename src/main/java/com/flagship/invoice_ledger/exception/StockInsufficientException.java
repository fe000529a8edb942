package com.flagship.invoice_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A product does not hold enough stock for the quantity an invoice asks for.
 */
@Getter
public class StockInsufficientException extends ValidationException {

    private final long productId;
    private final String productName;
    private final int available;
    private final BigDecimal requested;

    public StockInsufficientException(long productId, String productName, int available, BigDecimal requested) {
        super(String.format("Insufficient stock for %s: available %d, requested %s",
            productName, available, requested.stripTrailingZeros().toPlainString()));
        this.productId = productId;
        this.productName = productName;
        this.available = available;
        this.requested = requested;
    }

    @Override
    public Map<String, String> getDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("productId", String.valueOf(productId));
        details.put("product", productName);
        details.put("available", String.valueOf(available));
        details.put("requested", requested.stripTrailingZeros().toPlainString());
        return details;
    }
}
