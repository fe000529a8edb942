package com.flagship.invoice_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.ledger.InvoiceItemDraft;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One invoice line. Omit {@code product_id} for an ad-hoc line.
 */
@Value
public class InvoiceItemRequest {

    @JsonProperty("product_id")
    Long productId;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", message = "Quantity must not be negative")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @DecimalMin(value = "0", message = "Unit price must not be negative")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @DecimalMin(value = "0", message = "Discount must be between 0 and 100")
    @DecimalMax(value = "100", message = "Discount must be between 0 and 100")
    @JsonProperty("discount")
    BigDecimal discount;

    @DecimalMin(value = "0", message = "Line total must not be negative")
    @JsonProperty("line_total")
    BigDecimal lineTotal;

    public InvoiceItemDraft toDraft() {
        return InvoiceItemDraft.builder()
            .productId(productId)
            .description(description)
            .quantity(quantity)
            .unitPrice(unitPrice)
            .discountPercent(discount)
            .lineTotal(lineTotal)
            .build();
    }
}
