package com.flagship.invoice_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.catalog.ProductDraft;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ProductRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @DecimalMin(value = "0", message = "Unit price must not be negative")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @DecimalMin(value = "0", message = "Cost price must not be negative")
    @JsonProperty("cost_price")
    BigDecimal costPrice;

    @DecimalMin(value = "0", message = "Sale price must not be negative")
    @JsonProperty("sale_price")
    BigDecimal salePrice;

    @Min(value = 0, message = "Stock must not be negative")
    @JsonProperty("stock")
    Integer stock;

    @JsonProperty("unit")
    String unit;

    public ProductDraft toDraft() {
        return ProductDraft.builder()
            .name(name)
            .description(description)
            .unitPrice(unitPrice)
            .costPrice(costPrice)
            .salePrice(salePrice)
            .stock(stock)
            .unit(unit)
            .build();
    }
}
