package com.flagship.invoice_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.ledger.InvoiceHeader;
import com.flagship.invoice_ledger.ledger.InvoiceItemDraft;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO for creating or replacing an invoice.
 */
@Value
public class InvoiceRequest {

    @NotBlank(message = "Invoice number is required")
    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("customer_id")
    Long customerId;

    @JsonProperty("invoice_date")
    LocalDate invoiceDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @DecimalMin(value = "0", message = "Total must not be negative")
    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("status")
    String status;

    @Valid
    @JsonProperty("items")
    List<InvoiceItemRequest> items;

    public InvoiceHeader toHeader() {
        return InvoiceHeader.builder()
            .invoiceNumber(invoiceNumber)
            .customerId(customerId)
            .invoiceDate(invoiceDate)
            .dueDate(dueDate)
            .totalAmount(totalAmount)
            .status(status)
            .build();
    }

    public List<InvoiceItemDraft> toItemDrafts() {
        if (items == null) {
            return List.of();
        }
        return items.stream().map(InvoiceItemRequest::toDraft).toList();
    }
}
