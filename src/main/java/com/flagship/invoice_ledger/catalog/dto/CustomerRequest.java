package com.flagship.invoice_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.catalog.CustomerDraft;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CustomerRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    @JsonProperty("name")
    String name;

    @Email(message = "Email must be a valid address")
    @JsonProperty("email")
    String email;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("address")
    String address;

    @JsonProperty("tax_number")
    String taxNumber;

    public CustomerDraft toDraft() {
        return CustomerDraft.builder()
            .name(name)
            .email(email)
            .phone(phone)
            .address(address)
            .taxNumber(taxNumber)
            .build();
    }
}
