package com.flagship.invoice_ledger.credentials.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ChangePasswordRequest {

    @NotBlank(message = "Username is required")
    @JsonProperty("username")
    String username;

    @NotBlank(message = "Current password is required")
    @JsonProperty("current_password")
    String currentPassword;

    @NotBlank(message = "License key is required")
    @JsonProperty("license_key")
    String licenseKey;

    @NotBlank(message = "New password is required")
    @JsonProperty("new_password")
    String newPassword;
}
