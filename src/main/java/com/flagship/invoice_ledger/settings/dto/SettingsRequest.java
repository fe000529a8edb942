package com.flagship.invoice_ledger.settings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.settings.Settings;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class SettingsRequest {

    @JsonProperty("company_name")
    String companyName;

    @JsonProperty("company_phone")
    String companyPhone;

    @JsonProperty("company_address")
    String companyAddress;

    @JsonProperty("default_currency")
    String defaultCurrency;

    @JsonProperty("theme")
    String theme;

    @JsonProperty("language")
    String language;

    @DecimalMin(value = "0", message = "Maximum discount must be between 0 and 100")
    @DecimalMax(value = "100", message = "Maximum discount must be between 0 and 100")
    @JsonProperty("max_discount")
    BigDecimal maxDiscount;

    public Settings toSettings() {
        return Settings.builder()
            .companyName(companyName)
            .companyPhone(companyPhone)
            .companyAddress(companyAddress)
            .defaultCurrency(defaultCurrency)
            .theme(theme)
            .language(language)
            .maxDiscountPercent(maxDiscount)
            .build();
    }
}
