package com.flagship.invoice_ledger.settings;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Application-wide configuration: company display fields and user preferences.
 *
 * Exactly one instance is live at a time; {@link SettingsService} loads it at
 * startup and swaps it on save.
 */
@Value
@Builder(toBuilder = true)
public class Settings {

    public static final String DEFAULT_CURRENCY = "USD";
    public static final String DEFAULT_THEME = "dark";
    public static final String DEFAULT_LANGUAGE = "en";

    String companyName;
    String companyPhone;
    String companyAddress;
    String defaultCurrency;
    String theme;
    String language;
    BigDecimal maxDiscountPercent;

    public static Settings defaults() {
        return Settings.builder()
            .companyName("")
            .companyPhone("")
            .companyAddress("")
            .defaultCurrency(DEFAULT_CURRENCY)
            .theme(DEFAULT_THEME)
            .language(DEFAULT_LANGUAGE)
            .maxDiscountPercent(new BigDecimal("0.00"))
            .build();
    }

    /**
     * @return true when a discount cap is configured; zero means uncapped
     */
    public boolean hasDiscountCap() {
        return maxDiscountPercent != null && maxDiscountPercent.signum() > 0;
    }
}
