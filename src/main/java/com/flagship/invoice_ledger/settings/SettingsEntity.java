package com.flagship.invoice_ledger.settings;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Row mapping for the singleton settings table.
 *
 * The primary key is always {@link SettingsService#SINGLETON_ID}; a CHECK
 * constraint in the schema rejects any other value.
 */
@Entity
@Table(name = "settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettingsEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Integer id;

    @Column(name = "company_name")
    private String companyName;

    @Column(name = "company_phone")
    private String companyPhone;

    @Column(name = "company_address")
    private String companyAddress;

    @Column(name = "default_currency", nullable = false, length = 3)
    private String defaultCurrency;

    @Column(nullable = false)
    private String theme;

    @Column(nullable = false)
    private String language;

    @Column(name = "max_discount", nullable = false, precision = 9, scale = 4)
    private BigDecimal maxDiscount;

    static SettingsEntity fromDomain(Settings settings) {
        return new SettingsEntity(
            SettingsService.SINGLETON_ID,
            settings.getCompanyName(),
            settings.getCompanyPhone(),
            settings.getCompanyAddress(),
            settings.getDefaultCurrency(),
            settings.getTheme(),
            settings.getLanguage(),
            settings.getMaxDiscountPercent()
        );
    }

    Settings toDomain() {
        return Settings.builder()
            .companyName(nullToEmpty(companyName))
            .companyPhone(nullToEmpty(companyPhone))
            .companyAddress(nullToEmpty(companyAddress))
            .defaultCurrency(defaultCurrency)
            .theme(theme)
            .language(language)
            .maxDiscountPercent(maxDiscount == null
                ? new BigDecimal("0.00")
                : maxDiscount.setScale(2, RoundingMode.HALF_UP))
            .build();
    }

    void updateFromDomain(Settings settings) {
        this.companyName = settings.getCompanyName();
        this.companyPhone = settings.getCompanyPhone();
        this.companyAddress = settings.getCompanyAddress();
        this.defaultCurrency = settings.getDefaultCurrency();
        this.theme = settings.getTheme();
        this.language = settings.getLanguage();
        this.maxDiscount = settings.getMaxDiscountPercent();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
