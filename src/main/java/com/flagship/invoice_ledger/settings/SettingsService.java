package com.flagship.invoice_ledger.settings;

import com.flagship.invoice_ledger.exception.StorageFailureException;
import com.flagship.invoice_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;

/**
 * Holds the one live {@link Settings} instance and persists it on save.
 *
 * Key principles:
 * - The row is created with defaults during startup, before anything reads it
 * - Readers get the in-memory instance; no query per read
 * - Saving upserts row {@value #SINGLETON_ID}, so the table never holds more than one row
 */
@Service
@Slf4j
public class SettingsService {

    public static final int SINGLETON_ID = 1;

    static final Set<String> SUPPORTED_THEMES = Set.of("dark", "light");
    static final Set<String> SUPPORTED_LANGUAGES = Set.of("tr", "en", "id", "ar");

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int DISCOUNT_SCALE = 2;

    private final SettingsRepository repository;

    private volatile Settings current;

    public SettingsService(SettingsRepository repository) {
        this.repository = repository;
    }

    /**
     * Loads the settings row into memory, creating it with defaults when the
     * store has none. Safe to call more than once.
     */
    @Transactional
    public Settings initialize() {
        SettingsEntity entity = repository.findById(SINGLETON_ID).orElseGet(() -> {
            log.info("No settings row found, creating defaults");
            return repository.saveAndFlush(SettingsEntity.fromDomain(Settings.defaults()));
        });
        current = entity.toDomain();
        log.debug("Settings loaded: currency={}, theme={}, language={}",
            current.getDefaultCurrency(), current.getTheme(), current.getLanguage());
        return current;
    }

    /**
     * Returns the live settings. Falls back to defaults, without touching the
     * store, if called before {@link #initialize()}.
     */
    public Settings getSettings() {
        Settings settings = current;
        return settings != null ? settings : Settings.defaults();
    }

    /**
     * Validates, persists and publishes new settings.
     *
     * @return the normalized settings now in effect
     * @throws ValidationException if a field is out of range
     * @throws StorageFailureException if the store refuses the row
     */
    @Transactional
    public Settings saveSettings(Settings values) {
        if (values == null) {
            throw new ValidationException("Settings are required");
        }
        Settings normalized = normalize(values);

        SettingsEntity entity = repository.findById(SINGLETON_ID)
            .map(existing -> {
                existing.updateFromDomain(normalized);
                return existing;
            })
            .orElseGet(() -> SettingsEntity.fromDomain(normalized));
        try {
            repository.saveAndFlush(entity);
        } catch (DataAccessException e) {
            throw StorageFailureException.wrap("Save settings", e);
        }

        current = normalized;
        log.info("Settings saved: currency={}, theme={}, language={}, maxDiscount={}",
            normalized.getDefaultCurrency(), normalized.getTheme(), normalized.getLanguage(),
            normalized.getMaxDiscountPercent());
        return normalized;
    }

    /**
     * Re-reads the persisted row, bypassing the in-memory instance.
     */
    @Transactional(readOnly = true)
    public Settings readPersisted() {
        return repository.findById(SINGLETON_ID)
            .map(SettingsEntity::toDomain)
            .orElseGet(Settings::defaults);
    }

    @Transactional(readOnly = true)
    public long rowCount() {
        return repository.count();
    }

    Settings normalize(Settings values) {
        String currency = trimToEmpty(values.getDefaultCurrency()).toUpperCase(Locale.ROOT);
        if (currency.isEmpty()) {
            currency = Settings.DEFAULT_CURRENCY;
        }
        if (!currency.matches("[A-Z]{3}")) {
            throw new ValidationException("Currency must be a 3-letter code: " + values.getDefaultCurrency());
        }

        String theme = values.getTheme() == null ? Settings.DEFAULT_THEME : values.getTheme().trim();
        if (!SUPPORTED_THEMES.contains(theme)) {
            throw new ValidationException("Unsupported theme: " + theme);
        }

        String language = values.getLanguage() == null ? Settings.DEFAULT_LANGUAGE : values.getLanguage().trim();
        if (!SUPPORTED_LANGUAGES.contains(language)) {
            throw new ValidationException("Unsupported language: " + language);
        }

        BigDecimal maxDiscount = values.getMaxDiscountPercent() == null
            ? BigDecimal.ZERO
            : values.getMaxDiscountPercent();
        if (maxDiscount.signum() < 0 || maxDiscount.compareTo(HUNDRED) > 0) {
            throw new ValidationException("Maximum discount must be between 0 and 100: " + maxDiscount);
        }
        if (maxDiscount.stripTrailingZeros().scale() > DISCOUNT_SCALE) {
            throw new ValidationException("Maximum discount allows at most " + DISCOUNT_SCALE
                + " decimal places: " + maxDiscount.toPlainString());
        }

        return Settings.builder()
            .companyName(trimToEmpty(values.getCompanyName()))
            .companyPhone(trimToEmpty(values.getCompanyPhone()))
            .companyAddress(trimToEmpty(values.getCompanyAddress()))
            .defaultCurrency(currency)
            .theme(theme)
            .language(language)
            .maxDiscountPercent(maxDiscount.setScale(DISCOUNT_SCALE, RoundingMode.UNNECESSARY))
            .build();
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
