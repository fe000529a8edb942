package com.flagship.invoice_ledger.bootstrap;

import com.flagship.invoice_ledger.credentials.CredentialService;
import com.flagship.invoice_ledger.schema.SchemaStore;
import com.flagship.invoice_ledger.settings.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Brings a freshly migrated store to its initialized state: the settings row
 * exists and is loaded, and at least one administrator exists.
 *
 * Runs once all singletons are created, so migrations have already been
 * applied. Any failure here aborts startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreInitializer implements SmartInitializingSingleton {

    private final SchemaStore schemaStore;
    private final SettingsService settingsService;
    private final CredentialService credentialService;

    @Override
    public void afterSingletonsInstantiated() {
        settingsService.initialize();
        boolean seeded = credentialService.seedDefaultAdmin();
        log.info("Store ready: schema version {}, default admin seeded: {}", schemaStore.currentVersion(), seeded);
    }
}
