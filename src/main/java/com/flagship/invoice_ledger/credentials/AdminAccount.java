package com.flagship.invoice_ledger.credentials;

import lombok.Value;

/**
 * Administrator as shown to the UI. Never carries the hash.
 */
@Value
public class AdminAccount {
    long id;
    String username;
    String licenseKey;
    boolean active;

    static AdminAccount from(AdminUserEntity entity) {
        return new AdminAccount(entity.getId(), entity.getUsername(), entity.getLicenseKey(), entity.isActive());
    }
}
