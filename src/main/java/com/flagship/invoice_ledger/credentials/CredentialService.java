package com.flagship.invoice_ledger.credentials;

import com.flagship.invoice_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Optional;

/**
 * Administrator credential store.
 *
 * Passwords are kept as hex SHA-256 digests. A login succeeds only when the
 * username, the digest of the supplied password and the license key all match
 * an active row.
 */
@Service
@Slf4j
public class CredentialService {

    private final AdminUserRepository repository;
    private final String defaultUsername;
    private final String defaultPassword;
    private final String defaultLicenseKey;

    public CredentialService(AdminUserRepository repository,
                             @Value("${ledger.admin.default-username:admin}") String defaultUsername,
                             @Value("${ledger.admin.default-password:admin}") String defaultPassword,
                             @Value("${ledger.admin.default-license-key:NOURA-DEV-0000-0000}") String defaultLicenseKey) {
        this.repository = repository;
        this.defaultUsername = defaultUsername;
        this.defaultPassword = defaultPassword;
        this.defaultLicenseKey = defaultLicenseKey;
    }

    /**
     * Makes sure at least one active administrator exists. When none does, the
     * configured default administrator is inserted, or reactivated with the
     * default credentials if its row is present but inactive.
     *
     * @return true if a row was inserted or reactivated
     */
    @Transactional
    public boolean seedDefaultAdmin() {
        if (repository.countByActiveTrue() > 0) {
            return false;
        }
        Optional<AdminUserEntity> existing = repository.findByUsername(defaultUsername);
        if (existing.isPresent()) {
            AdminUserEntity user = existing.get();
            user.reactivate(hash(defaultPassword), defaultLicenseKey);
            repository.save(user);
            log.warn("No active administrator found; reactivated '{}' with the DEVELOPMENT-ONLY default "
                + "password and license key. Change the password before using this store in production.",
                defaultUsername);
        } else {
            repository.save(AdminUserEntity.create(defaultUsername, hash(defaultPassword), defaultLicenseKey));
            log.warn("Seeded DEVELOPMENT-ONLY administrator '{}' with the default password and license key. "
                + "Change the password before using this store in production.", defaultUsername);
        }
        return true;
    }

    @Transactional(readOnly = true)
    public boolean authenticate(String username, String password, String licenseKey) {
        if (isBlank(username) || isBlank(password) || isBlank(licenseKey)) {
            log.warn("Login rejected: username, password and license key are all required");
            return false;
        }

        Optional<AdminUserEntity> match = repository.findByUsername(username.trim());
        boolean accepted = match
            .filter(AdminUserEntity::isActive)
            .filter(user -> digestEquals(user.getPasswordHash(), hash(password)))
            .filter(user -> licenseKey.trim().equals(user.getLicenseKey()))
            .isPresent();

        if (accepted) {
            log.info("Administrator '{}' authenticated", username.trim());
        } else {
            log.warn("Login rejected for '{}'", username.trim());
        }
        return accepted;
    }

    /**
     * Replaces an administrator's password after re-checking the current
     * credentials.
     *
     * @throws ValidationException if the current credentials do not match or
     *                             the new password is blank
     */
    @Transactional
    public void changePassword(String username, String currentPassword, String licenseKey, String newPassword) {
        if (isBlank(newPassword)) {
            throw new ValidationException("New password must not be blank");
        }
        if (!authenticate(username, currentPassword, licenseKey)) {
            throw new ValidationException("Current credentials do not match");
        }
        AdminUserEntity user = repository.findByUsername(username.trim())
            .orElseThrow(() -> new ValidationException("Current credentials do not match"));
        user.replacePasswordHash(hash(newPassword));
        repository.save(user);
        log.info("Password changed for administrator '{}'", user.getUsername());
    }

    @Transactional(readOnly = true)
    public List<AdminAccount> listAdmins() {
        return repository.findAll().stream()
            .map(AdminAccount::from)
            .toList();
    }

    @Transactional(readOnly = true)
    public long activeAdminCount() {
        return repository.countByActiveTrue();
    }

    static String hash(String password) {
        return DigestUtils.sha256Hex(password.getBytes(StandardCharsets.UTF_8));
    }

    private static boolean digestEquals(String stored, String supplied) {
        return MessageDigest.isEqual(
            stored.getBytes(StandardCharsets.US_ASCII),
            supplied.getBytes(StandardCharsets.US_ASCII));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
