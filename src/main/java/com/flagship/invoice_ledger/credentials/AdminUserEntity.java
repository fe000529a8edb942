package com.flagship.invoice_ledger.credentials;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Row mapping for an administrator allowed into the admin panel.
 *
 * No setters: the password hash changes only through {@link #replacePasswordHash(String)}
 * or {@link #reactivate(String, String)}.
 */
@Entity
@Table(name = "admin_users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AdminUserEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 64)
    private String passwordHash;

    @Column(name = "license_key", nullable = false, length = 128)
    private String licenseKey;

    @Column(nullable = false)
    private boolean active;

    static AdminUserEntity create(String username, String passwordHash, String licenseKey) {
        AdminUserEntity entity = new AdminUserEntity();
        entity.username = username;
        entity.passwordHash = passwordHash;
        entity.licenseKey = licenseKey;
        entity.active = true;
        return entity;
    }

    void replacePasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    void reactivate(String passwordHash, String licenseKey) {
        this.passwordHash = passwordHash;
        this.licenseKey = licenseKey;
        this.active = true;
    }
}
