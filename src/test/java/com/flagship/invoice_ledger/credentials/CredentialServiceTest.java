package com.flagship.invoice_ledger.credentials;

import com.flagship.invoice_ledger.exception.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class CredentialServiceTest {

    private static final String USERNAME = "cashier";
    private static final String PASSWORD = "s3cret";
    private static final String LICENSE = "NOURA-TEST-1111-2222";

    @Autowired
    private CredentialService credentialService;

    @Autowired
    private AdminUserRepository repository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        repository.findByUsername(USERNAME).ifPresent(repository::delete);
        repository.save(AdminUserEntity.create(USERNAME, CredentialService.hash(PASSWORD), LICENSE));
    }

    @AfterEach
    void tearDown() {
        repository.findByUsername(USERNAME).ifPresent(repository::delete);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Test
    @DisplayName("Default administrator is seeded at startup and authenticates")
    void testDefaultAdminSeeded() {
        printTestHeader("Default Admin");

        assertTrue(credentialService.activeAdminCount() >= 1);
        assertTrue(credentialService.authenticate("admin", "admin", "NOURA-DEV-0000-0000"));

        // Seeding again is a no-op while an active admin exists
        assertFalse(credentialService.seedDefaultAdmin());
    }

    @Test
    @DisplayName("Seeding inserts exactly one active admin with a hashed password")
    void testSeedingOnEmptyStore() {
        printTestHeader("Seeding On Empty Store");

        AdminUserRepository emptyRepository = mock(AdminUserRepository.class);
        when(emptyRepository.countByActiveTrue()).thenReturn(0L);
        CredentialService service = new CredentialService(emptyRepository, "owner", "pw", "LIC-1");

        assertTrue(service.seedDefaultAdmin());

        ArgumentCaptor<AdminUserEntity> saved = ArgumentCaptor.forClass(AdminUserEntity.class);
        verify(emptyRepository).save(saved.capture());
        printOutput("Seeded user", saved.getValue().getUsername());
        assertEquals("owner", saved.getValue().getUsername());
        assertEquals(CredentialService.hash("pw"), saved.getValue().getPasswordHash());
        assertEquals(64, saved.getValue().getPasswordHash().length());
        assertTrue(saved.getValue().isActive());

        when(emptyRepository.countByActiveTrue()).thenReturn(1L);
        assertFalse(service.seedDefaultAdmin());
        verify(emptyRepository, times(1)).save(any());
    }

    @Test
    @DisplayName("A store holding only inactive admins gets the default admin back on seeding")
    void testSeedingWithOnlyInactiveAdmins() {
        printTestHeader("Seeding With Only Inactive Admins");

        // Given
        jdbcTemplate.update("UPDATE admin_users SET active = FALSE");
        assertEquals(0, credentialService.activeAdminCount());

        // When
        boolean seeded = credentialService.seedDefaultAdmin();

        // Then
        printOutput("Seeded", seeded);
        printOutput("Active admins", credentialService.activeAdminCount());
        assertTrue(seeded);
        assertEquals(1, credentialService.activeAdminCount());
        Integer defaultRows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM admin_users WHERE username = ?", Integer.class, "admin");
        assertEquals(1, defaultRows.intValue());
        assertTrue(credentialService.authenticate("admin", "admin", "NOURA-DEV-0000-0000"));
        assertFalse(credentialService.authenticate(USERNAME, PASSWORD, LICENSE));
    }

    @Test
    @DisplayName("Authentication needs username, password and license key to all match")
    void testAuthenticationMatrix() {
        printTestHeader("Authentication Matrix");

        assertTrue(credentialService.authenticate(USERNAME, PASSWORD, LICENSE));
        assertTrue(credentialService.authenticate("  " + USERNAME + " ", PASSWORD, LICENSE));

        assertFalse(credentialService.authenticate(USERNAME, "wrong", LICENSE));
        assertFalse(credentialService.authenticate(USERNAME, PASSWORD, "NOURA-OTHER"));
        assertFalse(credentialService.authenticate("nobody", PASSWORD, LICENSE));
        assertFalse(credentialService.authenticate(USERNAME, PASSWORD, ""));
        assertFalse(credentialService.authenticate(null, PASSWORD, LICENSE));
        assertFalse(credentialService.authenticate(USERNAME, null, LICENSE));
    }

    @Test
    @DisplayName("Inactive administrators cannot log in")
    void testInactiveAdminRejected() {
        jdbcTemplate.update("UPDATE admin_users SET active = FALSE WHERE username = ?", USERNAME);

        assertFalse(credentialService.authenticate(USERNAME, PASSWORD, LICENSE));
        assertTrue(credentialService.listAdmins().stream()
            .anyMatch(a -> a.getUsername().equals(USERNAME) && !a.isActive()));
    }

    @Test
    @DisplayName("Password change requires the current credentials")
    void testChangePassword() {
        printTestHeader("Change Password");

        ValidationException wrongCurrent = assertThrows(ValidationException.class,
            () -> credentialService.changePassword(USERNAME, "wrong", LICENSE, "next"));
        printOutput("Rejected", wrongCurrent.getMessage());
        assertThrows(ValidationException.class,
            () -> credentialService.changePassword(USERNAME, PASSWORD, LICENSE, " "));

        credentialService.changePassword(USERNAME, PASSWORD, LICENSE, "next");

        assertFalse(credentialService.authenticate(USERNAME, PASSWORD, LICENSE));
        assertTrue(credentialService.authenticate(USERNAME, "next", LICENSE));
    }

    @Test
    @DisplayName("Listing admins never exposes password hashes")
    void testListAdmins() {
        List<AdminAccount> admins = credentialService.listAdmins();
        printOutput("Admins", admins);

        assertTrue(admins.stream().anyMatch(a -> a.getUsername().equals(USERNAME) && a.isActive()));
        assertTrue(admins.stream().noneMatch(a -> a.toString().contains(CredentialService.hash(PASSWORD))));
    }
}
