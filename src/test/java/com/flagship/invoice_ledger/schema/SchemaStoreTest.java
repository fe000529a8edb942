package com.flagship.invoice_ledger.schema;

import com.flagship.invoice_ledger.bootstrap.StoreInitializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schema migration on fresh, current and legacy stores.
 *
 * Standalone stores get their own in-memory database so they never see the
 * shared test store.
 */
@SpringBootTest
@ActiveProfiles("test")
class SchemaStoreTest {

    @Autowired
    private SchemaStore schemaStore;

    @Autowired
    private StoreInitializer storeInitializer;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static DriverManagerDataSource isolatedStore() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.h2.Driver");
        dataSource.setUrl("jdbc:h2:mem:schema_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1");
        dataSource.setUsername("sa");
        dataSource.setPassword("");
        return dataSource;
    }

    @Test
    @DisplayName("Application store is fully migrated at startup")
    void testStartupMigration() {
        printTestHeader("Startup Migration");

        printOutput("Current version", schemaStore.currentVersion());
        assertEquals("6", schemaStore.currentVersion());
        assertEquals(0, schemaStore.pendingCount());
        assertEquals(0, schemaStore.migrate());

        printSuccess("No pending migrations");
    }

    @Test
    @DisplayName("Fresh store gets every migration once; a second run is a no-op")
    void testFreshStoreMigratesOnce() {
        printTestHeader("Fresh Store");

        DriverManagerDataSource dataSource = isolatedStore();
        SchemaStore store = new SchemaStore(SchemaMigrationConfig.flywayFor(dataSource));

        // When
        int first = store.migrate();
        int second = store.migrate();
        printOutput("First run", first);
        printOutput("Second run", second);

        // Then
        assertEquals(6, first);
        assertEquals(0, second);
        assertEquals(List.of("1", "2", "3", "4", "5", "6"), store.appliedVersions());

        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        Integer tables = jdbc.queryForObject(
            "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_SCHEMA = 'PUBLIC' AND TABLE_NAME IN "
                + "('CUSTOMERS', 'PRODUCTS', 'INVOICES', 'INVOICE_ITEMS', 'SETTINGS', 'ADMIN_USERS')",
            Integer.class);
        assertEquals(6, tables);

        printSuccess("Six tables created by six migrations");
    }

    @Test
    @DisplayName("Store written by an old release is baselined and upgraded without losing data")
    void testLegacyStoreUpgrade() {
        printTestHeader("Legacy Store Upgrade");

        // Given: The shape written before pricing, stock, discounts, settings and admins existed
        DriverManagerDataSource dataSource = isolatedStore();
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("CREATE TABLE customers (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
            + "name VARCHAR(255) NOT NULL, email VARCHAR(255), phone VARCHAR(64), address VARCHAR(1024), "
            + "tax_number VARCHAR(64), created_at TIMESTAMP)");
        jdbc.execute("CREATE TABLE products (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
            + "name VARCHAR(255) NOT NULL, description VARCHAR(2048), unit_price DECIMAL(19, 4) DEFAULT 0 NOT NULL, "
            + "unit VARCHAR(64), created_at TIMESTAMP)");
        jdbc.execute("CREATE TABLE invoices (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
            + "invoice_number VARCHAR(64) NOT NULL UNIQUE, customer_id BIGINT, invoice_date DATE, due_date DATE, "
            + "total_amount DECIMAL(19, 4), status VARCHAR(32), created_at TIMESTAMP)");
        jdbc.execute("CREATE TABLE invoice_items (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
            + "invoice_id BIGINT NOT NULL, product_id BIGINT, description VARCHAR(1024), "
            + "quantity DECIMAL(19, 4) NOT NULL, unit_price DECIMAL(19, 4) NOT NULL, line_total DECIMAL(19, 4) NOT NULL)");
        jdbc.update("INSERT INTO products (name, unit_price) VALUES ('Legacy Lamp', 12.50)");
        jdbc.update("INSERT INTO invoices (invoice_number, status) VALUES ('OLD-1', 'Paid')");

        SchemaStore store = new SchemaStore(SchemaMigrationConfig.flywayFor(dataSource));

        // When
        int applied = store.migrate();
        printOutput("Migrations applied", applied);
        printOutput("Applied versions", store.appliedVersions());

        // Then: Baseline 0 plus every step
        assertEquals(6, applied);
        assertEquals("6", store.currentVersion());
        assertTrue(store.appliedVersions().containsAll(List.of("0", "1", "2", "3", "4", "5", "6")));

        BigDecimal salePrice = jdbc.queryForObject(
            "SELECT sale_price FROM products WHERE name = 'Legacy Lamp'", BigDecimal.class);
        Integer stock = jdbc.queryForObject("SELECT stock FROM products WHERE name = 'Legacy Lamp'", Integer.class);
        assertEquals(0, new BigDecimal("12.50").compareTo(salePrice));
        assertEquals(0, stock);

        Integer discountColumns = jdbc.queryForObject(
            "SELECT COUNT(*) FROM INFORMATION_SCHEMA.COLUMNS WHERE TABLE_NAME = 'INVOICE_ITEMS' AND COLUMN_NAME = 'DISCOUNT'",
            Integer.class);
        assertEquals(1, discountColumns);
        assertEquals(1, jdbc.queryForObject("SELECT COUNT(*) FROM invoices WHERE invoice_number = 'OLD-1'", Integer.class));

        // And: Running again changes nothing
        assertEquals(0, store.migrate());

        printSuccess("Legacy data kept, missing columns and tables added");
    }

    @Test
    @DisplayName("Initialization twice does not duplicate the settings or admin seed rows")
    void testInitializationIsIdempotent() {
        printTestHeader("Idempotent Initialization");

        storeInitializer.afterSingletonsInstantiated();
        storeInitializer.afterSingletonsInstantiated();

        Integer settingsRows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM settings", Integer.class);
        Integer adminRows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM admin_users", Integer.class);
        printOutput("Settings rows", settingsRows);
        printOutput("Admin rows", adminRows);

        assertEquals(1, settingsRows);
        assertTrue(adminRows >= 1);
        assertEquals(0, schemaStore.migrate());

        printSuccess("Seed rows not duplicated");
    }
}
