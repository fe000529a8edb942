package com.flagship.invoice_ledger.schema;

import org.flywaydb.core.Flyway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Runs the versioned schema migrations before anything touches the store.
 *
 * The Flyway bean is detected as a database initializer, so JdbcTemplate and
 * the JPA EntityManagerFactory are only created once {@code migrate} returned.
 * A failing migration aborts context startup.
 */
@Configuration
public class SchemaMigrationConfig {

    static final String MIGRATION_LOCATION = "classpath:db/migration";

    @Bean(initMethod = "migrate")
    public Flyway ledgerFlyway(DataSource dataSource) {
        return flywayFor(dataSource);
    }

    /**
     * Stores written before the history table existed are baselined at
     * version 0, so every migration replays over them; each step is written to
     * tolerate tables and columns that are already present.
     */
    public static Flyway flywayFor(DataSource dataSource) {
        return Flyway.configure()
            .dataSource(dataSource)
            .locations(MIGRATION_LOCATION)
            .baselineOnMigrate(true)
            .baselineVersion("0")
            .load();
    }
}
