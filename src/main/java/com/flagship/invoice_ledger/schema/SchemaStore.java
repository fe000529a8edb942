package com.flagship.invoice_ledger.schema;

import com.flagship.invoice_ledger.exception.StorageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.output.MigrateResult;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Owns the physical layout of the store.
 *
 * Migration itself happens at startup through {@link SchemaMigrationConfig};
 * this component reports what was applied and allows an explicit re-run,
 * which is a no-op on a store that already has the latest shape.
 */
@Component
@Slf4j
public class SchemaStore {

    private final Flyway flyway;

    public SchemaStore(Flyway flyway) {
        this.flyway = flyway;
    }

    /**
     * Applies any pending migrations.
     *
     * @return number of migrations executed by this call
     * @throws StorageFailureException if a migration fails
     */
    public int migrate() {
        try {
            MigrateResult result = flyway.migrate();
            if (result.migrationsExecuted > 0) {
                log.info("Schema migrated to version {} ({} step(s) applied)",
                    result.targetSchemaVersion, result.migrationsExecuted);
            } else {
                log.debug("Schema already at version {}", currentVersion());
            }
            return result.migrationsExecuted;
        } catch (FlywayException e) {
            log.error("Schema migration failed: {}", e.getMessage());
            throw new StorageFailureException("Schema migration failed: " + e.getMessage(), e);
        }
    }

    /**
     * @return the highest applied version, or "none" for an empty store
     */
    public String currentVersion() {
        MigrationInfo current = flyway.info().current();
        return current == null ? "none" : current.getVersion().getVersion();
    }

    public List<String> appliedVersions() {
        return Arrays.stream(flyway.info().applied())
            .filter(info -> info.getVersion() != null)
            .map(info -> info.getVersion().getVersion())
            .toList();
    }

    public int pendingCount() {
        return flyway.info().pending().length;
    }
}
