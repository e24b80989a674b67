package de.bsommerfeld.modelstore.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural changes applied by one {@link SchemaMigrator#migrate} run, plus
 * the tables whose migration failed. An empty change list on a successful
 * report means the storage already matched the schema.
 */
public final class MigrationReport {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationReport.class);

    private final List<String> changes = new ArrayList<>();
    private final Set<String> failedTables = new LinkedHashSet<>();

    void record(String change) {
        LOG.info("[DB] Migration: {}", change);
        changes.add(change);
    }

    void markFailed(String table) {
        failedTables.add(table);
    }

    public List<String> changes() {
        return Collections.unmodifiableList(changes);
    }

    public Set<String> failedTables() {
        return Collections.unmodifiableSet(failedTables);
    }

    public boolean isSuccessful() {
        return failedTables.isEmpty();
    }

    @Override
    public String toString() {
        return "MigrationReport{changes=" + changes + ", failedTables=" + failedTables + "}";
    }
}
