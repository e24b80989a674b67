package de.bsommerfeld.modelstore.db;

import de.bsommerfeld.modelstore.db.schema.ColumnDefinition;
import de.bsommerfeld.modelstore.db.schema.Identifiers;
import de.bsommerfeld.modelstore.db.schema.Schema;
import de.bsommerfeld.modelstore.db.schema.TableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Brings the physical layout in line with a declared {@link Schema}.
 *
 * <p>
 * Per table, in order: create the table if missing, otherwise rename columns
 * that declare a previous name, add missing columns (filling in declared
 * defaults), drop undeclared columns when {@code deleteUnused} is set; then,
 * when {@code reorder} is set, rebuild the table if its physical column order
 * differs from the declared one. Finally, when {@code deleteUnused} is set and
 * every table migrated cleanly, undeclared tables are dropped.
 *
 * <p>
 * Every step inspects the catalog before acting, so a second run against
 * conformant storage changes nothing. A failing step aborts the remaining
 * steps for that table only; nothing already applied is rolled back.
 *
 * <h3>Table rebuilds</h3>
 * Reordering and the column-drop fallback copy the table into
 * {@code _rebuild_<table>}, drop the original and rename the copy into place.
 * The whole swap runs inside one savepoint, so an interruption leaves the
 * original table untouched.
 */
public class SchemaMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrator.class);
    private static final String REBUILD_PREFIX = "_rebuild_";

    private final RowStore rows;
    private final ErrorReporter errors;
    private final boolean deleteUnused;
    private final boolean reorder;

    SchemaMigrator(RowStore rows, ErrorReporter errors, boolean deleteUnused, boolean reorder) {
        this.rows = rows;
        this.errors = errors;
        this.deleteUnused = deleteUnused;
        this.reorder = reorder;
    }

    public MigrationReport migrate(Schema schema) {
        MigrationReport report = new MigrationReport();
        for (TableDefinition table : schema.tables()) {
            Result result = ensureTable(table, report);
            if (result.isOk() && reorder)
                result = reorderColumns(table, report);
            if (!result.isOk()) {
                LOG.error("[DB] Migration of table '{}' aborted (code {})", table.name(), result.code());
                report.markFailed(table.name());
            }
        }

        if (deleteUnused) {
            if (report.isSuccessful()) {
                pruneTables(schema, report);
            } else {
                LOG.warn("[DB] Skipping table pruning, migration failed for {}", report.failedTables());
            }
        }
        return report;
    }

    /** Creates {@code table} with its declared columns, or reconciles it if it exists. */
    public Result ensureTable(TableDefinition table, MigrationReport report) {
        try {
            if (rows.tableExists(table.name()))
                return reconcileColumns(table, report);

            createTable(table.name(), table.columns().stream().map(PhysicalColumn::of).collect(Collectors.toList()));
            report.record("created table " + table.name());
            return Result.ok();
        } catch (SQLException e) {
            errors.report("migrate:" + table.name(), e);
            return Result.failure();
        }
    }

    /** Renames, adds and (optionally) drops columns of an existing table. */
    public Result reconcileColumns(TableDefinition table, MigrationReport report) {
        String name = table.name();
        try {
            for (ColumnDefinition column : table.columns()) {
                if (column.previousName() == null)
                    continue;
                Result renamed = renameColumn(name, column.previousName(), column.name());
                if (renamed.code() == Result.CONFLICT) {
                    LOG.warn("[DB] Cannot rename {}.{} to '{}': target column already exists",
                            name, column.previousName(), column.name());
                } else if (renamed.succeeded()) {
                    report.record("renamed column " + name + "." + column.previousName() + " -> " + column.name());
                }
            }

            Set<String> physical = rows.tableInfo(name).stream()
                    .map(PhysicalColumn::name)
                    .collect(Collectors.toSet());

            for (ColumnDefinition column : table.columns()) {
                if (physical.contains(column.name()))
                    continue;
                addColumn(name, column);
                report.record("added column " + name + "." + column.name());
            }

            if (deleteUnused) {
                for (String column : physical) {
                    if (table.hasColumn(column))
                        continue;
                    dropColumn(name, column);
                    report.record("dropped column " + name + "." + column);
                }
            }
            return Result.ok();
        } catch (SQLException e) {
            errors.report("migrate:" + name, e);
            return Result.failure();
        }
    }

    /**
     * Rebuilds {@code table} so that declared columns come first, in declared
     * order, followed by any undeclared leftovers in their current order.
     *
     * @return {@code status == false} when the order already matched and
     *         nothing was rebuilt
     */
    public Result reorderColumns(TableDefinition table, MigrationReport report) {
        String name = table.name();
        try {
            List<PhysicalColumn> physical = rows.tableInfo(name);
            List<PhysicalColumn> ordered = new ArrayList<>();
            for (String declared : table.columnNames()) {
                physical.stream().filter(c -> c.name().equals(declared)).findFirst().ifPresent(ordered::add);
            }
            for (PhysicalColumn column : physical) {
                if (!ordered.contains(column))
                    ordered.add(column);
            }

            if (ordered.equals(physical))
                return Result.ok(false);

            rebuildTable(name, ordered);
            report.record("reordered columns of " + name + " to "
                    + ordered.stream().map(PhysicalColumn::name).collect(Collectors.toList()));
            return Result.ok(true);
        } catch (SQLException e) {
            errors.report("migrate:" + name, e);
            return Result.failure();
        }
    }

    /** Drops every physical table that the schema does not declare. */
    public Result pruneTables(Schema schema, MigrationReport report) {
        try {
            for (String table : rows.listTables()) {
                if (schema.contains(table))
                    continue;
                rows.executeDdl(SqlLoader.format("drop-table", Identifiers.quote(table)));
                report.record("dropped table " + table);
            }
            return Result.ok();
        } catch (SQLException e) {
            errors.report("migrate:prune", e);
            report.markFailed("prune");
            return Result.failure();
        }
    }

    // =====================================================================
    // Individual DDL steps
    // =====================================================================

    /**
     * @return {@link Result#NOT_FOUND} if {@code oldName} does not exist,
     *         {@link Result#CONFLICT} if {@code newName} already does
     */
    Result renameColumn(String table, String oldName, String newName) throws SQLException {
        List<PhysicalColumn> physical = rows.tableInfo(table);
        if (physical.stream().noneMatch(c -> c.name().equals(oldName)))
            return Result.notFound();
        if (physical.stream().anyMatch(c -> c.name().equals(newName)))
            return Result.conflict();

        rows.executeDdl(SqlLoader.format("rename-column", Identifiers.quote(table), Identifiers.quote(oldName),
                Identifiers.quote(newName)));
        return Result.ok();
    }

    /**
     * @return {@link Result#NOT_FOUND} if {@code oldName} does not exist,
     *         {@link Result#CONFLICT} if {@code newName} already does
     */
    Result renameTable(String oldName, String newName) throws SQLException {
        if (!rows.tableExists(oldName))
            return Result.notFound();
        if (rows.tableExists(newName))
            return Result.conflict();

        rows.executeDdl(SqlLoader.format("rename-table", Identifiers.quote(oldName), Identifiers.quote(newName)));
        return Result.ok();
    }

    private void createTable(String table, List<PhysicalColumn> columns) throws SQLException {
        long keys = columns.stream().filter(PhysicalColumn::primaryKey).count();
        boolean inlineKey = keys == 1;
        List<String> clauses = columns.stream().map(c -> c.ddl(inlineKey)).collect(Collectors.toList());
        if (keys > 1) {
            clauses.add("PRIMARY KEY (" + columns.stream()
                    .filter(PhysicalColumn::primaryKey)
                    .map(c -> Identifiers.quote(c.name()))
                    .collect(Collectors.joining(", ")) + ")");
        }
        rows.executeDdl(SqlLoader.format("create-table", Identifiers.quote(table), String.join(", ", clauses)));
    }

    /**
     * Adds a column and writes its declared default into every existing row.
     * A key column is added without its constraint: SQLite cannot add one to
     * an existing table.
     */
    private void addColumn(String table, ColumnDefinition column) throws SQLException {
        PhysicalColumn physical = new PhysicalColumn(column.name(), column.type().sqlType(), false);
        rows.executeDdl(SqlLoader.format("add-column", Identifiers.quote(table), physical.ddl(false)));
        if (column.defaultValue() == null)
            return;

        String sql = SqlLoader.format("fill-column", Identifiers.quote(table), Identifiers.quote(column.name()));
        try (PreparedStatement ps = rows.connection().prepareStatement(sql)) {
            ps.setObject(1, column.defaultValue());
            ps.executeUpdate();
        }
    }

    /**
     * Drops a column natively where the engine allows it; key, unique and
     * indexed columns are rejected by {@code ALTER TABLE ... DROP COLUMN}, in
     * which case the table is rebuilt without the column.
     */
    private void dropColumn(String table, String column) throws SQLException {
        try {
            rows.executeDdl(SqlLoader.format("drop-column", Identifiers.quote(table), Identifiers.quote(column)));
        } catch (SQLException nativeDropFailure) {
            LOG.debug("[DB] Native drop of {}.{} rejected ({}), rebuilding table",
                    table, column, nativeDropFailure.getMessage());
            List<PhysicalColumn> remaining = rows.tableInfo(table).stream()
                    .filter(c -> !c.name().equals(column))
                    .collect(Collectors.toList());
            rebuildTable(table, remaining);
        }
    }

    /**
     * Replaces {@code table} with a copy holding exactly {@code columns}, in
     * that order. Data is copied through a column-projected select.
     */
    private void rebuildTable(String table, List<PhysicalColumn> columns) throws SQLException {
        String temp = REBUILD_PREFIX + table;
        String columnList = columns.stream()
                .map(c -> Identifiers.quote(c.name()))
                .collect(Collectors.joining(", "));

        rows.inSavepoint("rebuild_table", () -> {
            rows.executeDdl(SqlLoader.format("drop-table-if-exists", Identifiers.quote(temp)));
            createTable(temp, columns);
            rows.executeDdl(SqlLoader.format("copy-rows", Identifiers.quote(temp), columnList, columnList,
                    Identifiers.quote(table)));
            rows.executeDdl(SqlLoader.format("drop-table", Identifiers.quote(table)));
            Result renamed = renameTable(temp, table);
            if (!renamed.isOk())
                throw new SQLException("Could not rename " + temp + " to " + table + " (code " + renamed.code() + ")");
            return null;
        });
    }
}
