/**
 * Schema-driven SQLite storage: declared tables in, typed models out.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Caller]
 *      │ open / close / model(name)
 *      ▼
 *   Database            ← lifecycle, single statement thread
 *    ├── SchemaMigrator      ← reconciles storage with the Schema on open
 *    ├── Model ×n            ← one per declared table
 *    │     ├── ColumnOps     ← per-column helpers
 *    │     └── Instance      ← in-memory row + RowSnapshot
 *    ├── MaintenanceScheduler ← backup / vacuum timers
 *    │     └── MaintenanceGuard (busy signal)
 *    └── RowStore            ← CRUD primitives on the one Connection
 * </pre>
 *
 * <h2>Migration</h2>
 * On {@link de.bsommerfeld.modelstore.db.Database#open()} every declared
 * table is created if missing, then its columns are reconciled: renames
 * (driven by {@code previousName}), additions with defaults, and, if enabled,
 * drops and reordering. Rebuilds copy rows into a temporary table inside a
 * savepoint, so a failed rebuild leaves the original table in place.
 * Undeclared tables are dropped only when enabled and only if every table
 * migrated cleanly.
 *
 * <h2>Results</h2>
 * Storage operations never throw engine errors. They return a
 * {@link de.bsommerfeld.modelstore.db.Result} whose {@code code} says whether
 * the statement ran and whose {@code status} says whether it had an effect.
 * Engine errors are logged and passed to the configured
 * {@link de.bsommerfeld.modelstore.db.ErrorCallback}. Misuse (an identity
 * operation on a table without primary key, an unknown column) throws
 * {@link de.bsommerfeld.modelstore.db.ConfigurationException} before any
 * statement runs.
 *
 * <h2>SQL File Inventory</h2>
 * Statements live in {@code sql/*.sql}, loaded via
 * {@link de.bsommerfeld.modelstore.db.SqlLoader}. Templates that take
 * identifiers are {@link String#format} patterns; identifiers are quoted
 * before they are spliced in and all values are bound.
 * <ul>
 * <li>{@code list-tables.sql}, {@code table-exists.sql},
 * {@code table-info.sql}: catalog inspection</li>
 * <li>{@code create-table.sql}, {@code drop-table.sql},
 * {@code drop-table-if-exists.sql}, {@code rename-table.sql}: table DDL</li>
 * <li>{@code add-column.sql}, {@code fill-column.sql},
 * {@code rename-column.sql}, {@code drop-column.sql}: column DDL</li>
 * <li>{@code copy-rows.sql}: column-projected copy used by rebuilds</li>
 * <li>{@code insert-row.sql}, {@code insert-columns.sql}, {@code select-rows.sql},
 * {@code select-value.sql}, {@code value-exists.sql},
 * {@code update-columns.sql}, {@code delete-rows.sql},
 * {@code move-rows.sql}: row access</li>
 * <li>{@code vacuum.sql}, {@code commit.sql}, {@code rollback.sql}</li>
 * </ul>
 */
package de.bsommerfeld.modelstore.db;
