package de.bsommerfeld.modelstore.db;

import de.bsommerfeld.modelstore.db.schema.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Table- and predicate-scoped CRUD primitives. Knows nothing about the
 * declared schema: every method takes table and column names as arguments and
 * returns a {@link Result}.
 *
 * <p>
 * Values are always bound as statement parameters (including {@code LIMIT});
 * only quoted identifiers and {@link Operator} symbols are spliced into SQL.
 * Engine errors are reported through {@link ErrorReporter} and surface as a
 * {@link Result#FAILURE} result, never as an exception.
 *
 * <p>
 * Not thread-safe on its own. The owning {@link Database} confines all calls
 * to its statement thread.
 */
public class RowStore {

    private static final Logger LOG = LoggerFactory.getLogger(RowStore.class);
    private static final int NO_LIMIT = -1;

    private final Supplier<Connection> connection;
    private final ErrorReporter errors;

    RowStore(Supplier<Connection> connection, ErrorReporter errors) {
        this.connection = connection;
        this.errors = errors;
    }

    Connection connection() {
        Connection conn = connection.get();
        if (conn == null)
            throw new IllegalStateException("Database connection is not open");
        return conn;
    }

    // =====================================================================
    // Writes
    // =====================================================================

    /** Inserts one row; {@code values} are positional, in physical column order. */
    public Result insert(String table, List<?> values) {
        String placeholders = String.join(", ", Collections.nCopies(values.size(), "?"));
        String sql = SqlLoader.format("insert-row", Identifiers.quote(table), placeholders);
        return run("insert", sql, ps -> {
            bind(ps, 1, values);
            return Result.changed(ps.executeUpdate());
        });
    }

    /**
     * Inserts one row, naming its columns. The physical column order does not
     * matter; physical columns missing from {@code row} take their engine
     * default.
     */
    public Result insert(String table, Map<String, ?> row) {
        if (row.isEmpty())
            throw new IllegalArgumentException("Cannot insert an empty row into " + table);
        String columns = row.keySet().stream().map(Identifiers::quote).collect(Collectors.joining(", "));
        String placeholders = String.join(", ", Collections.nCopies(row.size(), "?"));
        String sql = SqlLoader.format("insert-columns", Identifiers.quote(table), columns, placeholders);
        return run("insert", sql, ps -> {
            bind(ps, 1, new ArrayList<>(row.values()));
            return Result.changed(ps.executeUpdate());
        });
    }

    /** Sets one column on every row where {@code predicateColumn = predicateValue}. */
    public Result updateColumn(String table, String column, Object newValue, String predicateColumn,
            Object predicateValue) {
        Map<String, Object> assignment = new LinkedHashMap<>();
        assignment.put(column, newValue);
        return updateColumns(table, assignment, predicateColumn, predicateValue);
    }

    /**
     * Sets several columns in a single statement, so either all of them change
     * or none do.
     */
    public Result updateColumns(String table, Map<String, ?> assignments, String predicateColumn,
            Object predicateValue) {
        if (assignments.isEmpty())
            return Result.changed(0);
        String setClause = assignments.keySet().stream()
                .map(c -> Identifiers.quote(c) + " = ?")
                .collect(Collectors.joining(", "));
        String sql = SqlLoader.format("update-columns", Identifiers.quote(table), setClause,
                Identifiers.quote(predicateColumn));
        return run("updateColumn", sql, ps -> {
            int next = bind(ps, 1, new ArrayList<>(assignments.values()));
            ps.setObject(next, predicateValue);
            return Result.changed(ps.executeUpdate());
        });
    }

    public Result deleteRows(String table, String column, Object value, Operator operator, int limit) {
        String sql = SqlLoader.format("delete-rows", Identifiers.quote(table), where(column, operator));
        return run("deleteRows", sql, ps -> {
            int next = bindPredicate(ps, 1, value, operator);
            ps.setInt(next, limitOf(limit));
            return Result.changed(ps.executeUpdate());
        });
    }

    public Result deleteRows(String table, String column, Object value) {
        return deleteRows(table, column, value, Operator.EQ, NO_LIMIT);
    }

    public Result deleteOne(String table, String column, Object value) {
        return deleteRows(table, column, value, Operator.EQ, 1);
    }

    /**
     * Copies matching rows into {@code toTable}, then deletes them from
     * {@code fromTable}. Both phases share one savepoint: a failure in either
     * rolls back both, so rows are never duplicated or lost. Columns are
     * matched by name: every destination column that the source also has is
     * copied, in any physical order. Source columns the destination lacks are
     * not carried over.
     *
     * @return changes = number of rows moved
     */
    public Result moveRows(String fromTable, String toTable, String column, Object value, Operator operator,
            int limit) {
        String from = Identifiers.quote(fromTable);
        String predicate = where(column, operator);
        String deleteSql = SqlLoader.format("delete-rows", from, predicate);
        try {
            int moved = inSavepoint("move_rows", () -> {
                String insertSql = SqlLoader.format("move-rows", Identifiers.quote(toTable), from,
                        sharedColumnList(fromTable, toTable), predicate);
                int inserted;
                try (PreparedStatement ps = connection().prepareStatement(insertSql)) {
                    int next = bindPredicate(ps, 1, value, operator);
                    ps.setInt(next, limitOf(limit));
                    inserted = ps.executeUpdate();
                }
                try (PreparedStatement ps = connection().prepareStatement(deleteSql)) {
                    int next = bindPredicate(ps, 1, value, operator);
                    ps.setInt(next, limitOf(limit));
                    int deleted = ps.executeUpdate();
                    if (deleted != inserted)
                        throw new SQLException("Moved " + inserted + " rows but removed " + deleted
                                + " from " + fromTable);
                }
                return inserted;
            });
            LOG.debug("[DB] Moved {} rows {} -> {}", moved, fromTable, toTable);
            return Result.changed(moved);
        } catch (SQLException e) {
            errors.report("moveRows", e);
            return Result.failure();
        }
    }

    public Result moveRows(String fromTable, String toTable, String column, Object value) {
        return moveRows(fromTable, toTable, column, value, Operator.EQ, NO_LIMIT);
    }

    /** Quoted destination columns, in destination order, that also exist in the source. */
    private String sharedColumnList(String fromTable, String toTable) throws SQLException {
        Set<String> source = tableInfo(fromTable).stream()
                .map(PhysicalColumn::name)
                .collect(Collectors.toSet());
        List<String> shared = tableInfo(toTable).stream()
                .map(PhysicalColumn::name)
                .filter(source::contains)
                .map(Identifiers::quote)
                .collect(Collectors.toList());
        if (shared.isEmpty())
            throw new SQLException("Tables " + fromTable + " and " + toTable + " share no columns");
        return String.join(", ", shared);
    }

    // =====================================================================
    // Reads
    // =====================================================================

    /**
     * Returns rows matching {@code column <operator> value}; with
     * {@link Operator#ALL} the whole table. A negative {@code limit} means no
     * limit.
     */
    public Result selectRows(String table, String column, Object value, Operator operator, int limit) {
        String sql = SqlLoader.format("select-rows", Identifiers.quote(table), where(column, operator));
        return run("selectRows", sql, ps -> {
            int next = bindPredicate(ps, 1, value, operator);
            ps.setInt(next, limitOf(limit));
            try (ResultSet rs = ps.executeQuery()) {
                return Result.ok().withRows(readRows(rs));
            }
        });
    }

    public Result selectRows(String table, String column, Object value) {
        return selectRows(table, column, value, Operator.EQ, NO_LIMIT);
    }

    public Result selectAll(String table) {
        return selectRows(table, null, null, Operator.ALL, NO_LIMIT);
    }

    /** {@link #selectRows} with limit 1; {@code row} is {@code null} when nothing matched. */
    public Result selectOne(String table, String column, Object value, Operator operator) {
        Result result = selectRows(table, column, value, operator, 1);
        if (!result.isOk())
            return result;
        boolean found = !result.rows().isEmpty();
        return Result.ok(found).withRow(found ? result.rows().get(0) : null);
    }

    public Result selectOne(String table, String column, Object value) {
        return selectOne(table, column, value, Operator.EQ);
    }

    /** Returns {@code searchColumn} of the first row matching the predicate as {@code value}. */
    public Result selectValue(String table, String column, Object value, String searchColumn, Operator operator) {
        String sql = SqlLoader.format("select-value", Identifiers.quote(searchColumn), Identifiers.quote(table),
                where(column, operator));
        return run("selectValue", sql, ps -> {
            bindPredicate(ps, 1, value, operator);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next())
                    return Result.ok(true).withValue(rs.getObject(1));
                return Result.ok(false);
            }
        });
    }

    /** {@code status} tells whether at least one row matches. */
    public Result valueExists(String table, String column, Object value, Operator operator) {
        String sql = SqlLoader.format("value-exists", Identifiers.quote(table), where(column, operator));
        return run("valueExists", sql, ps -> {
            bindPredicate(ps, 1, value, operator);
            try (ResultSet rs = ps.executeQuery()) {
                return Result.ok(rs.next());
            }
        });
    }

    public Result valueExists(String table, String column, Object value) {
        return valueExists(table, column, value, Operator.EQ);
    }

    // =====================================================================
    // Passthrough
    // =====================================================================

    /**
     * Runs caller-supplied SQL with bound parameters. Queries return
     * {@code rows}, everything else {@code changes}.
     */
    public Result execute(String sql, List<?> params) {
        return run("execute", sql, ps -> {
            bind(ps, 1, params);
            if (ps.execute()) {
                try (ResultSet rs = ps.getResultSet()) {
                    return Result.ok().withRows(readRows(rs));
                }
            }
            return Result.changed(Math.max(ps.getUpdateCount(), 0));
        });
    }

    /** Executes a parameterless statement, reporting failures under {@code location}. */
    Result runStatement(String location, String sql) {
        try (Statement stmt = connection().createStatement()) {
            stmt.execute(sql);
            return Result.ok();
        } catch (SQLException e) {
            errors.report(location, e);
            return Result.failure();
        }
    }

    // =====================================================================
    // Catalog inspection (used by SchemaMigrator)
    // =====================================================================

    List<String> listTables() throws SQLException {
        List<String> tables = new ArrayList<>();
        try (PreparedStatement ps = connection().prepareStatement(SqlLoader.load("list-tables"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                tables.add(rs.getString(1));
        }
        return tables;
    }

    boolean tableExists(String table) throws SQLException {
        try (PreparedStatement ps = connection().prepareStatement(SqlLoader.load("table-exists"))) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /** Physical columns of {@code table} in physical order; empty if the table does not exist. */
    List<PhysicalColumn> tableInfo(String table) throws SQLException {
        List<PhysicalColumn> columns = new ArrayList<>();
        try (PreparedStatement ps = connection().prepareStatement(SqlLoader.load("table-info"))) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(new PhysicalColumn(rs.getString("name"),
                            Objects.requireNonNullElse(rs.getString("type"), ""),
                            rs.getInt("pk") > 0));
                }
            }
        }
        return columns;
    }

    boolean columnExists(String table, String column) throws SQLException {
        return tableInfo(table).stream().anyMatch(c -> c.name().equals(column));
    }

    /** Executes a statement that takes no parameters; errors propagate. */
    void executeDdl(String sql) throws SQLException {
        LOG.debug("[DB] {}", sql);
        try (Statement stmt = connection().createStatement()) {
            stmt.execute(sql);
        }
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    @FunctionalInterface
    interface SqlWork<T> {
        T run() throws SQLException;
    }

    /**
     * Runs {@code work} inside {@code SAVEPOINT name}. Released on success,
     * rolled back and released on failure. Savepoints nest, so this also works
     * inside a transaction opened through the passthrough.
     */
    <T> T inSavepoint(String name, SqlWork<T> work) throws SQLException {
        String savepoint = Identifiers.quote(name);
        try (Statement stmt = connection().createStatement()) {
            stmt.execute("SAVEPOINT " + savepoint);
            try {
                T result = work.run();
                stmt.execute("RELEASE " + savepoint);
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    stmt.execute("ROLLBACK TO " + savepoint);
                    stmt.execute("RELEASE " + savepoint);
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            }
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    @FunctionalInterface
    private interface StatementWork {
        Result run(PreparedStatement ps) throws SQLException;
    }

    private Result run(String location, String sql, StatementWork work) {
        try (PreparedStatement ps = connection().prepareStatement(sql)) {
            return work.run(ps);
        } catch (SQLException e) {
            errors.report(location, e);
            return Result.failure();
        }
    }

    private static String where(String column, Operator operator) {
        Operator op = operator == null ? Operator.EQ : operator;
        if (op.isWildcard())
            return "";
        Objects.requireNonNull(column, "column is required unless the operator is ALL");
        return " WHERE " + Identifiers.quote(column) + " " + op.symbol() + " ?";
    }

    private static int bindPredicate(PreparedStatement ps, int index, Object value, Operator operator)
            throws SQLException {
        if (operator != null && operator.isWildcard())
            return index;
        ps.setObject(index, value);
        return index + 1;
    }

    private static int bind(PreparedStatement ps, int index, List<?> values) throws SQLException {
        int i = index;
        for (Object value : values)
            ps.setObject(i++, value);
        return i;
    }

    private static int limitOf(int limit) {
        return limit < 0 ? NO_LIMIT : limit;
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= count; i++)
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            rows.add(Collections.unmodifiableMap(row));
        }
        return rows;
    }
}
