package de.bsommerfeld.modelstore.db;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import de.bsommerfeld.modelstore.db.schema.ColumnDefinition;
import de.bsommerfeld.modelstore.db.schema.TableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Typed access to one declared table. A {@code Model} is created by
 * {@link Database} for every {@link TableDefinition} in its schema and is
 * usable once the database is open.
 *
 * <p>
 * Identity-based operations ({@link #find}, {@link #delete}, {@link #move},
 * {@link #setValue}, and {@link Instance#save()} and friends) need a primary
 * key column; on a key-less table they throw {@link ConfigurationException}
 * before anything reaches the engine. Scans ({@link #all()},
 * {@link ColumnOps#fetch}) work on every table.
 *
 * <p>
 * Per-column helpers live in {@link #columns()}, keyed by column name.
 */
public final class Model {

    private static final Logger LOG = LoggerFactory.getLogger(Model.class);

    private final Database database;
    private final TableDefinition definition;
    private final String primaryKey;
    private final List<String> nonKeyColumns;
    private final ImmutableMap<String, ColumnOps> columns;

    Model(Database database, TableDefinition definition) {
        this.database = database;
        this.definition = definition;
        this.primaryKey = definition.primaryKey().map(ColumnDefinition::name).orElse(null);
        this.nonKeyColumns = definition.columns().stream()
                .filter(c -> !c.primaryKey())
                .map(ColumnDefinition::name)
                .collect(ImmutableList.toImmutableList());

        ImmutableMap.Builder<String, ColumnOps> builder = ImmutableMap.builder();
        for (ColumnDefinition column : definition.columns())
            builder.put(column.name(), new ColumnOps(this, column));
        this.columns = builder.build();

        if (primaryKey == null) {
            LOG.warn("[DB] Table '{}' has no primary key; find, save, delete and move will not work.",
                    definition.name());
        }
    }

    public String tableName() {
        return definition.name();
    }

    public TableDefinition definition() {
        return definition;
    }

    public Optional<String> primaryKey() {
        return Optional.ofNullable(primaryKey);
    }

    public boolean hasPrimaryKey() {
        return primaryKey != null;
    }

    /**
     * @throws ConfigurationException if the column is not declared
     */
    public ColumnOps column(String name) {
        ColumnOps ops = columns.get(name);
        if (ops == null)
            throw new ConfigurationException("Table '" + tableName() + "' has no column '" + name + "'");
        return ops;
    }

    public Map<String, ColumnOps> columns() {
        return columns;
    }

    // =====================================================================
    // Construction (in memory only)
    // =====================================================================

    /**
     * Builds an unsaved instance from positional values in declared column
     * order. Trailing columns that are not given take their declared default.
     *
     * @throws IllegalArgumentException if more values than columns are given
     */
    public Instance create(Object... values) {
        List<ColumnDefinition> declared = definition.columns();
        if (values.length > declared.size()) {
            throw new IllegalArgumentException("Table '" + tableName() + "' has " + declared.size()
                    + " columns, got " + values.length + " values");
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < declared.size(); i++) {
            ColumnDefinition column = declared.get(i);
            row.put(column.name(), i < values.length ? column.type().coerce(values[i]) : column.defaultValue());
        }
        return new Instance(this, row);
    }

    /**
     * Builds an unsaved instance from a field mapping. Fields that are not
     * declared are ignored; declared columns missing from {@code fields} take
     * their default.
     */
    public Instance fromObject(Map<String, ?> fields) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (ColumnDefinition column : definition.columns()) {
            Object value = fields.containsKey(column.name())
                    ? column.type().coerce(fields.get(column.name()))
                    : column.defaultValue();
            row.put(column.name(), value);
        }
        return new Instance(this, row);
    }

    // =====================================================================
    // Storage operations
    // =====================================================================

    /**
     * @return the stored row with this primary key, or empty if there is none
     *         or the lookup failed
     * @throws ConfigurationException if the table has no primary key
     */
    public CompletableFuture<Optional<Instance>> find(Object keyValue) {
        String key = requirePrimaryKey("find");
        return submit(() -> {
            Result result = rows().selectOne(tableName(), key, keyValue);
            return Optional.ofNullable(result.row()).map(this::fromRow);
        });
    }

    /**
     * @throws ConfigurationException if the table has no primary key
     */
    public CompletableFuture<Result> delete(Object keyValue) {
        String key = requirePrimaryKey("delete");
        return submit(() -> rows().deleteOne(tableName(), key, keyValue));
    }

    /**
     * Moves the row with this primary key into {@code destination}'s table.
     *
     * @throws ConfigurationException if the table has no primary key
     */
    public CompletableFuture<Result> move(Object keyValue, Model destination) {
        String key = requirePrimaryKey("move");
        return submit(() -> rows().moveRows(tableName(), destination.tableName(), key, keyValue, Operator.EQ, 1));
    }

    /** Every stored row, unbounded. An engine error yields an empty list. */
    public CompletableFuture<List<Instance>> all() {
        return submit(() -> toInstances(rows().selectAll(tableName())));
    }

    /**
     * Sets {@code column} on the row identified by {@code keyValue}.
     *
     * @throws ConfigurationException if the table has no primary key or the
     *                                column is not declared
     */
    public CompletableFuture<Result> setValue(String column, Object value, Object keyValue) {
        return column(column).setValue(keyValue, value);
    }

    // =====================================================================
    // Package internals
    // =====================================================================

    String requirePrimaryKey(String operation) {
        if (primaryKey == null) {
            throw new ConfigurationException("Cannot " + operation + ": no primary key defined for table '"
                    + tableName() + "'");
        }
        return primaryKey;
    }

    ColumnDefinition requireColumn(String name) {
        return column(name).definition();
    }

    List<String> nonKeyColumnNames() {
        return nonKeyColumns;
    }

    RowStore rows() {
        return database.rows();
    }

    <T> CompletableFuture<T> submit(Supplier<T> work) {
        return database.submit(work);
    }

    /** Maps a stored row to an instance; physical columns that are not declared are ignored. */
    Instance fromRow(Map<String, Object> row) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ColumnDefinition column : definition.columns())
            values.put(column.name(), column.type().coerce(row.get(column.name())));
        return new Instance(this, values);
    }

    List<Instance> toInstances(Result result) {
        if (!result.isOk() || result.rows() == null)
            return List.of();
        return result.rows().stream().map(this::fromRow).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "Model[" + tableName() + "]";
    }
}
