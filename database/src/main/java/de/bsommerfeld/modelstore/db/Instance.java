package de.bsommerfeld.modelstore.db;

import com.google.common.primitives.Longs;
import de.bsommerfeld.modelstore.db.schema.ColumnDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One row of a {@link Model}, held in memory. Values are copies; nothing here
 * keeps a cursor or connection open.
 *
 * <p>
 * An instance remembers the values it was created or loaded with in a
 * {@link RowSnapshot}. {@link #save()} inserts the row when its primary key
 * is not stored yet and otherwise updates only the columns that differ from
 * the snapshot.
 *
 * <p>
 * Instances are not thread-safe. Mutations made after {@code save()} returns
 * its future are not part of that save.
 */
public final class Instance {

    private static final Logger LOG = LoggerFactory.getLogger(Instance.class);

    private final Model model;
    private final Map<String, Object> values;
    private volatile RowSnapshot snapshot;

    /** {@code values} must be coerced and hold exactly the declared columns, in order. */
    Instance(Model model, Map<String, Object> values) {
        this.model = model;
        this.values = new LinkedHashMap<>(values);
        this.snapshot = RowSnapshot.of(values);
    }

    public Model model() {
        return model;
    }

    public Object get(String column) {
        model.requireColumn(column);
        return values.get(column);
    }

    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    /**
     * @return the value as a {@code Long}, or {@code null} if it is unset or
     *         not numeric (SQLite keeps text stored in an {@code INTEGER}
     *         column as text)
     */
    public Long getLong(String column) {
        Object value = get(column);
        if (value instanceof Number)
            return ((Number) value).longValue();
        return value == null ? null : Longs.tryParse(value.toString().trim());
    }

    /** Sets a column value, coerced to the column's declared type. */
    public Instance set(String column, Object value) {
        ColumnDefinition definition = model.requireColumn(column);
        values.put(column, definition.type().coerce(value));
        return this;
    }

    public RowSnapshot snapshot() {
        return snapshot;
    }

    /** Non-key columns whose current value differs from the snapshot. */
    public List<String> changedColumns() {
        return snapshot.changedColumns(values, model.nonKeyColumnNames());
    }

    // =====================================================================
    // Persistence
    // =====================================================================

    /**
     * Inserts the row if its primary key is not stored yet, otherwise writes
     * the changed non-key columns in one statement. {@code info} lists the
     * columns written by an update; a save with nothing changed performs no
     * write and reports {@code changes == 0}.
     *
     * @throws ConfigurationException if the table has no primary key
     */
    public CompletableFuture<Result> save() {
        model.requirePrimaryKey("save");
        Map<String, Object> current = new LinkedHashMap<>(values);
        return model.submit(() -> saveNow(current));
    }

    Result saveNow(Map<String, Object> current) {
        String table = model.tableName();
        String key = model.requirePrimaryKey("save");
        Object keyValue = current.get(key);
        RowStore rows = model.rows();

        Result exists = rows.valueExists(table, key, keyValue);
        if (!exists.isOk())
            return exists;

        if (!exists.succeeded()) {
            Result inserted = rows.insert(table, current);
            if (inserted.succeeded())
                snapshot = RowSnapshot.of(current);
            return inserted;
        }

        List<String> changed = snapshot.changedColumns(current, model.nonKeyColumnNames());
        if (changed.isEmpty()) {
            LOG.trace("[DB] Nothing to save for {}={} in {}", key, keyValue, table);
            return Result.ok().withChanges(0).withInfo(changed);
        }

        Map<String, Object> assignments = new LinkedHashMap<>();
        for (String column : changed)
            assignments.put(column, current.get(column));

        Result updated = rows.updateColumns(table, assignments, key, keyValue);
        if (!updated.succeeded())
            return updated;

        snapshot = RowSnapshot.of(current);
        LOG.debug("[DB] Updated {} of {}={} in {}", changed, key, keyValue, table);
        return updated.withInfo(changed);
    }

    /**
     * Deletes the stored row with this instance's primary key.
     *
     * @throws ConfigurationException if the table has no primary key
     */
    public CompletableFuture<Result> delete() {
        String key = model.requirePrimaryKey("delete");
        Object keyValue = values.get(key);
        return model.submit(() -> model.rows().deleteOne(model.tableName(), key, keyValue));
    }

    /**
     * Moves the stored row with this instance's primary key into
     * {@code destination}'s table.
     *
     * @throws ConfigurationException if the table has no primary key
     */
    public CompletableFuture<Result> move(Model destination) {
        String key = model.requirePrimaryKey("move");
        Object keyValue = values.get(key);
        return model.submit(() -> model.rows().moveRows(model.tableName(), destination.tableName(), key,
                keyValue, Operator.EQ, 1));
    }

    /**
     * Re-creates this row in {@code destination}: fields are matched by name,
     * missing ones take the destination's defaults, extra ones are dropped. The
     * original row is deleted only after the new one was saved.
     *
     * @return the saved destination instance, or empty if saving it failed, in
     *         which case the original row is untouched
     * @throws ConfigurationException if either table has no primary key
     */
    public CompletableFuture<Optional<Instance>> convert(Model destination) {
        String key = model.requirePrimaryKey("convert");
        destination.requirePrimaryKey("convert");
        Object keyValue = values.get(key);
        Instance converted = destination.fromObject(toObject(true));
        Map<String, Object> convertedValues = converted.toObject(true);

        return model.submit(() -> {
            Result saved = converted.saveNow(convertedValues);
            if (!saved.succeeded()) {
                LOG.warn("[DB] Converting {}={} from {} to {} failed (code {}), original kept",
                        key, keyValue, model.tableName(), destination.tableName(), saved.code());
                return Optional.empty();
            }
            Result deleted = model.rows().deleteOne(model.tableName(), key, keyValue);
            if (!deleted.isOk()) {
                LOG.warn("[DB] Converted {}={} to {} but could not delete it from {}",
                        key, keyValue, destination.tableName(), model.tableName());
            }
            return Optional.of(converted);
        });
    }

    // =====================================================================
    // Serialization
    // =====================================================================

    /** All declared columns, in declared order. */
    public Map<String, Object> toObject() {
        return toObject(true);
    }

    /**
     * Declared columns in declared order. With {@code includeSensitive ==
     * false}, columns flagged sensitive are left out.
     */
    public Map<String, Object> toObject(boolean includeSensitive) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (ColumnDefinition column : model.definition().columns()) {
            if (includeSensitive || !column.sensitive())
                out.put(column.name(), values.get(column.name()));
        }
        return out;
    }

    @Override
    public String toString() {
        return model.tableName() + toObject(false);
    }
}
