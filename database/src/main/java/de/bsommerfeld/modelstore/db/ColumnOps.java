package de.bsommerfeld.modelstore.db;

import de.bsommerfeld.modelstore.db.schema.ColumnDefinition;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Operations bound to one column of one {@link Model}. Obtained through
 * {@link Model#column(String)}.
 */
public final class ColumnOps {

    private final Model model;
    private final ColumnDefinition column;

    ColumnOps(Model model, ColumnDefinition column) {
        this.model = model;
        this.column = column;
    }

    public String name() {
        return column.name();
    }

    public ColumnDefinition definition() {
        return column;
    }

    public Model model() {
        return model;
    }

    /**
     * Sets this column on the row identified by {@code keyValue}.
     *
     * @throws ConfigurationException if the table has no primary key
     */
    public CompletableFuture<Result> setValue(Object keyValue, Object value) {
        String key = model.requirePrimaryKey("setValue");
        Object coerced = column.type().coerce(value);
        return model.submit(() -> model.rows().updateColumn(model.tableName(), column.name(), coerced, key, keyValue));
    }

    /** Rows whose value in this column equals {@code value}. */
    public CompletableFuture<List<Instance>> fetch(Object value) {
        return fetch(value, Operator.EQ);
    }

    /** Rows where {@code column <operator> value}; {@link Operator#ALL} returns every row. */
    public CompletableFuture<List<Instance>> fetch(Object value, Operator operator) {
        return model.submit(() -> model.toInstances(
                model.rows().selectRows(model.tableName(), column.name(), value, operator, -1)));
    }

    /** Moves every row whose value in this column equals {@code value} into {@code destination}. */
    public CompletableFuture<Result> move(Model destination, Object value) {
        return move(destination, value, Operator.EQ);
    }

    public CompletableFuture<Result> move(Model destination, Object value, Operator operator) {
        return model.submit(() -> model.rows().moveRows(model.tableName(), destination.tableName(),
                column.name(), value, operator, -1));
    }

    /**
     * Sets this column to {@code newValue} on every row where
     * {@code whereColumn = whereValue}.
     *
     * @throws ConfigurationException if {@code whereColumn} belongs to another
     *                                table
     */
    public CompletableFuture<Result> updateValues(Object newValue, ColumnOps whereColumn, Object whereValue) {
        if (whereColumn.model() != model) {
            throw new ConfigurationException("Column '" + whereColumn.name() + "' does not belong to table '"
                    + model.tableName() + "'");
        }
        Object coerced = column.type().coerce(newValue);
        return model.submit(() -> model.rows().updateColumn(model.tableName(), column.name(), coerced,
                whereColumn.name(), whereValue));
    }

    @Override
    public String toString() {
        return model.tableName() + "." + column.name();
    }
}
