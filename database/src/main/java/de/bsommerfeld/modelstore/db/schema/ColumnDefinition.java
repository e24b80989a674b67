package de.bsommerfeld.modelstore.db.schema;

import java.util.Objects;

/**
 * One declared column. Instances are immutable; the fluent methods return
 * modified copies:
 *
 * <pre>
 * ColumnDefinition.text("id").asPrimaryKey()
 * ColumnDefinition.text("url").renamedFrom("download_url")
 * ColumnDefinition.integer("size").withDefault(0)
 * ColumnDefinition.text("token").asSensitive()
 * </pre>
 *
 * @param name         column name, unique within its table
 * @param type         storage type
 * @param primaryKey   whether this column identifies a row
 * @param sensitive    excluded from {@code toObject(false)}
 * @param defaultValue value applied to existing rows when the column is added
 *                     and to fields missing from {@code fromObject}; may be
 *                     {@code null}
 * @param previousName former physical name; migration renames it to
 *                     {@code name}; may be {@code null}
 */
public record ColumnDefinition(String name, ColumnType type, boolean primaryKey, boolean sensitive,
        Object defaultValue, String previousName) {

    public ColumnDefinition {
        Identifiers.requireValid(name, "column");
        Objects.requireNonNull(type, "type");
        if (previousName != null) {
            Identifiers.requireValid(previousName, "previous column");
            if (previousName.equals(name))
                throw new IllegalArgumentException("Column '" + name + "' cannot be renamed from itself");
        }
        defaultValue = type.coerce(defaultValue);
    }

    public static ColumnDefinition text(String name) {
        return new ColumnDefinition(name, ColumnType.TEXT, false, false, null, null);
    }

    public static ColumnDefinition integer(String name) {
        return new ColumnDefinition(name, ColumnType.INTEGER, false, false, null, null);
    }

    public ColumnDefinition asPrimaryKey() {
        return new ColumnDefinition(name, type, true, sensitive, defaultValue, previousName);
    }

    public ColumnDefinition asSensitive() {
        return new ColumnDefinition(name, type, primaryKey, true, defaultValue, previousName);
    }

    public ColumnDefinition withDefault(Object value) {
        return new ColumnDefinition(name, type, primaryKey, sensitive, value, previousName);
    }

    public ColumnDefinition renamedFrom(String oldName) {
        return new ColumnDefinition(name, type, primaryKey, sensitive, defaultValue, oldName);
    }
}
