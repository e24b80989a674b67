package de.bsommerfeld.modelstore.db;

import de.bsommerfeld.modelstore.db.schema.ColumnDefinition;
import de.bsommerfeld.modelstore.db.schema.Identifiers;

import java.util.regex.Pattern;

/**
 * A column as the engine reports it, which may differ from what is declared.
 *
 * @param name       physical column name
 * @param type       declared SQL type as stored in the catalog, may be empty
 * @param primaryKey whether the column is (part of) the table's primary key
 */
public record PhysicalColumn(String name, String type, boolean primaryKey) {

    private static final Pattern SAFE_TYPE = Pattern.compile("[A-Za-z0-9_ (),]*");

    static PhysicalColumn of(ColumnDefinition column) {
        return new PhysicalColumn(column.name(), column.type().sqlType(), column.primaryKey());
    }

    /**
     * Column clause for {@code CREATE TABLE}: quoted name, type and, when
     * {@code inlineKey} is set and this is the key column, the key constraint.
     */
    String ddl(boolean inlineKey) {
        StringBuilder sb = new StringBuilder(Identifiers.quote(name));
        if (type != null && !type.isBlank() && SAFE_TYPE.matcher(type).matches())
            sb.append(' ').append(type);
        if (inlineKey && primaryKey)
            sb.append(" PRIMARY KEY");
        return sb.toString();
    }
}
