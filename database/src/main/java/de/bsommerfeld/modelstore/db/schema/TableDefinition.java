package de.bsommerfeld.modelstore.db.schema;

import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A declared table: its name and its columns in declared (physical) order.
 * At most one column may be the primary key. Tables without one are read-only
 * from the model's point of view.
 */
public record TableDefinition(String name, List<ColumnDefinition> columns) {

    public TableDefinition {
        Identifiers.requireValid(name, "table");
        columns = ImmutableList.copyOf(columns);
        if (columns.isEmpty())
            throw new IllegalArgumentException("Table '" + name + "' declares no columns");

        Set<String> seen = new HashSet<>();
        int keys = 0;
        for (ColumnDefinition column : columns) {
            if (!seen.add(column.name()))
                throw new IllegalArgumentException("Duplicate column '" + column.name() + "' in table '" + name + "'");
            if (column.primaryKey())
                keys++;
        }
        if (keys > 1)
            throw new IllegalArgumentException("Table '" + name + "' declares more than one primary key");
    }

    public static TableDefinition of(String name, ColumnDefinition... columns) {
        return new TableDefinition(name, List.of(columns));
    }

    public Optional<ColumnDefinition> primaryKey() {
        return columns.stream().filter(ColumnDefinition::primaryKey).findFirst();
    }

    public Optional<ColumnDefinition> column(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }

    public boolean hasColumn(String columnName) {
        return column(columnName).isPresent();
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDefinition::name).collect(ImmutableList.toImmutableList());
    }
}
