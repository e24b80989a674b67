package de.bsommerfeld.modelstore.db.schema;

import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * The complete declared layout: table name to {@link TableDefinition}, in
 * declaration order. Immutable once built.
 */
public final class Schema {

    private static final Schema EMPTY = new Schema(ImmutableMap.of());

    private final ImmutableMap<String, TableDefinition> tables;

    private Schema(ImmutableMap<String, TableDefinition> tables) {
        this.tables = tables;
    }

    public static Schema empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException if two tables share a name
     */
    public static Schema of(TableDefinition... tables) {
        Builder builder = builder();
        for (TableDefinition table : tables)
            builder.table(table);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Collection<TableDefinition> tables() {
        return tables.values();
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }

    public Optional<TableDefinition> table(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    public boolean contains(String name) {
        return tables.containsKey(name);
    }

    @Override
    public String toString() {
        return "Schema" + tables.keySet();
    }

    public static final class Builder {

        private final ImmutableMap.Builder<String, TableDefinition> tables = ImmutableMap.builder();

        private Builder() {
        }

        public Builder table(TableDefinition table) {
            tables.put(table.name(), table);
            return this;
        }

        public Builder table(String name, ColumnDefinition... columns) {
            return table(TableDefinition.of(name, columns));
        }

        public Schema build() {
            return new Schema(tables.buildOrThrow());
        }
    }
}
