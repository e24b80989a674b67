package de.bsommerfeld.modelstore.db;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable copy of an instance's values as they were last loaded or
 * persisted. {@link Instance#save()} compares against it field by field to
 * find the columns that actually need writing. {@code null} values are
 * allowed.
 */
public final class RowSnapshot {

    private final Map<String, Object> values;

    private RowSnapshot(Map<String, Object> values) {
        this.values = values;
    }

    public static RowSnapshot of(Map<String, ?> values) {
        return new RowSnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public Object get(String column) {
        return values.get(column);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Returns the {@code candidates} whose value in {@code current} differs from
     * this snapshot, in candidate order.
     */
    public List<String> changedColumns(Map<String, ?> current, Collection<String> candidates) {
        List<String> changed = new ArrayList<>();
        for (String column : candidates) {
            if (!Objects.equals(values.get(column), current.get(column)))
                changed.add(column);
        }
        return changed;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RowSnapshot && values.equals(((RowSnapshot) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RowSnapshot" + values;
    }
}
