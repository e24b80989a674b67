package de.bsommerfeld.modelstore.db.schema;

/**
 * Storage types a declared column may use. Values entering an instance are
 * normalized with {@link #coerce(Object)} so that change detection compares
 * like with like, regardless of whether the caller passed an {@code int} or
 * the driver returned an {@code Integer}.
 */
public enum ColumnType {

    TEXT("TEXT"),
    INTEGER("INTEGER");

    private final String sqlType;

    ColumnType(String sqlType) {
        this.sqlType = sqlType;
    }

    public String sqlType() {
        return sqlType;
    }

    /**
     * Normalizes a value to this type's Java representation: {@link Long} for
     * {@code INTEGER}, {@link String} for {@code TEXT}. {@code null} stays
     * {@code null}. Values that cannot be represented (e.g. non-numeric text in
     * an {@code INTEGER} column, which SQLite happily stores) are returned
     * unchanged.
     */
    public Object coerce(Object value) {
        if (value == null)
            return null;
        switch (this) {
            case INTEGER:
                if (value instanceof Long)
                    return value;
                if (value instanceof Number)
                    return ((Number) value).longValue();
                if (value instanceof Boolean)
                    return ((Boolean) value) ? 1L : 0L;
                if (value instanceof String) {
                    try {
                        return Long.parseLong(((String) value).trim());
                    } catch (NumberFormatException e) {
                        return value;
                    }
                }
                return value;
            case TEXT:
                if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean)
                    return value.toString();
                return value;
            default:
                throw new IllegalStateException("Unhandled column type " + this);
        }
    }
}
