package de.bsommerfeld.modelstore.db.schema;

import java.util.regex.Pattern;

/**
 * Identifier rules for table and column names. Declared names must be plain
 * SQL identifiers; every name that ends up inside a statement (declared or
 * read back from the engine catalog) goes through {@link #quote(String)}.
 * Predicate values are never interpolated, they are always bound.
 */
public final class Identifiers {

    private static final Pattern VALID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private Identifiers() {
    }

    public static boolean isValid(String name) {
        return name != null && VALID.matcher(name).matches();
    }

    /**
     * @throws IllegalArgumentException if {@code name} is not a plain identifier
     */
    public static String requireValid(String name, String kind) {
        if (!isValid(name)) {
            throw new IllegalArgumentException("Invalid " + kind + " name: '" + name + "'");
        }
        return name;
    }

    /**
     * Double-quotes an identifier, doubling embedded quotes.
     *
     * @throws IllegalArgumentException for null, empty or NUL-containing names
     */
    public static String quote(String name) {
        if (name == null || name.isEmpty() || name.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Cannot quote identifier: '" + name + "'");
        }
        return '"' + name.replace("\"", "\"\"") + '"';
    }
}
