package de.bsommerfeld.modelstore.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Statements that only bind values are used as-is. Statements that need
 * identifiers (table and column names) are {@link String#format} templates;
 * {@link #format(String, Object...)} fills them with names that have already
 * been passed through {@link de.bsommerfeld.modelstore.db.schema.Identifiers#quote}.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql},
 * e.g. {@code select-rows.sql}, {@code rename-column.sql}.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath,
     * trimmed and cached.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /** Loads the template {@code name} and fills its {@code %s} slots. */
    public static String format(String name, Object... quotedParts) {
        return String.format(load(name), quotedParts);
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
