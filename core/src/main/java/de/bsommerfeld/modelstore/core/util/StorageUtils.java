package de.bsommerfeld.modelstore.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Path helpers for locating storage and backup files.
 *
 * <p>
 * The default data root is {@code ~/Library/Application Support} on macOS,
 * {@code %APPDATA%} on Windows and {@code $XDG_DATA_HOME} (or
 * {@code ~/.local/share}) elsewhere.
 */
public final class StorageUtils {

    private StorageUtils() {
    }

    /**
     * Resolves the per-user folder a storage file lands in when no explicit
     * path is configured. Nothing is created here; {@code Database.open()}
     * creates missing parent directories itself.
     *
     * @param appName name of the sub-folder under the OS data root
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        Path path;

        if (os.contains("mac") || os.contains("darwin")) {
            path = Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        } else if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null) {
                path = Paths.get(appData, appName);
            } else {
                path = Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
            }
        } else {
            String xdgData = System.getenv("XDG_DATA_HOME");
            if (xdgData != null && !xdgData.isEmpty()) {
                path = Paths.get(xdgData, appName);
            } else {
                path = Paths.get(System.getProperty("user.home"), ".local", "share", appName);
            }
        }
        return path.toAbsolutePath();
    }

    /**
     * Returns the sibling path of {@code file} whose extension is replaced by
     * {@code newExtension}: {@code data/store.db} with {@code ".db.bak"} becomes
     * {@code data/store.db.bak}, {@code data/store} becomes
     * {@code data/store.db.bak}.
     *
     * @param file         the source file path
     * @param newExtension extension including the leading dot
     * @return path in the same directory as {@code file}
     */
    public static Path withExtension(Path file, String newExtension) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return file.resolveSibling(base + newExtension);
    }
}
