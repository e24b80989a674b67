package de.bsommerfeld.modelstore.db;

/**
 * Receives engine errors after they have been logged. {@code location} names
 * the failing operation, e.g. {@code "insert"}, {@code "migrate:items"} or
 * {@code "backup"}.
 */
@FunctionalInterface
public interface ErrorCallback {

    ErrorCallback NONE = (location, error) -> {
    };

    void onError(String location, Throwable error);
}
