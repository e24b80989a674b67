package de.bsommerfeld.modelstore.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs an engine error and forwards it to the configured {@link ErrorCallback}. */
final class ErrorReporter {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorReporter.class);

    private final ErrorCallback callback;

    ErrorReporter(ErrorCallback callback) {
        this.callback = callback == null ? ErrorCallback.NONE : callback;
    }

    void report(String location, Throwable error) {
        LOG.error("[DB] {} failed: {}", location, error.getMessage(), error);
        try {
            callback.onError(location, error);
        } catch (RuntimeException e) {
            LOG.warn("Error callback threw while handling '{}'", location, e);
        }
    }
}
