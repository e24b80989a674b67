package de.bsommerfeld.modelstore.db;

import com.google.inject.AbstractModule;
import com.google.inject.Scopes;
import de.bsommerfeld.modelstore.core.event.StorageEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for the storage layer. The caller supplies the options; the
 * module binds them together with a shared {@link StorageEventBus} and a
 * singleton {@link Database}. Opening the database is left to the caller.
 */
public class StorageModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(StorageModule.class);

    private final DatabaseOptions options;

    public StorageModule(DatabaseOptions options) {
        this.options = options;
    }

    @Override
    protected void configure() {
        LOG.debug("Binding storage at {}", options.getStoragePath());
        bind(DatabaseOptions.class).toInstance(options);
        bind(StorageEventBus.class).in(Scopes.SINGLETON);
        bind(Database.class).in(Scopes.SINGLETON);
    }
}
