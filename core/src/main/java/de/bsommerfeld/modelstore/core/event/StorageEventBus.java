package de.bsommerfeld.modelstore.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} used by the storage layer to
 * announce lifecycle and maintenance outcomes (state changes, finished
 * backups, finished vacuums) without coupling to whoever listens.
 *
 * <p>
 * Delivery is synchronous on the posting thread. For the database module that
 * is the statement thread, so listeners must not block.
 */
@Singleton
public class StorageEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(StorageEventBus.class);
    private final EventBus eventBus;

    public StorageEventBus() {
        this("modelstore");
    }

    public StorageEventBus(String identifier) {
        this.eventBus = new EventBus(identifier);
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
