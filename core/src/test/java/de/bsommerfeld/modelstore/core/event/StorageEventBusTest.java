package de.bsommerfeld.modelstore.core.event;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StorageEventBusTest {

    @Test
    void post_shouldDeliverEventToRegisteredListener() {
        var eventBus = new StorageEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post("backup-done");

        assertEquals("backup-done", received.get());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new StorageEventBus("test-bus");
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post("first");
        eventBus.unregister(listener);
        eventBus.post("second");

        assertEquals("first", received.get());
    }

    @Test
    void post_shouldIgnoreEventsWithoutSubscriber() {
        var eventBus = new StorageEventBus();
        assertDoesNotThrow(() -> eventBus.post(42));
    }
}
