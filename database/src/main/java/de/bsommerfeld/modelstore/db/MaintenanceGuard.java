package de.bsommerfeld.modelstore.db;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Busy signal shared by backup and vacuum. At most one holder at a time; a
 * caller that fails to acquire it reports {@link Result#BUSY} instead of
 * waiting.
 */
final class MaintenanceGuard {

    private final AtomicBoolean busy = new AtomicBoolean(false);

    boolean tryAcquire() {
        return busy.compareAndSet(false, true);
    }

    void release() {
        busy.set(false);
    }

    boolean isBusy() {
        return busy.get();
    }
}
