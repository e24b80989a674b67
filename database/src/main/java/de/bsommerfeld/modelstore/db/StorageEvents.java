package de.bsommerfeld.modelstore.db;

import java.nio.file.Path;
import java.util.List;

/**
 * Notifications published on the
 * {@link de.bsommerfeld.modelstore.core.event.StorageEventBus}. Listeners
 * run on whichever thread posts, usually the statement thread, so they must
 * not block.
 */
public final class StorageEvents {

    private StorageEvents() {
    }

    public record StateChangedEvent(DatabaseState from, DatabaseState to) {
    }

    /** Posted after every migration run, successful or not. */
    public record MigrationCompletedEvent(List<String> changes, List<String> failedTables) {
        public boolean successful() {
            return failedTables.isEmpty();
        }
    }

    public record BackupCompletedEvent(Path destination, Result result) {
    }

    public record VacuumCompletedEvent(Result result) {
    }
}
