package de.bsommerfeld.modelstore.db;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.modelstore.core.event.StorageEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Lifecycle, passthrough and event tests for the Database facade.
 */
@ExtendWith(MockitoExtension.class)
class DatabaseTest {

    @TempDir
    Path tempDir;

    @Mock
    private ErrorCallback errorCallback;

    private Database database;

    @AfterEach
    void tearDown() {
        if (database != null)
            database.close().join();
    }

    // -- Open --

    @Test
    void open_shouldReachReadyAndReportCreatedTables() {
        database = new Database(Fixtures.options(tempDir, errorCallback));
        assertEquals(DatabaseState.CONSTRUCTED, database.state());

        Result opened = database.open().join();

        assertEquals(Result.OK, opened.code());
        assertEquals(DatabaseState.READY, database.state());
        assertTrue(opened.info().contains("created table items"));
        assertEquals(Fixtures.SCHEMA.tableNames().size(), opened.info().size());
        assertTrue(Files.exists(tempDir.resolve("store.db")));
    }

    @Test
    void open_onConformantStorage_shouldApplyNoChanges() {
        DatabaseOptions options = Fixtures.options(tempDir, errorCallback);
        Database first = Fixtures.openDatabase(options);
        first.close().join();

        database = new Database(options);
        Result second = database.open().join();

        assertTrue(second.isOk());
        assertTrue(second.info().isEmpty(), "Expected no changes but got " + second.info());
    }

    @Test
    void open_afterClose_shouldReopenSameInstance() {
        database = Fixtures.openDatabase(Fixtures.options(tempDir, errorCallback));
        database.model("items").create("a", "http://x", 1).save().join();
        database.close().join();
        assertEquals(DatabaseState.CLOSED, database.state());

        Result reopened = database.open().join();

        assertTrue(reopened.isOk());
        assertTrue(reopened.info().isEmpty());
        assertTrue(database.model("items").find("a").join().isPresent());
    }

    @Test
    void open_whileReady_shouldThrow() {
        database = Fixtures.openDatabase(Fixtures.options(tempDir, errorCallback));

        assertThrows(IllegalStateException.class, () -> database.open());
    }

    @Test
    void open_withFailingMigration_shouldEndInFailedState() throws SQLException {
        Path storage = tempDir.resolve("store.db");
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + storage.toAbsolutePath());
                Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE VIEW items AS SELECT 1 AS id");
        }
        database = new Database(Fixtures.options(tempDir, errorCallback));

        Result opened = database.open().join();

        assertEquals(Result.FAILURE, opened.code());
        assertEquals(DatabaseState.FAILED, database.state());
        assertThrows(IllegalStateException.class, () -> database.model("archive").all());
        assertThrows(IllegalStateException.class, () -> database.open());
        assertFalse(database.close().join().succeeded());
        verify(errorCallback).onError(eq("migrate:items"), any(SQLException.class));
    }

    // -- Close --

    @Test
    void close_shouldTakeFinalBackupAndRejectFurtherWork() {
        database = Fixtures.openDatabase(Fixtures.options(tempDir, errorCallback));
        Model items = database.model("items");

        Result closed = database.close().join();

        assertTrue(closed.succeeded());
        assertEquals(DatabaseState.CLOSED, database.state());
        assertTrue(Files.exists(tempDir.resolve("store.db.bak")));
        assertThrows(IllegalStateException.class, items::all);
        assertThrows(IllegalStateException.class, () -> database.execute("SELECT 1"));
    }

    @Test
    void close_whileMaintenanceHoldsBusySignal_shouldCloseWithoutFinalBackup() {
        database = Fixtures.openDatabase(Fixtures.options(tempDir, errorCallback));
        assertTrue(database.maintenanceGuard().tryAcquire());

        Result closed = database.close().join();

        assertTrue(closed.succeeded());
        assertEquals(DatabaseState.CLOSED, database.state());
        assertFalse(Files.exists(tempDir.resolve("store.db.bak")));
        verifyNoInteractions(errorCallback);
    }

    @Test
    void close_shouldRunAfterPreviouslySubmittedWork() {
        database = Fixtures.openDatabase(Fixtures.options(tempDir, errorCallback));
        Model items = database.model("items");

        var save = items.create("a", "http://x", 1).save();
        database.close().join();

        assertTrue(save.isDone());
        assertTrue(save.join().succeeded());
    }

    @Test
    void close_beforeOpen_shouldDoNothing() {
        database = new Database(Fixtures.options(tempDir, errorCallback));

        Result closed = database.close().join();

        assertTrue(closed.isOk());
        assertFalse(closed.succeeded());
        assertEquals(DatabaseState.CONSTRUCTED, database.state());
    }

    // -- Events --

    @Test
    void lifecycle_shouldPublishStateChanges() {
        StorageEventBus eventBus = new StorageEventBus("test");
        StateRecorder recorder = new StateRecorder();
        eventBus.register(recorder);
        database = new Database(Fixtures.options(tempDir, errorCallback), eventBus);

        database.open().join();
        database.close().join();

        assertEquals(List.of(
                DatabaseState.OPENING,
                DatabaseState.READY,
                DatabaseState.CLOSING,
                DatabaseState.CLOSED), recorder.states);
        assertEquals(1, recorder.migrations.size());
        assertTrue(recorder.migrations.get(0).successful());
    }

    // -- Passthrough --

    @Test
    void execute_shouldRunRawStatements() {
        database = Fixtures.openDatabase(Fixtures.options(tempDir, errorCallback));

        Result inserted = database.execute("INSERT INTO items VALUES (?, ?, ?)", "a", "http://x", 1).join();
        Result queried = database.execute("SELECT url FROM items WHERE id = ?", "a").join();

        assertEquals(1, inserted.changes());
        assertEquals("http://x", queried.rows().get(0).get("url"));
    }

    @Test
    void rollback_shouldDiscardOpenTransaction() {
        database = Fixtures.openDatabase(Fixtures.options(tempDir, errorCallback));
        Model items = database.model("items");

        database.execute("BEGIN").join();
        items.create("a", "http://x", 1).save().join();
        Result rolledBack = database.rollback().join();

        assertTrue(rolledBack.isOk());
        assertTrue(items.find("a").join().isEmpty());
    }

    @Test
    void commit_shouldKeepOpenTransaction() {
        database = Fixtures.openDatabase(Fixtures.options(tempDir, errorCallback));
        Model items = database.model("items");

        database.execute("BEGIN").join();
        items.create("a", "http://x", 1).save().join();
        Result committed = database.commit().join();

        assertTrue(committed.isOk());
        assertTrue(items.find("a").join().isPresent());
    }

    @Test
    void commit_withoutTransaction_shouldReportFailure() {
        database = Fixtures.openDatabase(Fixtures.options(tempDir, errorCallback));

        Result result = database.commit().join();

        assertEquals(Result.FAILURE, result.code());
        verify(errorCallback).onError(eq("commit"), any(SQLException.class));
    }

    @Test
    void throwingErrorCallback_shouldNotEscape() {
        DatabaseOptions options = Fixtures.options(tempDir, (location, error) -> {
            throw new IllegalStateException("callback failure");
        });
        database = Fixtures.openDatabase(options);

        Result result = database.commit().join();

        assertEquals(Result.FAILURE, result.code());
    }

    // -- Accessors --

    @Test
    void model_shouldRejectUndeclaredTable() {
        database = new Database(Fixtures.options(tempDir, errorCallback));

        assertThrows(ConfigurationException.class, () -> database.model("nope"));
        assertEquals(List.copyOf(Fixtures.SCHEMA.tableNames()), List.copyOf(database.models().keySet()));
    }

    @Test
    void backupPath_shouldDefaultToSiblingOfStorage() {
        database = new Database(Fixtures.options(tempDir, errorCallback));

        assertEquals(tempDir.resolve("store.db.bak"), database.backupPath());
        assertEquals(tempDir.resolve("store.db").toAbsolutePath(), database.storagePath());
    }

    static class StateRecorder {
        final List<DatabaseState> states = new CopyOnWriteArrayList<>();
        final List<StorageEvents.MigrationCompletedEvent> migrations = new CopyOnWriteArrayList<>();

        @Subscribe
        public void onStateChanged(StorageEvents.StateChangedEvent event) {
            states.add(event.to());
        }

        @Subscribe
        public void onMigration(StorageEvents.MigrationCompletedEvent event) {
            migrations.add(event);
        }
    }
}
