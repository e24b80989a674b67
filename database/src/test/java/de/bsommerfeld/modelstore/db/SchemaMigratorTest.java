package de.bsommerfeld.modelstore.db;

import de.bsommerfeld.modelstore.db.schema.ColumnDefinition;
import de.bsommerfeld.modelstore.db.schema.Schema;
import de.bsommerfeld.modelstore.db.schema.TableDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Integration tests for SchemaMigrator against a real temporary SQLite
 * database. Each test seeds a physical layout by hand and checks what the
 * migrator makes of it.
 */
@ExtendWith(MockitoExtension.class)
class SchemaMigratorTest {

    private static final TableDefinition ITEMS = TableDefinition.of("items",
            ColumnDefinition.text("id").asPrimaryKey(),
            ColumnDefinition.text("url"),
            ColumnDefinition.integer("size").withDefault(0));

    @TempDir
    Path tempDir;

    @Mock
    private ErrorCallback errorCallback;

    private Connection conn;
    private RowStore rows;

    @BeforeEach
    void setUp() throws SQLException {
        conn = DriverManager.getConnection("jdbc:sqlite:" + tempDir.resolve("migrate.db").toAbsolutePath());
        rows = new RowStore(() -> conn, new ErrorReporter(errorCallback));
    }

    @AfterEach
    void tearDown() throws SQLException {
        conn.close();
    }

    // -- Create --

    @Test
    void migrate_shouldCreateMissingTables() throws SQLException {
        MigrationReport report = migrator(false, false).migrate(Schema.of(ITEMS));

        assertTrue(report.isSuccessful());
        assertEquals(List.of("created table items"), report.changes());
        assertEquals(List.of("id", "url", "size"), columnNames("items"));
        assertTrue(rows.tableInfo("items").get(0).primaryKey());
    }

    @Test
    void migrate_shouldBeIdempotent() {
        SchemaMigrator migrator = migrator(true, true);
        migrator.migrate(Schema.of(ITEMS));

        MigrationReport second = migrator.migrate(Schema.of(ITEMS));

        assertTrue(second.isSuccessful());
        assertTrue(second.changes().isEmpty(), "Second run should not change anything: " + second.changes());
    }

    // -- Columns --

    @Test
    void migrate_shouldAddMissingColumnsAndFillDefaults() throws SQLException {
        sql("CREATE TABLE items (id TEXT PRIMARY KEY, url TEXT)");
        sql("INSERT INTO items VALUES ('a', 'http://x')");

        MigrationReport report = migrator(false, false).migrate(Schema.of(ITEMS));

        assertEquals(List.of("added column items.size"), report.changes());
        Map<String, Object> row = rows.selectOne("items", "id", "a").row();
        assertEquals(0, ((Number) row.get("size")).intValue());
    }

    @Test
    void migrate_shouldRenameColumnsFromTheirPreviousName() throws SQLException {
        sql("CREATE TABLE items (id TEXT PRIMARY KEY, download_url TEXT, size INTEGER)");
        sql("INSERT INTO items VALUES ('a', 'http://x', 5)");
        TableDefinition renamed = TableDefinition.of("items",
                ColumnDefinition.text("id").asPrimaryKey(),
                ColumnDefinition.text("url").renamedFrom("download_url"),
                ColumnDefinition.integer("size"));
        SchemaMigrator migrator = migrator(false, false);

        MigrationReport first = migrator.migrate(Schema.of(renamed));
        MigrationReport second = migrator.migrate(Schema.of(renamed));

        assertEquals(List.of("renamed column items.download_url -> url"), first.changes());
        assertTrue(second.changes().isEmpty());
        assertEquals("http://x", rows.selectOne("items", "id", "a").row().get("url"));
    }

    @Test
    void renameColumn_shouldReportConflictWhenTargetExists() throws SQLException {
        sql("CREATE TABLE items (id TEXT PRIMARY KEY, download_url TEXT, url TEXT)");

        Result result = migrator(false, false).renameColumn("items", "download_url", "url");

        assertEquals(Result.CONFLICT, result.code());
        assertEquals(List.of("id", "download_url", "url"), columnNames("items"));
    }

    @Test
    void renameColumn_shouldReportMissingSource() throws SQLException {
        sql("CREATE TABLE items (id TEXT PRIMARY KEY, url TEXT)");

        Result result = migrator(false, false).renameColumn("items", "download_url", "link");

        assertEquals(Result.NOT_FOUND, result.code());
    }

    @Test
    void migrate_withRenameConflict_shouldStillSucceed() throws SQLException {
        sql("CREATE TABLE items (id TEXT PRIMARY KEY, download_url TEXT, url TEXT, size INTEGER)");
        TableDefinition renamed = TableDefinition.of("items",
                ColumnDefinition.text("id").asPrimaryKey(),
                ColumnDefinition.text("url").renamedFrom("download_url"),
                ColumnDefinition.integer("size"));

        MigrationReport report = migrator(false, false).migrate(Schema.of(renamed));

        assertTrue(report.isSuccessful());
        assertTrue(report.changes().isEmpty());
        assertTrue(rows.columnExists("items", "download_url"));
    }

    @Test
    void migrate_withDeleteUnused_shouldDropUndeclaredColumns() throws SQLException {
        sql("CREATE TABLE items (id TEXT PRIMARY KEY, url TEXT, legacy TEXT, size INTEGER)");
        sql("INSERT INTO items VALUES ('a', 'http://x', 'old', 3)");

        MigrationReport report = migrator(true, false).migrate(Schema.of(ITEMS));

        assertEquals(List.of("dropped column items.legacy"), report.changes());
        assertEquals(List.of("id", "url", "size"), columnNames("items"));
        assertEquals("http://x", rows.selectOne("items", "id", "a").row().get("url"));
    }

    @Test
    void migrate_withoutDeleteUnused_shouldKeepUndeclaredColumns() throws SQLException {
        sql("CREATE TABLE items (id TEXT PRIMARY KEY, url TEXT, legacy TEXT, size INTEGER)");

        MigrationReport report = migrator(false, false).migrate(Schema.of(ITEMS));

        assertTrue(report.changes().isEmpty());
        assertTrue(rows.columnExists("items", "legacy"));
    }

    @Test
    void migrate_shouldRebuildTableWhenNativeDropIsRejected() throws SQLException {
        sql("CREATE TABLE items (legacy_id TEXT PRIMARY KEY, id TEXT, url TEXT)");
        sql("INSERT INTO items VALUES ('L1', 'a', 'http://x')");
        sql("INSERT INTO items VALUES ('L2', 'b', 'http://y')");
        TableDefinition keyless = TableDefinition.of("items",
                ColumnDefinition.text("id"),
                ColumnDefinition.text("url"));

        MigrationReport report = migrator(true, false).migrate(Schema.of(keyless));

        assertTrue(report.isSuccessful());
        assertEquals(List.of("dropped column items.legacy_id"), report.changes());
        assertEquals(List.of("id", "url"), columnNames("items"));
        assertEquals("http://y", rows.selectOne("items", "id", "b").row().get("url"));
        assertFalse(rows.tableExists("_rebuild_items"));
    }

    // -- Reorder --

    @Test
    void migrate_withReorder_shouldRestoreDeclaredOrderAndKeepData() throws SQLException {
        sql("CREATE TABLE items (size INTEGER, url TEXT, id TEXT PRIMARY KEY)");
        sql("INSERT INTO items VALUES (10, 'http://x', 'a')");
        sql("INSERT INTO items VALUES (20, 'http://y', 'b')");
        List<Map<String, Object>> before = rows.execute("SELECT id, url, size FROM items ORDER BY id", List.of()).rows();

        MigrationReport report = migrator(false, true).migrate(Schema.of(ITEMS));

        assertEquals(List.of("reordered columns of items to [id, url, size]"), report.changes());
        assertEquals(List.of("id", "url", "size"), columnNames("items"));
        assertTrue(rows.tableInfo("items").get(0).primaryKey());
        assertEquals(before, rows.execute("SELECT id, url, size FROM items ORDER BY id", List.of()).rows());
    }

    @Test
    void reorderColumns_shouldAppendUndeclaredLeftovers() throws SQLException {
        sql("CREATE TABLE items (extra TEXT, url TEXT, id TEXT PRIMARY KEY, size INTEGER)");
        sql("INSERT INTO items VALUES ('e', 'http://x', 'a', 1)");
        MigrationReport report = new MigrationReport();

        Result result = migrator(false, true).reorderColumns(ITEMS, report);

        assertTrue(result.succeeded());
        assertEquals(List.of("id", "url", "size", "extra"), columnNames("items"));
        assertEquals("e", rows.selectOne("items", "id", "a").row().get("extra"));
    }

    @Test
    void reorderColumns_shouldDoNothingWhenOrderMatches() throws SQLException {
        sql("CREATE TABLE items (id TEXT PRIMARY KEY, url TEXT, size INTEGER, extra TEXT)");
        MigrationReport report = new MigrationReport();

        Result result = migrator(false, true).reorderColumns(ITEMS, report);

        assertTrue(result.isOk());
        assertFalse(result.succeeded());
        assertTrue(report.changes().isEmpty());
    }

    // -- Prune & failures --

    @Test
    void migrate_withDeleteUnused_shouldDropUndeclaredTables() throws SQLException {
        sql("CREATE TABLE stale (v TEXT)");
        sql("CREATE TABLE counters (n INTEGER PRIMARY KEY AUTOINCREMENT)");
        sql("INSERT INTO counters DEFAULT VALUES");
        TableDefinition counters = TableDefinition.of("counters", ColumnDefinition.integer("n").asPrimaryKey());

        MigrationReport report = migrator(true, false).migrate(Schema.of(ITEMS, counters));

        assertTrue(report.isSuccessful());
        assertTrue(report.changes().contains("dropped table stale"));
        assertFalse(rows.tableExists("stale"));
        assertTrue(rows.tableExists("sqlite_sequence"));
    }

    @Test
    void migrate_shouldIsolateFailingTableAndSkipPruning() throws SQLException {
        sql("CREATE TABLE stale (v TEXT)");
        sql("CREATE VIEW broken AS SELECT 1 AS v");
        TableDefinition broken = TableDefinition.of("broken", ColumnDefinition.text("v"));

        MigrationReport report = migrator(true, false).migrate(Schema.of(broken, ITEMS));

        assertFalse(report.isSuccessful());
        assertEquals(List.of("broken"), List.copyOf(report.failedTables()));
        assertTrue(report.changes().contains("created table items"));
        assertTrue(rows.tableExists("stale"), "Pruning must be skipped after a failure");
        verify(errorCallback).onError(eq("migrate:broken"), any(SQLException.class));
    }

    private SchemaMigrator migrator(boolean deleteUnused, boolean reorder) {
        return new SchemaMigrator(rows, new ErrorReporter(errorCallback), deleteUnused, reorder);
    }

    private List<String> columnNames(String table) throws SQLException {
        return rows.tableInfo(table).stream().map(PhysicalColumn::name).toList();
    }

    private void sql(String statement) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(statement);
        }
    }
}
