package de.bsommerfeld.modelstore.db;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.modelstore.core.event.StorageEventBus;
import de.bsommerfeld.modelstore.db.schema.Schema;
import de.bsommerfeld.modelstore.db.schema.TableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Entry point of the storage layer: owns the SQLite connection, migrates it to
 * the configured {@link Schema} on {@link #open()} and hands out one
 * {@link Model} per declared table.
 *
 * <h3>Threading</h3>
 * One JDBC {@link Connection} per instance, confined to a single statement
 * thread. Every statement (CRUD, migration, vacuum and the backup copy) runs
 * there, in submission order, and every public operation returns a
 * {@link CompletableFuture} completed on that thread. Nothing here blocks
 * the caller.
 *
 * <h3>Lifecycle</h3>
 * See {@link DatabaseState}. Model operations and passthroughs require
 * {@link DatabaseState#READY} and throw {@link IllegalStateException}
 * otherwise. A closed database may be opened again; a failed one may not.
 *
 * @see MaintenanceScheduler
 * @see SchemaMigrator
 */
@Singleton
public class Database {

    private static final Logger LOG = LoggerFactory.getLogger(Database.class);

    private final DatabaseOptions options;
    private final StorageEventBus eventBus;
    private final Schema schema;
    private final Path storagePath;
    private final ErrorReporter errors;
    private final RowStore rows;
    private final SchemaMigrator migrator;
    private final MaintenanceGuard guard = new MaintenanceGuard();
    private final ImmutableMap<String, Model> models;

    private volatile DatabaseState state = DatabaseState.CONSTRUCTED;
    private volatile Connection connection;
    private volatile ExecutorService statementExecutor;
    private MaintenanceScheduler scheduler;

    @Inject
    public Database(DatabaseOptions options, StorageEventBus eventBus) {
        this.options = options;
        this.eventBus = eventBus;
        this.schema = options.getSchema();
        this.storagePath = options.getStoragePath().toAbsolutePath();
        this.errors = new ErrorReporter(options.getErrorCallback());
        this.rows = new RowStore(() -> connection, errors);
        this.migrator = new SchemaMigrator(rows, errors, options.isDeleteUnused(), options.isReorder());

        ImmutableMap.Builder<String, Model> builder = ImmutableMap.builder();
        for (TableDefinition table : schema.tables())
            builder.put(table.name(), new Model(this, table));
        this.models = builder.build();
    }

    public Database(DatabaseOptions options) {
        this(options, new StorageEventBus());
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /**
     * Connects, migrates the storage to the schema and starts the enabled
     * maintenance timers. The result's {@code info} lists the structural
     * changes applied; it is empty when the storage already matched.
     *
     * <p>
     * A connection or migration failure completes the future with a
     * {@link Result#FAILURE} result and leaves the database
     * {@link DatabaseState#FAILED}.
     *
     * @throws IllegalStateException if the database is not
     *                               {@link DatabaseState#CONSTRUCTED} or
     *                               {@link DatabaseState#CLOSED}
     */
    public synchronized CompletableFuture<Result> open() {
        if (!state.canOpen())
            throw new IllegalStateException("Cannot open database in state " + state);

        transition(DatabaseState.OPENING);
        ExecutorService executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("modelstore-db-%d")
                .setDaemon(true)
                .build());
        statementExecutor = executor;
        return CompletableFuture.supplyAsync(() -> openNow(executor), executor);
    }

    private Result openNow(ExecutorService executor) {
        LOG.info("[DB] Opening {}", storagePath);
        try {
            Path parent = storagePath.getParent();
            if (parent != null)
                Files.createDirectories(parent);
            connection = DriverManager.getConnection("jdbc:sqlite:" + storagePath);
        } catch (IOException | SQLException e) {
            errors.report("open", e);
            return fail(executor, Result.failure());
        }

        MigrationReport report = migrator.migrate(schema);
        eventBus.post(new StorageEvents.MigrationCompletedEvent(List.copyOf(report.changes()),
                List.copyOf(report.failedTables())));
        if (!report.isSuccessful()) {
            LOG.error("[DB] Migration failed for {}", report.failedTables());
            return fail(executor, Result.failure().withInfo(report.changes()));
        }

        MaintenanceScheduler maintenance = new MaintenanceScheduler(rows, guard, executor, options, eventBus, errors);
        try {
            maintenance.start();
        } catch (IllegalArgumentException e) {
            errors.report("open", e);
            return fail(executor, Result.failure().withInfo(report.changes()));
        }

        synchronized (this) {
            scheduler = maintenance;
            transition(DatabaseState.READY);
        }
        LOG.info("[DB] Ready: {} tables, {} migration changes", models.size(), report.changes().size());
        return Result.ok().withInfo(report.changes());
    }

    private Result fail(ExecutorService executor, Result result) {
        closeConnection();
        executor.shutdown();
        transition(DatabaseState.FAILED);
        return result;
    }

    /**
     * Stops the timers, takes one final backup to the configured backup path
     * and releases the connection once every previously submitted operation
     * has run. Closing a database that is not {@link DatabaseState#READY} does
     * nothing and reports {@code status == false}.
     */
    public CompletableFuture<Result> close() {
        ExecutorService executor;
        MaintenanceScheduler maintenance;
        synchronized (this) {
            if (state != DatabaseState.READY) {
                LOG.debug("[DB] close() ignored in state {}", state);
                return CompletableFuture.completedFuture(Result.ok(false));
            }
            transition(DatabaseState.CLOSING);
            executor = statementExecutor;
            maintenance = scheduler;
            scheduler = null;
        }

        maintenance.stop();
        return maintenance.backup(options.getBackupPath())
                .handleAsync((backup, error) -> {
                    if (error != null)
                        errors.report("close", error);
                    else if (backup.code() == Result.BUSY)
                        LOG.warn("[DB] Final backup to {} skipped: maintenance still running", options.getBackupPath());
                    Result closed = closeConnection();
                    executor.shutdown();
                    transition(DatabaseState.CLOSED);
                    LOG.info("[DB] Closed {}", storagePath);
                    return closed;
                }, executor);
    }

    private Result closeConnection() {
        Connection conn = connection;
        connection = null;
        if (conn == null)
            return Result.ok(false);
        try {
            conn.close();
            return Result.ok();
        } catch (SQLException e) {
            errors.report("close", e);
            return Result.failure();
        }
    }

    private synchronized void transition(DatabaseState next) {
        DatabaseState previous = state;
        state = next;
        LOG.info("[DB] State {} -> {}", previous, next);
        eventBus.post(new StorageEvents.StateChangedEvent(previous, next));
    }

    // =====================================================================
    // Maintenance
    // =====================================================================

    /** Backs up to the configured backup path. */
    public CompletableFuture<Result> backup() {
        return backup(options.getBackupPath());
    }

    /**
     * Copies the storage file to {@code destination}. Returns
     * {@link Result#BUSY} without touching any file while a backup or vacuum
     * is running.
     */
    public CompletableFuture<Result> backup(Path destination) {
        return requireScheduler().backup(destination);
    }

    /** Runs {@code VACUUM}; {@link Result#BUSY} while a backup or vacuum is running. */
    public CompletableFuture<Result> vacuum() {
        return requireScheduler().vacuum();
    }

    private synchronized MaintenanceScheduler requireScheduler() {
        requireReady();
        return scheduler;
    }

    // =====================================================================
    // Passthroughs
    // =====================================================================

    /**
     * Runs raw SQL with bound parameters. Queries return {@code rows},
     * everything else {@code changes}.
     */
    public CompletableFuture<Result> execute(String sql, Object... params) {
        List<Object> bound = Arrays.asList(params.clone());
        return submit(() -> rows.execute(sql, bound));
    }

    public CompletableFuture<Result> commit() {
        return submit(() -> rows.runStatement("commit", SqlLoader.load("commit")));
    }

    public CompletableFuture<Result> rollback() {
        return submit(() -> rows.runStatement("rollback", SqlLoader.load("rollback")));
    }

    // =====================================================================
    // Accessors
    // =====================================================================

    /**
     * @throws ConfigurationException if the schema declares no such table
     */
    public Model model(String table) {
        Model model = models.get(table);
        if (model == null)
            throw new ConfigurationException("No table '" + table + "' declared in the schema");
        return model;
    }

    /** Models keyed by table name, in schema order. */
    public ImmutableMap<String, Model> models() {
        return models;
    }

    public DatabaseState state() {
        return state;
    }

    public Schema schema() {
        return schema;
    }

    public Path storagePath() {
        return storagePath;
    }

    public Path backupPath() {
        return options.getBackupPath();
    }

    // =====================================================================
    // Package internals
    // =====================================================================

    <T> CompletableFuture<T> submit(Supplier<T> work) {
        ExecutorService executor = requireReady();
        try {
            return CompletableFuture.supplyAsync(work, executor);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Database is shutting down", e);
        }
    }

    RowStore rows() {
        return rows;
    }

    MaintenanceGuard maintenanceGuard() {
        return guard;
    }

    private ExecutorService requireReady() {
        if (state != DatabaseState.READY)
            throw new IllegalStateException("Database is not ready (state " + state + ")");
        return statementExecutor;
    }
}
