package de.bsommerfeld.modelstore.db;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.modelstore.core.event.StorageEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodic backup and compaction of the storage file.
 *
 * <p>
 * Both jobs share one {@link MaintenanceGuard}: while a backup or vacuum is
 * running, the other (and a second run of the same) returns
 * {@link Result#BUSY} immediately. The work itself runs on the database's
 * statement thread, so no write interleaves with a backup copy. The timer
 * thread only submits.
 *
 * <p>
 * Ticks are fire-and-forget. A tick that finds the guard held is skipped and
 * the job runs again on its next interval.
 */
class MaintenanceScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final RowStore rows;
    private final MaintenanceGuard guard;
    private final Executor statementExecutor;
    private final Path storagePath;
    private final DatabaseOptions options;
    private final StorageEventBus eventBus;
    private final ErrorReporter errors;

    private ScheduledExecutorService timer;

    MaintenanceScheduler(RowStore rows, MaintenanceGuard guard, Executor statementExecutor,
            DatabaseOptions options, StorageEventBus eventBus, ErrorReporter errors) {
        this.rows = rows;
        this.guard = guard;
        this.statementExecutor = statementExecutor;
        this.storagePath = options.getStoragePath().toAbsolutePath();
        this.options = options;
        this.eventBus = eventBus;
        this.errors = errors;
    }

    /** Starts the enabled timers. The first run of each job happens one interval after start. */
    synchronized void start() {
        if (timer != null)
            return;
        if (!options.isBackupEnabled() && !options.isVacuumEnabled()) {
            LOG.debug("[DB] Scheduled maintenance disabled");
            return;
        }
        if (options.isBackupEnabled())
            requirePositive(options.getBackupInterval());
        if (options.isVacuumEnabled())
            requirePositive(options.getVacuumInterval());

        timer = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("modelstore-maintenance-%d")
                .setDaemon(true)
                .build());

        if (options.isBackupEnabled()) {
            Path destination = options.getBackupPath();
            schedule(options.getBackupInterval(), () -> backup(destination));
            LOG.info("[DB] Backup to {} every {}", destination, options.getBackupInterval());
        }
        if (options.isVacuumEnabled()) {
            schedule(options.getVacuumInterval(), this::vacuum);
            LOG.info("[DB] Vacuum every {}", options.getVacuumInterval());
        }
    }

    /** Cancels the timers. Jobs already handed to the statement thread still run. */
    synchronized void stop() {
        if (timer == null)
            return;
        timer.shutdownNow();
        timer = null;
        LOG.debug("[DB] Maintenance timers stopped");
    }

    synchronized boolean isRunning() {
        return timer != null;
    }

    // =====================================================================
    // Jobs
    // =====================================================================

    /**
     * Copies the storage file to {@code destination}. A file already at the
     * destination is replaced; if there was none the result carries
     * {@link Result#NO_PREVIOUS_BACKUP} with {@code status == true}.
     */
    CompletableFuture<Result> backup(Path destination) {
        return guarded("backup", () -> {
            Result result = copySnapshot(destination);
            eventBus.post(new StorageEvents.BackupCompletedEvent(destination, result));
            return result;
        });
    }

    CompletableFuture<Result> vacuum() {
        return guarded("vacuum", () -> {
            Result result = rows.runStatement("vacuum", SqlLoader.load("vacuum"));
            if (result.isOk())
                LOG.info("[DB] Vacuum completed");
            eventBus.post(new StorageEvents.VacuumCompletedEvent(result));
            return result;
        });
    }

    private CompletableFuture<Result> guarded(String job, Supplier<Result> work) {
        if (!guard.tryAcquire()) {
            LOG.warn("[DB] Skipping {}: maintenance already running", job);
            return CompletableFuture.completedFuture(Result.busy());
        }
        try {
            return CompletableFuture.supplyAsync(work, statementExecutor)
                    .whenComplete((result, error) -> guard.release());
        } catch (RejectedExecutionException e) {
            guard.release();
            errors.report(job, e);
            return CompletableFuture.completedFuture(Result.failure());
        }
    }

    private Result copySnapshot(Path destination) {
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);

            boolean replaced = Files.deleteIfExists(destination);
            Files.copy(storagePath, destination);

            LOG.info("[DB] Backup written to {}", destination);
            return replaced ? Result.ok() : Result.of(Result.NO_PREVIOUS_BACKUP, true);
        } catch (IOException e) {
            errors.report("backup", e);
            return Result.failure();
        }
    }

    private void schedule(Duration interval, Runnable job) {
        long millis = interval.toMillis();
        timer.scheduleAtFixedRate(job, millis, millis, TimeUnit.MILLISECONDS);
    }

    private static void requirePositive(Duration interval) {
        if (interval == null || interval.toMillis() <= 0)
            throw new IllegalArgumentException("Maintenance interval must be positive: " + interval);
    }
}
