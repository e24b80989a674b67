package de.bsommerfeld.modelstore.db;

import de.bsommerfeld.modelstore.core.util.StorageUtils;
import de.bsommerfeld.modelstore.db.schema.Schema;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Construction parameters for a {@link Database}. Every field has a usable
 * default; a caller normally sets the schema and leaves the rest alone.
 *
 * <p>
 * The backup path is derived from the storage path unless set explicitly,
 * so changing the storage path moves the default backup with it.
 */
public class DatabaseOptions {

    static final String APP_NAME = "modelstore";
    static final String BACKUP_EXTENSION = ".db.bak";

    private Path storagePath = StorageUtils.getAppDataDir(APP_NAME).resolve("modelstore.db");
    private Path backupPath;
    private Schema schema = Schema.empty();
    private ErrorCallback errorCallback = ErrorCallback.NONE;

    private boolean deleteUnused = false;
    private boolean reorder = false;

    private boolean backupEnabled = false;
    private Duration backupInterval = Duration.ofHours(1);

    private boolean vacuumEnabled = false;
    private Duration vacuumInterval = Duration.ofDays(7);

    public Path getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(Path storagePath) {
        this.storagePath = storagePath;
    }

    /** Explicit backup path, or the storage path with a {@code .db.bak} extension. */
    public Path getBackupPath() {
        return backupPath != null ? backupPath : StorageUtils.withExtension(storagePath, BACKUP_EXTENSION);
    }

    public void setBackupPath(Path backupPath) {
        this.backupPath = backupPath;
    }

    public Schema getSchema() {
        return schema;
    }

    public void setSchema(Schema schema) {
        this.schema = schema;
    }

    public ErrorCallback getErrorCallback() {
        return errorCallback;
    }

    public void setErrorCallback(ErrorCallback errorCallback) {
        this.errorCallback = errorCallback;
    }

    /** Drop physical tables and columns that the schema does not declare. */
    public boolean isDeleteUnused() {
        return deleteUnused;
    }

    public void setDeleteUnused(boolean deleteUnused) {
        this.deleteUnused = deleteUnused;
    }

    /** Rebuild tables whose physical column order differs from the declared order. */
    public boolean isReorder() {
        return reorder;
    }

    public void setReorder(boolean reorder) {
        this.reorder = reorder;
    }

    public boolean isBackupEnabled() {
        return backupEnabled;
    }

    public void setBackupEnabled(boolean backupEnabled) {
        this.backupEnabled = backupEnabled;
    }

    public Duration getBackupInterval() {
        return backupInterval;
    }

    public void setBackupInterval(Duration backupInterval) {
        this.backupInterval = backupInterval;
    }

    public boolean isVacuumEnabled() {
        return vacuumEnabled;
    }

    public void setVacuumEnabled(boolean vacuumEnabled) {
        this.vacuumEnabled = vacuumEnabled;
    }

    public Duration getVacuumInterval() {
        return vacuumInterval;
    }

    public void setVacuumInterval(Duration vacuumInterval) {
        this.vacuumInterval = vacuumInterval;
    }
}
