package de.bsommerfeld.modelstore.db;

import de.bsommerfeld.modelstore.db.schema.ColumnDefinition;
import de.bsommerfeld.modelstore.db.schema.Schema;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/** Shared schema and helpers for the database integration tests. */
final class Fixtures {

    static final Schema SCHEMA = Schema.builder()
            .table("items",
                    ColumnDefinition.text("id").asPrimaryKey(),
                    ColumnDefinition.text("url"),
                    ColumnDefinition.integer("size").withDefault(0))
            .table("archive",
                    ColumnDefinition.text("id").asPrimaryKey(),
                    ColumnDefinition.text("url"),
                    ColumnDefinition.integer("size").withDefault(0))
            .table("catalog",
                    ColumnDefinition.text("id").asPrimaryKey(),
                    ColumnDefinition.text("title"),
                    ColumnDefinition.integer("size"),
                    ColumnDefinition.text("note").withDefault("n/a"))
            .table("mirror",
                    ColumnDefinition.text("id").asPrimaryKey(),
                    ColumnDefinition.text("url"),
                    ColumnDefinition.integer("size"))
            .table("accounts",
                    ColumnDefinition.text("id").asPrimaryKey(),
                    ColumnDefinition.text("name"),
                    ColumnDefinition.text("password").asSensitive())
            .table("logs",
                    ColumnDefinition.text("message"),
                    ColumnDefinition.integer("level").withDefault(1))
            .build();

    private Fixtures() {
    }

    static DatabaseOptions options(Path dir, ErrorCallback callback) {
        DatabaseOptions options = new DatabaseOptions();
        options.setStoragePath(dir.resolve("store.db"));
        options.setSchema(SCHEMA);
        options.setErrorCallback(callback);
        return options;
    }

    static Database openDatabase(DatabaseOptions options) {
        Database database = new Database(options);
        Result opened = database.open().join();
        if (!opened.isOk())
            throw new IllegalStateException("Test database did not open: " + opened);
        return database;
    }

    /** Polls {@code condition} every 50 ms until it holds or {@code timeoutMillis} elapse. */
    static boolean await(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean())
                return true;
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }
}
