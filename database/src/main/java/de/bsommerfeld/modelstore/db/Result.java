package de.bsommerfeld.modelstore.db;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome envelope returned by every storage operation. Only {@code code} is
 * always set; the remaining components are {@code null} unless the operation
 * produces them.
 *
 * <p>
 * {@code code} tells whether the operation ran ({@link #OK}) or why it did
 * not. {@code status} tells whether it had an effect (a row was found, a row
 * changed, a rebuild happened). A successful {@code UPDATE} that matched
 * nothing is {@code code == 200, status == false}.
 *
 * @param code    status code, see the constants
 * @param status  success flag
 * @param changes number of affected rows
 * @param value   single scalar value
 * @param rows    result rows, column name to raw engine value
 * @param row     single result row, or {@code null} when nothing matched
 * @param info    free-form detail lines (migration changes, written columns)
 */
public record Result(int code, Boolean status, Integer changes, Object value,
        List<Map<String, Object>> rows, Map<String, Object> row, List<String> info) {

    public static final int OK = 200;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int BUSY = 429;
    public static final int FAILURE = 500;

    /**
     * Backup found no previous file at its destination. Non-fatal: the snapshot
     * was still written.
     */
    public static final int NO_PREVIOUS_BACKUP = -4082;

    public static Result ok() {
        return new Result(OK, true, null, null, null, null, null);
    }

    public static Result ok(boolean status) {
        return new Result(OK, status, null, null, null, null, null);
    }

    public static Result changed(int changes) {
        return new Result(OK, changes > 0, changes, null, null, null, null);
    }

    public static Result of(int code, boolean status) {
        return new Result(code, status, null, null, null, null, null);
    }

    public static Result failure() {
        return new Result(FAILURE, false, 0, null, null, null, null);
    }

    public static Result notFound() {
        return of(NOT_FOUND, false);
    }

    public static Result conflict() {
        return of(CONFLICT, false);
    }

    public static Result busy() {
        return of(BUSY, false);
    }

    public Result withChanges(int changes) {
        return new Result(code, status, changes, value, rows, row, info);
    }

    public Result withValue(Object value) {
        return new Result(code, status, changes, value, rows, row, info);
    }

    public Result withRows(List<Map<String, Object>> rows) {
        return new Result(code, status, changes, value, Collections.unmodifiableList(rows), row, info);
    }

    public Result withRow(Map<String, Object> row) {
        return new Result(code, status, changes, value, rows, row == null ? null : Collections.unmodifiableMap(row), info);
    }

    public Result withInfo(List<String> info) {
        return new Result(code, status, changes, value, rows, row, List.copyOf(info));
    }

    /** The operation ran without an engine error. */
    public boolean isOk() {
        return code == OK;
    }

    /** {@code status} is set and {@code true}. */
    public boolean succeeded() {
        return Boolean.TRUE.equals(status);
    }
}
