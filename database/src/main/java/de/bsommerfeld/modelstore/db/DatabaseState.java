package de.bsommerfeld.modelstore.db;

/**
 * Lifecycle of a {@link Database}.
 *
 * <pre>
 * CONSTRUCTED → OPENING → READY → CLOSING → CLOSED
 *                  │                           │
 *                  └──→ FAILED       (reopen) ─┘→ OPENING
 * </pre>
 */
public enum DatabaseState {
    CONSTRUCTED,
    OPENING,
    READY,
    CLOSING,
    CLOSED,
    FAILED;

    boolean canOpen() {
        return this == CONSTRUCTED || this == CLOSED;
    }
}
