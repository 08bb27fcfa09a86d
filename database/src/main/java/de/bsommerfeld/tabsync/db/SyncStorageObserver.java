package de.bsommerfeld.tabsync.db;

import de.bsommerfeld.tabsync.db.codec.RowDecodeException;

/**
 * Hook for the non-fatal and fatal events the storage layer runs into.
 * Bound to {@link LoggingSyncStorageObserver} unless a module overrides it.
 */
public interface SyncStorageObserver {

    /** A row was dropped under the SKIP decode policy. */
    void onDecodeSkipped(RowDecodeException error);

    /**
     * An INSERT completed without changing the connection's last inserted
     * row id, so no row can be assumed to exist.
     *
     * @param table             target table of the insert
     * @param lastInsertedRowId row id observed before and after the insert
     */
    void onInsertAnomaly(String table, long lastInsertedRowId);

    /** A transaction was rolled back; {@code error} is what the caller sees. */
    void onTransactionFailed(Exception error);
}
