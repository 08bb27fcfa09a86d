package de.bsommerfeld.tabsync.db;

import com.google.inject.Singleton;
import de.bsommerfeld.tabsync.db.codec.RowDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link SyncStorageObserver}: reports every event through SLF4J.
 */
@Singleton
public class LoggingSyncStorageObserver implements SyncStorageObserver {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingSyncStorageObserver.class);

    @Override
    public void onDecodeSkipped(RowDecodeException error) {
        LOG.warn("[DB] Skipped undecodable row in {} ({}): {}",
                error.getTable(), error.getColumn(), error.getMessage());
    }

    @Override
    public void onInsertAnomaly(String table, long lastInsertedRowId) {
        LOG.warn("[DB] INSERT into {} did not change last inserted row id ({}).", table, lastInsertedRowId);
    }

    @Override
    public void onTransactionFailed(Exception error) {
        LOG.error("[DB] Transaction rolled back", error);
    }
}
