package de.bsommerfeld.tabsync.db;

import java.util.concurrent.CompletableFuture;

/**
 * Storage that can discard everything it learned from sync. Local-only data
 * survives a reset.
 */
public interface ResettableSyncStorage {

    /** Discards sync state ahead of a fresh first sync. */
    CompletableFuture<Void> resetClient();

    /** Deletes all clients and all remote tabs in one transaction. */
    CompletableFuture<Void> clear();
}
