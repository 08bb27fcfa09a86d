package de.bsommerfeld.tabsync.db;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Transaction executor over the browser's sync database.
 *
 * <p>
 * Every method returns immediately; the returned future completes exactly
 * once, either with the result or exceptionally with the original
 * {@link java.sql.SQLException} (or runtime exception) that stopped the
 * work. There is no timeout or cancellation at this level.
 *
 * <p>
 * Transactions are serialized against each other. Reads may run
 * concurrently with a transaction and see its state only once committed.
 */
public interface BrowserDatabase {

    /** Executes a single change statement atomically. */
    CompletableFuture<Void> run(String sql, Object... args);

    /** Executes a query and decodes every row. */
    <T> CompletableFuture<List<T>> runQuery(String sql, RowDecoder<T> decoder, Object... args);

    /**
     * Runs {@code work} inside one transaction. The transaction commits if
     * the work returns and rolls back if it throws.
     */
    <T> CompletableFuture<T> transaction(ConnectionWork<T> work);

    /**
     * Runs {@code work} on one auto-commit connection, for multi-statement
     * reads that should share a connection but need no transaction.
     */
    <T> CompletableFuture<T> withConnection(ConnectionWork<T> work);
}
