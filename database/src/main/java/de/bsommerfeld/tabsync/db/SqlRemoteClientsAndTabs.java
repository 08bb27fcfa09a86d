package de.bsommerfeld.tabsync.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tabsync.core.domain.ClientAndTabs;
import de.bsommerfeld.tabsync.core.domain.RemoteClient;
import de.bsommerfeld.tabsync.core.domain.RemoteTab;
import de.bsommerfeld.tabsync.db.codec.EntityCodecs;
import de.bsommerfeld.tabsync.db.codec.HistoryCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * SQL implementation of {@link RemoteClientsAndTabs} and
 * {@link ResettableSyncStorage} on top of a {@link BrowserDatabase}.
 *
 * <p>
 * All statements live in {@code sql/*.sql} and are loaded through
 * {@link SqlLoader}. Every write runs as one transaction, so a failing
 * statement rolls back everything the operation already did and the
 * original {@link java.sql.SQLException} fails the returned future.
 *
 * <h3>Insert confirmation</h3>
 * SQLite reports a successful INSERT by advancing the connection's last
 * inserted row id. Tab inserts only count once that id moved; a non-moving
 * id is reported to the {@link SyncStorageObserver} and not counted.
 */
@Singleton
public class SqlRemoteClientsAndTabs implements RemoteClientsAndTabs, ResettableSyncStorage {

    private static final Logger LOG = LoggerFactory.getLogger(SqlRemoteClientsAndTabs.class);

    private final BrowserDatabase db;
    private final SyncStorageObserver observer;

    @Inject
    public SqlRemoteClientsAndTabs(BrowserDatabase db, SyncStorageObserver observer) {
        this.db = db;
        this.observer = observer;
    }

    // =====================================================================
    // Tab Operations
    // =====================================================================

    /**
     * Deletes the tabs owned by {@code clientGuid} and inserts the
     * replacements in one transaction. The delete matches with {@code IS} so
     * a {@code null} guid selects exactly the local tabs. A tab without an
     * absolute URL fails the call before anything is deleted.
     */
    @Override
    public CompletableFuture<Integer> replaceTabs(String clientGuid, List<RemoteTab> tabs) {
        List<RemoteTab> replacement = tabs != null ? new ArrayList<>(tabs) : List.of();
        try {
            StoredTabs.requireStorable(replacement);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        return db.transaction(conn -> {
            int deleted = conn.executeChange(SqlLoader.load("delete-tabs-for-client"), clientGuid);

            int inserted = 0;
            try (PreparedChange insert = conn.prepareChange(SqlLoader.load("insert-tab"))) {
                for (RemoteTab tab : replacement) {
                    long before = conn.lastInsertedRowId();
                    insert.execute(
                            tab.clientGuid(),
                            tab.url().toString(),
                            tab.title(),
                            HistoryCodec.encode(tab.history()),
                            tab.lastUsed());

                    long after = conn.lastInsertedRowId();
                    if (after == before) {
                        observer.onInsertAnomaly("tabs", after);
                    } else {
                        inserted++;
                    }
                }
            }

            LOG.debug("[DB] Replaced {} tabs of client {} with {}.", deleted, describe(clientGuid), inserted);
            return inserted;
        });
    }

    @Override
    public CompletableFuture<List<RemoteTab>> getTabsForClient(String clientGuid) {
        if (clientGuid == null)
            return db.runQuery(SqlLoader.load("select-local-tabs"), EntityCodecs::decodeTab);
        return db.runQuery(SqlLoader.load("select-tabs-for-client"), EntityCodecs::decodeTab, clientGuid);
    }

    @Override
    public CompletableFuture<Void> wipeRemoteTabs() {
        LOG.info("[DB] Wiping remote tabs.");
        return db.run(SqlLoader.load("delete-remote-tabs"));
    }

    @Override
    public CompletableFuture<Void> wipeTabs() {
        LOG.info("[DB] Wiping all tabs.");
        return db.run(SqlLoader.load("delete-all-tabs"));
    }

    // =====================================================================
    // Client Operations
    // =====================================================================

    /**
     * UPDATE by guid, then INSERT if nothing matched. Both statements are
     * prepared once and reused for every client of the batch. Clients are
     * processed in order, so a guid repeated within the batch updates the
     * row inserted for its first occurrence.
     *
     * <p>
     * The result counts processed clients, whether updated or inserted.
     */
    @Override
    public CompletableFuture<Integer> upsertClients(List<RemoteClient> clients) {
        List<RemoteClient> batch = clients != null ? new ArrayList<>(clients) : List.of();

        return db.transaction(conn -> {
            int processed = 0;
            int inserted = 0;
            try (PreparedChange update = conn.prepareChange(SqlLoader.load("update-client"));
                    PreparedChange insert = conn.prepareChange(SqlLoader.load("insert-client"))) {

                for (RemoteClient c : batch) {
                    int updated = update.execute(
                            c.name(), c.modified(), c.type(), c.formfactor(),
                            c.os(), c.version(), c.fxaDeviceId(), c.guid());

                    if (updated == 0) {
                        long before = conn.lastInsertedRowId();
                        insert.execute(
                                c.guid(), c.name(), c.modified(), c.type(),
                                c.formfactor(), c.os(), c.version(), c.fxaDeviceId());
                        long after = conn.lastInsertedRowId();
                        if (after == before) {
                            observer.onInsertAnomaly("clients", after);
                        } else {
                            inserted++;
                        }
                    }
                    processed++;
                }
            }

            LOG.debug("[DB] Upserted {} clients ({} inserted).", processed, inserted);
            return processed;
        });
    }

    @Override
    public CompletableFuture<Optional<RemoteClient>> getClient(String guid) {
        return db.runQuery(SqlLoader.load("select-client-by-guid"), EntityCodecs::decodeClient, guid)
                .thenApply(SqlRemoteClientsAndTabs::first);
    }

    @Override
    public CompletableFuture<Optional<RemoteClient>> getClientByFxaDeviceId(String fxaDeviceId) {
        return db.runQuery(SqlLoader.load("select-client-by-fxa-device-id"), EntityCodecs::decodeClient,
                fxaDeviceId).thenApply(SqlRemoteClientsAndTabs::first);
    }

    @Override
    public CompletableFuture<Set<String>> getClientGuids() {
        return db.runQuery(SqlLoader.load("select-client-guids"), row -> row.getString("guid"))
                .thenApply(Set::copyOf);
    }

    @Override
    public CompletableFuture<Void> deleteClient(String guid) {
        return db.transaction(conn -> {
            int clients = conn.executeChange(SqlLoader.load("delete-client"), guid);
            int tabs = conn.executeChange(SqlLoader.load("delete-client-tabs"), guid);
            LOG.debug("[DB] Deleted client {} ({} rows) and {} tabs.", guid, clients, tabs);
            return null;
        });
    }

    // =====================================================================
    // Joined Read
    // =====================================================================

    /**
     * Reads registered clients and all remote tabs over one connection, then
     * groups the tabs per client in memory. The two reads are not wrapped in
     * a transaction; a write committed between them can show up in the tabs
     * but not the clients, which the next read corrects.
     */
    @Override
    public CompletableFuture<List<ClientAndTabs>> getClientsAndTabs() {
        return db.withConnection(conn -> new Snapshot(
                conn.executeQuery(SqlLoader.load("select-active-remote-clients"), EntityCodecs::decodeClient),
                conn.executeQuery(SqlLoader.load("select-remote-tabs"), EntityCodecs::decodeTab)))
                .thenApply(s -> ClientTabJoin.join(s.clients(), s.tabs()));
    }

    private record Snapshot(List<RemoteClient> clients, List<RemoteTab> tabs) {
    }

    // =====================================================================
    // Reset
    // =====================================================================

    /** Resetting this store is the same as clearing it. */
    @Override
    public CompletableFuture<Void> resetClient() {
        return clear();
    }

    @Override
    public CompletableFuture<Void> clear() {
        return db.transaction(conn -> {
            int tabs = conn.executeChange(SqlLoader.load("delete-remote-tabs"));
            int clients = conn.executeChange(SqlLoader.load("delete-all-clients"));
            LOG.info("[DB] Cleared {} clients and {} remote tabs.", clients, tabs);
            return null;
        });
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static String describe(String clientGuid) {
        return clientGuid != null ? clientGuid : "<local>";
    }
}
