package de.bsommerfeld.tabsync.db;

import de.bsommerfeld.tabsync.core.domain.ClientAndTabs;
import de.bsommerfeld.tabsync.core.domain.RemoteClient;
import de.bsommerfeld.tabsync.core.domain.RemoteTab;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Sync storage for remote clients and the tabs they reported. All operations
 * are asynchronous; each returned future completes once with the result or
 * with the failure that aborted the operation. Failed writes leave the store
 * unchanged.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlRemoteClientsAndTabs}: production persistence via SQLite</li>
 * <li>{@link InMemoryRemoteClientsAndTabs}: volatile store for TEST mode</li>
 * </ul>
 *
 * <p>
 * A tab whose {@code clientGuid} is {@code null} belongs to the local device.
 * Local tabs are never returned by remote-scoped reads and never removed by
 * remote wipes.
 */
public interface RemoteClientsAndTabs {

    // -- Tabs --

    /**
     * Replaces every tab owned by {@code clientGuid} ({@code null}: the local
     * tabs) with {@code tabs}, atomically. The tabs' own {@code clientGuid}
     * is trusted to match.
     *
     * @return future completing with the number of rows confirmed inserted
     */
    CompletableFuture<Integer> replaceTabs(String clientGuid, List<RemoteTab> tabs);

    /** Replaces the local device's tabs. Same as {@code replaceTabs(null, tabs)}. */
    default CompletableFuture<Integer> replaceLocalTabs(List<RemoteTab> tabs) {
        return replaceTabs(null, tabs);
    }

    /**
     * Tabs owned by {@code clientGuid}, or the local tabs if {@code null}. No
     * ordering is guaranteed.
     */
    CompletableFuture<List<RemoteTab>> getTabsForClient(String clientGuid);

    default CompletableFuture<List<RemoteTab>> getLocalTabs() {
        return getTabsForClient(null);
    }

    /** Deletes every tab that has an owning client. */
    CompletableFuture<Void> wipeRemoteTabs();

    /** Deletes every tab, local ones included. */
    CompletableFuture<Void> wipeTabs();

    // -- Clients --

    /**
     * Updates each client by guid, inserting it if no row matched, all in one
     * transaction.
     *
     * @return future completing with the number of clients processed
     */
    CompletableFuture<Integer> upsertClients(List<RemoteClient> clients);

    default CompletableFuture<Integer> upsertClient(RemoteClient client) {
        return upsertClients(List.of(client));
    }

    CompletableFuture<Optional<RemoteClient>> getClient(String guid);

    CompletableFuture<Optional<RemoteClient>> getClientByFxaDeviceId(String fxaDeviceId);

    /** All non-null client guids. */
    CompletableFuture<Set<String>> getClientGuids();

    /** Deletes a client and its tabs in one transaction. */
    CompletableFuture<Void> deleteClient(String guid);

    // -- Joined --

    /**
     * Clients registered as remote devices, most recently modified first,
     * each with its tabs, most recently used first. Clients without tabs get
     * an empty list; tabs of unregistered clients are left out.
     */
    CompletableFuture<List<ClientAndTabs>> getClientsAndTabs();
}
