package de.bsommerfeld.tabsync.db;

import com.google.inject.Singleton;
import de.bsommerfeld.tabsync.core.domain.ClientAndTabs;
import de.bsommerfeld.tabsync.core.domain.RemoteClient;
import de.bsommerfeld.tabsync.core.domain.RemoteTab;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Volatile {@link RemoteClientsAndTabs} for TEST mode: no disk I/O, no
 * SQLite. Bound by {@link StorageModule} when the application runs with
 * {@code tabsync.mode=TEST}.
 *
 * <p>
 * Behaves like {@link SqlRemoteClientsAndTabs} as far as callers can tell:
 * writes are all-or-nothing, rows missing a required field are rejected the
 * way the schema's {@code NOT NULL} constraints would, tabs are kept in the
 * form they would be read back from the database, and the joined read
 * only includes clients whose {@code fxaDeviceId} was registered through
 * {@link #registerRemoteDevice}. The account layer owns that registry in
 * production; here it is kept alongside the data.
 *
 * <p>
 * All state is guarded by the instance monitor. Futures are returned
 * already completed.
 */
@Singleton
public class InMemoryRemoteClientsAndTabs implements RemoteClientsAndTabs, ResettableSyncStorage {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRemoteClientsAndTabs.class);

    private final List<RemoteClient> clients = new ArrayList<>();
    private final List<RemoteTab> tabs = new ArrayList<>();
    private final Set<String> remoteDevices = new HashSet<>();

    public InMemoryRemoteClientsAndTabs() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Tab storage is NOT persisted     #");
        LOG.warn("#######################################################");
    }

    /** Marks an account device id as a known remote device. */
    public synchronized void registerRemoteDevice(String fxaDeviceId) {
        remoteDevices.add(fxaDeviceId);
    }

    // -- Tabs --

    @Override
    public synchronized CompletableFuture<Integer> replaceTabs(String clientGuid, List<RemoteTab> replacement) {
        List<RemoteTab> incoming = replacement != null ? new ArrayList<>(replacement) : List.of();
        try {
            StoredTabs.requireStorable(incoming);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        for (RemoteTab tab : incoming) {
            if (tab.title() == null)
                return CompletableFuture.failedFuture(
                        new IllegalArgumentException("Tab is missing a title: " + tab));
        }

        tabs.removeIf(t -> Objects.equals(t.clientGuid(), clientGuid));
        for (RemoteTab tab : incoming) {
            tabs.add(StoredTabs.asStored(tab));
        }
        return CompletableFuture.completedFuture(incoming.size());
    }

    @Override
    public synchronized CompletableFuture<List<RemoteTab>> getTabsForClient(String clientGuid) {
        return CompletableFuture.completedFuture(tabs.stream()
                .filter(t -> Objects.equals(t.clientGuid(), clientGuid))
                .collect(Collectors.toList()));
    }

    @Override
    public synchronized CompletableFuture<Void> wipeRemoteTabs() {
        tabs.removeIf(t -> !t.isLocal());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> wipeTabs() {
        tabs.clear();
        return CompletableFuture.completedFuture(null);
    }

    // -- Clients --

    @Override
    public synchronized CompletableFuture<Integer> upsertClients(List<RemoteClient> batch) {
        List<RemoteClient> incoming = batch != null ? new ArrayList<>(batch) : List.of();
        for (RemoteClient c : incoming) {
            if (c.name() == null)
                return CompletableFuture.failedFuture(
                        new IllegalArgumentException("Client is missing a name: " + c));
        }

        for (RemoteClient c : incoming) {
            int index = indexOf(c.guid());
            if (index >= 0) {
                clients.set(index, c);
            } else {
                clients.add(c);
            }
        }
        return CompletableFuture.completedFuture(incoming.size());
    }

    @Override
    public synchronized CompletableFuture<Optional<RemoteClient>> getClient(String guid) {
        return CompletableFuture.completedFuture(clients.stream()
                .filter(c -> guid != null && guid.equals(c.guid()))
                .findFirst());
    }

    @Override
    public synchronized CompletableFuture<Optional<RemoteClient>> getClientByFxaDeviceId(String fxaDeviceId) {
        return CompletableFuture.completedFuture(clients.stream()
                .filter(c -> fxaDeviceId != null && fxaDeviceId.equals(c.fxaDeviceId()))
                .findFirst());
    }

    @Override
    public synchronized CompletableFuture<Set<String>> getClientGuids() {
        Set<String> guids = new LinkedHashSet<>();
        for (RemoteClient c : clients) {
            if (c.guid() != null)
                guids.add(c.guid());
        }
        return CompletableFuture.completedFuture(Set.copyOf(guids));
    }

    @Override
    public synchronized CompletableFuture<Void> deleteClient(String guid) {
        clients.removeIf(c -> guid != null && guid.equals(c.guid()));
        tabs.removeIf(t -> guid != null && guid.equals(t.clientGuid()));
        return CompletableFuture.completedFuture(null);
    }

    // -- Joined --

    @Override
    public synchronized CompletableFuture<List<ClientAndTabs>> getClientsAndTabs() {
        List<RemoteClient> active = clients.stream()
                .filter(c -> c.fxaDeviceId() != null && remoteDevices.contains(c.fxaDeviceId()))
                .sorted(Comparator.comparingLong(RemoteClient::modified).reversed())
                .collect(Collectors.toList());

        List<RemoteTab> remote = tabs.stream()
                .filter(t -> !t.isLocal())
                .sorted(Comparator.comparing(RemoteTab::clientGuid).reversed()
                        .thenComparing(Comparator.comparingLong(RemoteTab::lastUsed).reversed()))
                .collect(Collectors.toList());

        return CompletableFuture.completedFuture(ClientTabJoin.join(active, remote));
    }

    // -- Reset --

    @Override
    public CompletableFuture<Void> resetClient() {
        return clear();
    }

    @Override
    public synchronized CompletableFuture<Void> clear() {
        tabs.removeIf(t -> !t.isLocal());
        clients.clear();
        return CompletableFuture.completedFuture(null);
    }

    /** Index of the client with this guid; a {@code null} guid never matches. */
    private int indexOf(String guid) {
        if (guid == null)
            return -1;
        for (int i = 0; i < clients.size(); i++) {
            if (guid.equals(clients.get(i).guid()))
                return i;
        }
        return -1;
    }
}
