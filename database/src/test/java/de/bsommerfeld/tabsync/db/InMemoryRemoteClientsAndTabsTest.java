package de.bsommerfeld.tabsync.db;

import de.bsommerfeld.tabsync.core.domain.ClientAndTabs;
import de.bsommerfeld.tabsync.core.domain.RemoteClient;
import de.bsommerfeld.tabsync.core.domain.RemoteTab;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the in-memory storage used during TEST mode. It has to behave like
 * the SQLite storage for everything a caller can observe.
 */
class InMemoryRemoteClientsAndTabsTest {

    private InMemoryRemoteClientsAndTabs storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryRemoteClientsAndTabs();
    }

    @Test
    void replaceTabs_shouldReplaceOnlyTheGivenClient() {
        storage.replaceTabs("g1", List.of(tab("g1", "https://old.example/", "Old", 1))).join();
        storage.replaceTabs("g2", List.of(tab("g2", "https://other.example/", "Other", 1))).join();

        int inserted = storage.replaceTabs("g1", List.of(
                tab("g1", "https://a.example/", "A", 2),
                tab("g1", "https://b.example/", "B", 3))).join();

        assertEquals(2, inserted);
        assertEquals(Set.of("A", "B"), titles(storage.getTabsForClient("g1").join()));
        assertEquals(Set.of("Other"), titles(storage.getTabsForClient("g2").join()));
    }

    @Test
    void replaceTabs_shouldRejectIncompleteTabWithoutChanges() {
        storage.replaceTabs("g1", List.of(tab("g1", "https://a.example/", "A", 1))).join();

        CompletableFuture<Integer> failed = storage.replaceTabs("g1", List.of(
                tab("g1", "https://b.example/", "B", 2),
                tab("g1", "https://c.example/", null, 3)));

        ExecutionException e = assertThrows(ExecutionException.class, failed::get);
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertEquals(Set.of("A"), titles(storage.getTabsForClient("g1").join()));
    }

    @Test
    void replaceTabs_shouldRejectRelativeUrlWithoutChanges() {
        storage.replaceTabs("g1", List.of(tab("g1", "https://a.example/", "A", 1))).join();

        CompletableFuture<Integer> failed = storage.replaceTabs("g1",
                List.of(tab("g1", "relative/path", "Rel", 2)));

        ExecutionException e = assertThrows(ExecutionException.class, failed::get);
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertEquals(Set.of("A"), titles(storage.getTabsForClient("g1").join()));
    }

    @Test
    void replaceTabs_shouldReturnTabsAsTheDatabaseWould() {
        URI previous = URI.create("https://h.example/");
        RemoteTab tab = new RemoteTab("g1", URI.create("https://a.example/"), "A",
                List.of(previous, previous, URI.create("rel")), 1,
                URI.create("https://a.example/icon.png"));

        storage.replaceTabs("g1", List.of(tab)).join();

        RemoteTab stored = storage.getTabsForClient("g1").join().get(0);
        assertEquals(List.of(previous), stored.history());
        assertNull(stored.icon());
        assertEquals(tab.url(), stored.url());
        assertEquals(tab.title(), stored.title());
        assertEquals(tab.lastUsed(), stored.lastUsed());
    }

    @Test
    void replaceLocalTabs_shouldNotTouchRemoteTabs() {
        storage.replaceTabs("g1", List.of(tab("g1", "https://remote.example/", "Remote", 1))).join();

        storage.replaceLocalTabs(List.of(tab(null, "https://local.example/", "Local", 1))).join();

        assertEquals(Set.of("Local"), titles(storage.getLocalTabs().join()));
        assertEquals(Set.of("Remote"), titles(storage.getTabsForClient("g1").join()));
    }

    @Test
    void upsertClients_shouldUpdateExistingByGuid() {
        storage.upsertClient(new RemoteClient("g1", "Laptop", 10, "dev-1")).join();

        int processed = storage.upsertClients(List.of(
                new RemoteClient("g1", "Work Laptop", 11, "dev-1"),
                new RemoteClient("g2", "Phone", 12, "dev-2"))).join();

        assertEquals(2, processed);
        assertEquals(Set.of("g1", "g2"), storage.getClientGuids().join());
        assertEquals("Work Laptop", storage.getClient("g1").join().orElseThrow().name());
    }

    @Test
    void upsertClients_shouldRejectClientWithoutName() {
        CompletableFuture<Integer> failed = storage.upsertClients(List.of(
                new RemoteClient("g1", "Laptop", 10, "dev-1"),
                new RemoteClient("g2", null, 10, "dev-2")));

        assertThrows(ExecutionException.class, failed::get);
        assertTrue(storage.getClientGuids().join().isEmpty());
    }

    @Test
    void getClientByFxaDeviceId_shouldMatchDeviceId() {
        storage.upsertClient(new RemoteClient("g1", "Laptop", 10, "dev-1")).join();

        assertEquals("g1", storage.getClientByFxaDeviceId("dev-1").join().orElseThrow().guid());
        assertTrue(storage.getClientByFxaDeviceId(null).join().isEmpty());
    }

    @Test
    void getClientsAndTabs_shouldOnlyIncludeRegisteredDevicesNewestFirst() {
        storage.registerRemoteDevice("dev-a");
        storage.registerRemoteDevice("dev-b");
        storage.upsertClients(List.of(
                new RemoteClient("A", "Older", 5, "dev-a"),
                new RemoteClient("B", "Newer", 10, "dev-b"),
                new RemoteClient("C", "Unregistered", 20, "dev-c"))).join();
        storage.replaceTabs("A", List.of(
                tab("A", "https://a1.example/", "a1", 1),
                tab("A", "https://a2.example/", "a2", 3))).join();
        storage.replaceTabs("C", List.of(tab("C", "https://c.example/", "c", 1))).join();

        List<ClientAndTabs> result = storage.getClientsAndTabs().join();

        assertEquals(List.of("B", "A"),
                result.stream().map(ct -> ct.client().guid()).collect(Collectors.toList()));
        assertTrue(result.get(0).tabs().isEmpty());
        assertEquals(List.of("a2", "a1"),
                result.get(1).tabs().stream().map(RemoteTab::title).collect(Collectors.toList()));
    }

    @Test
    void deleteClient_shouldRemoveClientAndItsTabs() {
        storage.upsertClient(new RemoteClient("g1", "Laptop", 10, "dev-1")).join();
        storage.replaceTabs("g1", List.of(tab("g1", "https://a.example/", "A", 1))).join();

        storage.deleteClient("g1").join();

        assertTrue(storage.getClient("g1").join().isEmpty());
        assertTrue(storage.getTabsForClient("g1").join().isEmpty());
    }

    @Test
    void clear_shouldKeepLocalTabs() {
        storage.upsertClient(new RemoteClient("g1", "Laptop", 10, "dev-1")).join();
        storage.replaceTabs("g1", List.of(tab("g1", "https://a.example/", "A", 1))).join();
        storage.replaceLocalTabs(List.of(tab(null, "https://local.example/", "Local", 1))).join();

        storage.resetClient().join();

        assertTrue(storage.getClientGuids().join().isEmpty());
        assertTrue(storage.getTabsForClient("g1").join().isEmpty());
        assertEquals(1, storage.getLocalTabs().join().size());
    }

    @Test
    void wipeTabs_shouldRemoveEverything() {
        storage.replaceTabs("g1", List.of(tab("g1", "https://a.example/", "A", 1))).join();
        storage.replaceLocalTabs(List.of(tab(null, "https://local.example/", "Local", 1))).join();

        storage.wipeRemoteTabs().join();
        assertEquals(1, storage.getLocalTabs().join().size());

        storage.wipeTabs().join();
        assertTrue(storage.getLocalTabs().join().isEmpty());
    }

    private static RemoteTab tab(String clientGuid, String url, String title, long lastUsed) {
        return new RemoteTab(clientGuid, URI.create(url), title, List.of(), lastUsed);
    }

    private static Set<String> titles(List<RemoteTab> tabs) {
        return tabs.stream().map(RemoteTab::title).collect(Collectors.toSet());
    }
}
