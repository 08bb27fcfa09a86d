package de.bsommerfeld.tabsync.db.codec;

import de.bsommerfeld.tabsync.core.domain.RemoteClient;
import de.bsommerfeld.tabsync.core.domain.RemoteTab;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Decoding against mocked rows, so column values of unexpected types can be
 * fed without a schema in the way.
 */
class EntityCodecsTest {

    // -- Clients --

    @Test
    void decodeClient_shouldMapAllColumns() throws SQLException {
        Map<String, Object> values = clientRow();
        values.put("type", "mobile");
        values.put("formfactor", "phone");
        values.put("os", "Android");
        values.put("version", "128.0");

        RemoteClient client = EntityCodecs.decodeClient(row(values));

        assertEquals(new RemoteClient("g1", "Pixel", 1_700_000_000_000L,
                "mobile", "phone", "Android", "128.0", "dev-1"), client);
    }

    @Test
    void decodeClient_shouldAcceptIntegerModified() throws SQLException {
        Map<String, Object> values = clientRow();
        values.put("modified", 5);

        assertEquals(5L, EntityCodecs.decodeClient(row(values)).modified());
    }

    @Test
    void decodeClient_shouldFailOnMissingName() {
        Map<String, Object> values = clientRow();
        values.put("name", null);

        RowDecodeException e = assertThrows(RowDecodeException.class,
                () -> EntityCodecs.decodeClient(row(values)));
        assertEquals("clients", e.getTable());
        assertEquals("name", e.getColumn());
    }

    @Test
    void decodeClient_shouldFailOnNonIntegerModified() {
        Map<String, Object> values = clientRow();
        values.put("modified", "yesterday");

        RowDecodeException e = assertThrows(RowDecodeException.class,
                () -> EntityCodecs.decodeClient(row(values)));
        assertEquals("modified", e.getColumn());
    }

    @Test
    void decodeClient_shouldTreatNonTextOptionalsAsNull() throws SQLException {
        Map<String, Object> values = clientRow();
        values.put("os", 3.5);

        assertNull(EntityCodecs.decodeClient(row(values)).os());
    }

    // -- Tabs --

    @Test
    void decodeTab_shouldMapAllColumns() throws SQLException {
        RemoteTab tab = EntityCodecs.decodeTab(row(tabRow()));

        assertEquals("g1", tab.clientGuid());
        assertEquals(URI.create("https://example.com/"), tab.url());
        assertEquals("Example", tab.title());
        assertEquals(List.of(URI.create("https://prev.example/")), tab.history());
        assertEquals(42L, tab.lastUsed());
        assertNull(tab.icon());
    }

    @Test
    void decodeTab_shouldKeepNullClientGuidForLocalTabs() throws SQLException {
        Map<String, Object> values = tabRow();
        values.put("client_guid", null);

        assertTrue(EntityCodecs.decodeTab(row(values)).isLocal());
    }

    @Test
    void decodeTab_shouldDecodeHistoryFromBytes() throws SQLException {
        Map<String, Object> values = tabRow();
        values.put("history", "[\"https://blob.example/\"]".getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of(URI.create("https://blob.example/")),
                EntityCodecs.decodeTab(row(values)).history());
    }

    @Test
    void decodeTab_shouldDegradeBadHistoryToEmpty() throws SQLException {
        Map<String, Object> values = tabRow();
        values.put("history", "{broken");
        assertTrue(EntityCodecs.decodeTab(row(values)).history().isEmpty());

        values.put("history", null);
        assertTrue(EntityCodecs.decodeTab(row(values)).history().isEmpty());

        values.put("history", 7);
        assertTrue(EntityCodecs.decodeTab(row(values)).history().isEmpty());
    }

    @Test
    void decodeTab_shouldFailOnUnparseableUrl() {
        Map<String, Object> values = tabRow();
        values.put("url", "not a url");

        RowDecodeException e = assertThrows(RowDecodeException.class,
                () -> EntityCodecs.decodeTab(row(values)));
        assertEquals("tabs", e.getTable());
        assertEquals("url", e.getColumn());
    }

    @Test
    void decodeTab_shouldFailOnRelativeUrl() {
        Map<String, Object> values = tabRow();
        values.put("url", "/just/a/path");

        assertThrows(RowDecodeException.class, () -> EntityCodecs.decodeTab(row(values)));
    }

    @Test
    void decodeTab_shouldFailOnMissingTitleOrLastUsed() {
        Map<String, Object> noTitle = tabRow();
        noTitle.put("title", null);
        assertEquals("title",
                assertThrows(RowDecodeException.class, () -> EntityCodecs.decodeTab(row(noTitle))).getColumn());

        Map<String, Object> noLastUsed = tabRow();
        noLastUsed.put("last_used", null);
        assertEquals("last_used",
                assertThrows(RowDecodeException.class, () -> EntityCodecs.decodeTab(row(noLastUsed))).getColumn());
    }

    // -- Helpers --

    private static Map<String, Object> clientRow() {
        Map<String, Object> values = new HashMap<>();
        values.put("guid", "g1");
        values.put("name", "Pixel");
        values.put("modified", 1_700_000_000_000L);
        values.put("fxaDeviceId", "dev-1");
        return values;
    }

    private static Map<String, Object> tabRow() {
        Map<String, Object> values = new HashMap<>();
        values.put("client_guid", "g1");
        values.put("url", "https://example.com/");
        values.put("title", "Example");
        values.put("history", "[\"https://prev.example/\"]");
        values.put("last_used", 42);
        return values;
    }

    private static ResultSet row(Map<String, Object> values) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getObject(anyString())).thenAnswer(inv -> values.get(inv.<String>getArgument(0)));
        return rs;
    }
}
