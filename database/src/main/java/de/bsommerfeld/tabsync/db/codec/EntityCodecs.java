package de.bsommerfeld.tabsync.db.codec;

import de.bsommerfeld.tabsync.core.domain.RemoteClient;
import de.bsommerfeld.tabsync.core.domain.RemoteTab;

import java.net.URI;
import java.net.URISyntaxException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Maps {@code clients} and {@code tabs} rows to domain records.
 *
 * <p>
 * Required columns ({@code name}, {@code modified} for clients;
 * {@code url}, {@code title}, {@code last_used} for tabs) must be present and
 * well-typed, otherwise a {@link RowDecodeException} is thrown and the
 * caller's decode policy decides whether the row is skipped or the query
 * fails. Optional text columns holding anything but text decode as
 * {@code null}. Column values are read through {@link ResultSet#getObject}
 * so the stored type can be checked instead of coerced.
 */
public final class EntityCodecs {

    static final String CLIENTS = "clients";
    static final String TABS = "tabs";

    private EntityCodecs() {
    }

    public static RemoteClient decodeClient(ResultSet row) throws SQLException {
        String name = requireString(row, CLIENTS, "name");
        long modified = requireLong(row, CLIENTS, "modified");
        return new RemoteClient(
                optionalString(row, "guid"), name, modified,
                optionalString(row, "type"), optionalString(row, "formfactor"),
                optionalString(row, "os"), optionalString(row, "version"),
                optionalString(row, "fxaDeviceId"));
    }

    /**
     * Decodes a tab row. The history column degrades to an empty list when
     * absent or malformed; the icon is never stored and decodes as
     * {@code null}.
     */
    public static RemoteTab decodeTab(ResultSet row) throws SQLException {
        String rawUrl = requireString(row, TABS, "url");
        URI url;
        try {
            url = new URI(rawUrl);
        } catch (URISyntaxException e) {
            throw new RowDecodeException(TABS, "url", "unparseable URL '" + rawUrl + "'", e);
        }
        if (!url.isAbsolute())
            throw new RowDecodeException(TABS, "url", "relative URL '" + rawUrl + "'");

        String title = requireString(row, TABS, "title");
        long lastUsed = requireLong(row, TABS, "last_used");
        return new RemoteTab(optionalString(row, "client_guid"), url, title,
                decodeHistoryColumn(row.getObject("history")), lastUsed);
    }

    private static List<URI> decodeHistoryColumn(Object value) {
        if (value instanceof byte[])
            return HistoryCodec.decode((byte[]) value);
        return HistoryCodec.decode(value instanceof String ? (String) value : null);
    }

    private static String requireString(ResultSet row, String table, String column) throws SQLException {
        Object value = row.getObject(column);
        if (value instanceof String)
            return (String) value;
        throw new RowDecodeException(table, column, describe(value) + " where text is required");
    }

    private static long requireLong(ResultSet row, String table, String column) throws SQLException {
        Object value = row.getObject(column);
        if (value instanceof Integer || value instanceof Long)
            return ((Number) value).longValue();
        throw new RowDecodeException(table, column, describe(value) + " where an integer is required");
    }

    private static String optionalString(ResultSet row, String column) throws SQLException {
        Object value = row.getObject(column);
        return value instanceof String ? (String) value : null;
    }

    private static String describe(Object value) {
        return value == null ? "NULL" : value.getClass().getSimpleName();
    }
}
