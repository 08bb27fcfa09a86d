package de.bsommerfeld.tabsync.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL from classpath resources. Single statements live in
 * {@code sql/<operation>-<entity>.sql}, e.g. {@code insert-tab.sql} or
 * {@code select-remote-tabs.sql}; multi-statement scripts such as
 * {@code schema.sql} sit at the classpath root.
 *
 * <p>
 * Each resource is read once and kept for the lifetime of the JVM.
 *
 * @see SqliteBrowserDatabase
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();
    private static final String STATEMENT_SEPARATOR = ";\\s*(\\r?\\n|$)";

    private SqlLoader() {
    }

    /**
     * Returns the trimmed statement from {@code sql/<name>.sql}.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent("sql/" + name + ".sql", SqlLoader::readResource);
    }

    /**
     * Returns the individual statements of a script resource, split on
     * semicolons that end a line. Blank fragments are dropped.
     *
     * @param resource classpath path of the script, e.g. {@code schema.sql}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> loadScript(String resource) {
        String script = CACHE.computeIfAbsent(resource, SqlLoader::readResource);
        List<String> statements = new ArrayList<>();
        for (String sql : script.split(STATEMENT_SEPARATOR)) {
            if (!sql.isBlank())
                statements.add(sql.trim());
        }
        return statements;
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
