package de.bsommerfeld.tabsync.core.util;

import de.bsommerfeld.tabsync.core.config.StorageConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves where TabSync keeps its files. Paths are returned absolute but
 * are <strong>not</strong> created; the caller makes sure the directory
 * exists.
 *
 * <p>
 * Application data directory per platform:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "tabsync";

    private StorageUtils() {
    }

    /**
     * Returns the platform-specific application data directory for the given
     * app name. The directory is not guaranteed to exist.
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName)
                    .toAbsolutePath();
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            Path base = appData != null
                    ? Paths.get(appData)
                    : Paths.get(System.getProperty("user.home"), "AppData", "Roaming");
            return base.resolve(appName).toAbsolutePath();
        }

        String xdgData = System.getenv("XDG_DATA_HOME");
        Path base = (xdgData != null && !xdgData.isEmpty())
                ? Paths.get(xdgData)
                : Paths.get(System.getProperty("user.home"), ".local", "share");
        return base.resolve(appName).toAbsolutePath();
    }

    /** Location of config.toml inside the app data directory. */
    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve("config.toml");
    }

    /**
     * Resolves the database file. An explicit {@code database-path} wins;
     * otherwise {@code database-file} is placed in the app data directory.
     */
    public static Path resolveDatabasePath(String appName, StorageConfig config) {
        String explicit = config.getDatabasePath();
        if (explicit != null && !explicit.isBlank()) {
            return Paths.get(explicit).toAbsolutePath();
        }
        return getAppDataDir(appName).resolve(config.getDatabaseFile());
    }
}
