package de.bsommerfeld.tabsync.core.util;

import de.bsommerfeld.tabsync.core.config.StorageConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void getAppDataDir_shouldBeAbsoluteAndContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.isAbsolute());
        assertEquals("test-app", dir.getFileName().toString());
    }

    @Test
    void getConfigFile_shouldLiveInAppDataDir() {
        Path config = StorageUtils.getConfigFile("test-app");
        assertEquals(StorageUtils.getAppDataDir("test-app").resolve("config.toml"), config);
    }

    @Test
    void resolveDatabasePath_shouldDefaultToAppDataDir() {
        var config = new StorageConfig();
        Path db = StorageUtils.resolveDatabasePath("test-app", config);

        assertEquals(StorageUtils.getAppDataDir("test-app").resolve("tabsync.db"), db);
    }

    @Test
    void resolveDatabasePath_shouldPreferExplicitPath() {
        var config = new StorageConfig();
        Path explicit = tempDir.resolve("elsewhere.db");
        config.setDatabasePath(explicit.toString());

        assertEquals(explicit.toAbsolutePath(), StorageUtils.resolveDatabasePath("test-app", config));
    }

    @Test
    void resolveDatabasePath_shouldIgnoreBlankExplicitPath() {
        var config = new StorageConfig();
        config.setDatabasePath("   ");
        config.setDatabaseFile("other.db");

        Path db = StorageUtils.resolveDatabasePath("test-app", config);
        assertEquals("other.db", db.getFileName().toString());
    }
}
