package de.bsommerfeld.tabsync.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.tabsync.core.config.ApplicationMode;
import de.bsommerfeld.tabsync.core.config.ConfigLoader;
import de.bsommerfeld.tabsync.core.config.GlobalConfig;
import de.bsommerfeld.tabsync.core.config.StorageConfig;
import de.bsommerfeld.tabsync.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for tab sync storage.
 *
 * <p>
 * In PROD mode both storage capabilities resolve to the same
 * {@link SqlRemoteClientsAndTabs} singleton over a
 * {@link SqliteBrowserDatabase}; in TEST mode to
 * {@link InMemoryRemoteClientsAndTabs}, and no database file is opened.
 */
public class StorageModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(StorageModule.class);

    private final GlobalConfig config;
    private final ApplicationMode mode;

    /** Loads config.toml from the app data directory and resolves the mode. */
    public StorageModule() {
        this(ConfigLoader.load(StorageUtils.getConfigFile(StorageUtils.APP_NAME)), ApplicationMode.get());
    }

    public StorageModule(GlobalConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);
        bind(StorageConfig.class).toInstance(config.getStorage());
        bind(SyncStorageObserver.class).to(LoggingSyncStorageObserver.class);

        LOG.info("Storage mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(RemoteClientsAndTabs.class).to(InMemoryRemoteClientsAndTabs.class);
            bind(ResettableSyncStorage.class).to(InMemoryRemoteClientsAndTabs.class);
        } else {
            bind(BrowserDatabase.class).to(SqliteBrowserDatabase.class);
            bind(RemoteClientsAndTabs.class).to(SqlRemoteClientsAndTabs.class);
            bind(ResettableSyncStorage.class).to(SqlRemoteClientsAndTabs.class);
        }
    }
}
