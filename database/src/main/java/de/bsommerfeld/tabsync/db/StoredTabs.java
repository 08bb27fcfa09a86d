package de.bsommerfeld.tabsync.db;

import de.bsommerfeld.tabsync.core.domain.RemoteTab;
import de.bsommerfeld.tabsync.db.codec.HistoryCodec;

import java.util.List;

/**
 * Rules a tab has to meet before it is written, and the shape it has once
 * read back.
 */
final class StoredTabs {

    private StoredTabs() {
    }

    /**
     * Rejects tabs whose URL is missing or relative. Such rows would be
     * written fine but fail every later read of the table.
     *
     * @throws IllegalArgumentException naming the first offending tab
     */
    static void requireStorable(List<RemoteTab> tabs) {
        for (RemoteTab tab : tabs) {
            if (tab.url() == null || !tab.url().isAbsolute())
                throw new IllegalArgumentException("Tab URL must be absolute: " + tab);
        }
    }

    /**
     * The tab as the database returns it: history normalized by its JSON
     * form, icon dropped.
     */
    static RemoteTab asStored(RemoteTab tab) {
        return new RemoteTab(tab.clientGuid(), tab.url(), tab.title(),
                HistoryCodec.decode(HistoryCodec.encode(tab.history())), tab.lastUsed());
    }
}
