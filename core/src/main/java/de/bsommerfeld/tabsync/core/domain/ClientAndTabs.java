package de.bsommerfeld.tabsync.core.domain;

import java.util.Collections;
import java.util.List;

/**
 * Read-only view pairing a client with the tabs it reported. Never
 * persisted; assembled on every read.
 *
 * @param client the remote client
 * @param tabs   the client's tabs, most recently used first
 */
public record ClientAndTabs(RemoteClient client, List<RemoteTab> tabs) {

    public ClientAndTabs {
        tabs = tabs != null ? List.copyOf(tabs) : Collections.emptyList();
    }
}
