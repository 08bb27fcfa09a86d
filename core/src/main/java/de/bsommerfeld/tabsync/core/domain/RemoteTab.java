package de.bsommerfeld.tabsync.core.domain;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single browser tab as reported by a client.
 *
 * @param clientGuid owning client's guid, {@code null} for tabs of the local
 *                   device
 * @param url        absolute URL currently shown in the tab
 * @param title      page title
 * @param history    back-history of the tab, most recent first
 * @param lastUsed   last-used timestamp in epoch milliseconds
 * @param icon       favicon URL; transient, never persisted
 */
public record RemoteTab(
        String clientGuid,
        URI url,
        String title,
        List<URI> history,
        long lastUsed,
        URI icon) {

    public RemoteTab {
        history = history != null
                ? Collections.unmodifiableList(new ArrayList<>(history))
                : Collections.emptyList();
    }

    public RemoteTab(String clientGuid, URI url, String title, List<URI> history, long lastUsed) {
        this(clientGuid, url, title, history, lastUsed, null);
    }

    /** {@code true} if this tab belongs to the local device. */
    public boolean isLocal() {
        return clientGuid == null;
    }
}
