package de.bsommerfeld.tabsync.db;

import de.bsommerfeld.tabsync.core.domain.ClientAndTabs;
import de.bsommerfeld.tabsync.core.domain.RemoteClient;
import de.bsommerfeld.tabsync.core.domain.RemoteTab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory join of already ordered clients and tabs into
 * {@link ClientAndTabs}. Client order and per-client tab order are kept as
 * given.
 */
final class ClientTabJoin {

    private ClientTabJoin() {
    }

    static List<ClientAndTabs> join(List<RemoteClient> clients, List<RemoteTab> tabs) {
        Map<String, List<RemoteTab>> byClient = new HashMap<>();
        for (RemoteTab tab : tabs) {
            // Local tabs have no place in a per-client view
            if (tab.clientGuid() == null)
                continue;
            byClient.computeIfAbsent(tab.clientGuid(), k -> new ArrayList<>()).add(tab);
        }

        List<ClientAndTabs> result = new ArrayList<>(clients.size());
        for (RemoteClient client : clients) {
            List<RemoteTab> own = client.guid() != null ? byClient.get(client.guid()) : null;
            result.add(new ClientAndTabs(client, own != null ? own : Collections.emptyList()));
        }
        return result;
    }
}
