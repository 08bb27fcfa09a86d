/**
 * Persistence for tab sync: remote clients and the tabs they reported.
 * SQLite-backed in production, in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Sync engine / UI]
 *          │
 *          ▼
 *   RemoteClientsAndTabs + ResettableSyncStorage   ← capabilities
 *      ┌───┴──────────────┐
 *      │                  │
 *   SqlRemote...       InMemoryRemote...  (TEST)
 *      │
 *      ▼
 *   BrowserDatabase   ← transaction executor (single writer, pooled readers)
 *      │
 *      ▼
 *   SqliteBrowserDatabase → JDBC
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────┐
 * │ clients                                                       │
 * ├──────────────┬────────────────────────────────────────────────┤
 * │ guid (PK)    │ sync record id, identity of the client         │
 * │ name         │ device name, NOT NULL                          │
 * │ modified     │ server timestamp, NOT NULL, drives join order  │
 * │ type …       │ type, formfactor, os, version (optional)       │
 * │ fxaDeviceId  │ links to remote_devices.guid                   │
 * └──────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────┐
 * │ tabs                                                          │
 * ├──────────────┬────────────────────────────────────────────────┤
 * │ id (PK,auto) │ row id, advances on every insert               │
 * │ client_guid  │ owning client, NULL for local tabs             │
 * │ url / title  │ NOT NULL                                       │
 * │ history      │ JSON array of URL strings, most recent first   │
 * │ last_used    │ NOT NULL                                       │
 * └──────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * {@code remote_devices} belongs to the account layer and is only consulted
 * by the joined read as an existence filter. No foreign keys are declared:
 * a tab may reference a client that does not exist.
 *
 * <h2>SQL File Inventory</h2>
 * All statements are externalized to {@code sql/*.sql}, loaded via
 * {@link de.bsommerfeld.tabsync.db.SqlLoader}:
 * <ul>
 * <li>{@code delete-tabs-for-client.sql}: {@code client_guid IS ?}, matches
 * NULL</li>
 * <li>{@code insert-tab.sql}, {@code update-client.sql},
 * {@code insert-client.sql}</li>
 * <li>{@code select-client-by-guid.sql},
 * {@code select-client-by-fxa-device-id.sql},
 * {@code select-client-guids.sql}</li>
 * <li>{@code select-tabs-for-client.sql}, {@code select-local-tabs.sql}</li>
 * <li>{@code select-active-remote-clients.sql}: clients with a registered
 * device, newest first</li>
 * <li>{@code select-remote-tabs.sql}: owned tabs by client, then most
 * recently used</li>
 * <li>{@code delete-client.sql}, {@code delete-client-tabs.sql},
 * {@code delete-remote-tabs.sql}, {@code delete-all-tabs.sql},
 * {@code delete-all-clients.sql}</li>
 * <li>{@code select-last-insert-rowid.sql}</li>
 * </ul>
 */
package de.bsommerfeld.tabsync.db;
