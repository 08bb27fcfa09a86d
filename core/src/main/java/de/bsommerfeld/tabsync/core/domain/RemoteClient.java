package de.bsommerfeld.tabsync.core.domain;

/**
 * A remote device participating in tab sync, as last reported by the sync
 * server. Timestamps are Unix epoch milliseconds.
 *
 * @param guid        sync identifier of the client record, {@code null} only
 *                    transiently before the record has been uploaded
 * @param name        user-visible device name
 * @param modified    server modification timestamp, treated as unsigned
 * @param type        device type reported by the client (e.g. {@code mobile})
 * @param formfactor  form factor hint (e.g. {@code phone}, {@code tablet})
 * @param os          operating system name
 * @param version     application version string
 * @param fxaDeviceId account device id, links the client to a registered
 *                    remote device
 */
public record RemoteClient(
        String guid,
        String name,
        long modified,
        String type,
        String formfactor,
        String os,
        String version,
        String fxaDeviceId) {

    /**
     * Convenience constructor for clients that only carry the required fields
     * and an account device id.
     */
    public RemoteClient(String guid, String name, long modified, String fxaDeviceId) {
        this(guid, name, modified, null, null, null, null, fxaDeviceId);
    }
}
