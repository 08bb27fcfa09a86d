package de.bsommerfeld.tabsync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Storage parameters, read from the {@code [storage]} section of
 * config.toml. Setters exist for the config mapper and for tests.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageConfig {

    /** File name of the database inside the app data directory. */
    @JsonProperty("database-file")
    private String databaseFile = "tabsync.db";

    /** Absolute path overriding {@code database-file}. Empty means unset. */
    @JsonProperty("database-path")
    private String databasePath = "";

    @JsonProperty("busy-timeout-millis")
    private int busyTimeoutMillis = 5000;

    @JsonProperty("wal-enabled")
    private boolean walEnabled = true;

    @JsonProperty("reader-threads")
    private int readerThreads = 2;

    @JsonProperty("decode-failure-policy")
    private DecodeFailurePolicy decodeFailurePolicy = DecodeFailurePolicy.ABORT;

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(String databasePath) {
        this.databasePath = databasePath;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }

    public void setBusyTimeoutMillis(int busyTimeoutMillis) {
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    public boolean isWalEnabled() {
        return walEnabled;
    }

    public void setWalEnabled(boolean walEnabled) {
        this.walEnabled = walEnabled;
    }

    public int getReaderThreads() {
        return readerThreads;
    }

    public void setReaderThreads(int readerThreads) {
        this.readerThreads = readerThreads;
    }

    public DecodeFailurePolicy getDecodeFailurePolicy() {
        return decodeFailurePolicy;
    }

    public void setDecodeFailurePolicy(DecodeFailurePolicy decodeFailurePolicy) {
        this.decodeFailurePolicy = decodeFailurePolicy;
    }
}
