package de.bsommerfeld.tabsync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of config.toml. Each section maps to its own POJO so modules can be
 * handed only the part they need.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    public StorageConfig getStorage() {
        return storage;
    }
}
