package de.bsommerfeld.tabsync.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a TOML file. A missing file is not an
 * error: the defaults are returned and nothing is written.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    /**
     * @param configPath path to config.toml
     * @return the parsed configuration, or defaults if the file does not exist
     * @throws UncheckedIOException if the file exists but cannot be read or
     *                              parsed
     */
    public static GlobalConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            LOG.info("No configuration at {}, using defaults.", configPath.toAbsolutePath());
            return new GlobalConfig();
        }

        LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());
        try {
            GlobalConfig config = MAPPER.readValue(configPath.toFile(), GlobalConfig.class);
            return config != null ? config : new GlobalConfig();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + configPath, e);
        }
    }
}
