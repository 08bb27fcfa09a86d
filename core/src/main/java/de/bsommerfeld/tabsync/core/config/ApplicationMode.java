package de.bsommerfeld.tabsync.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects which storage backs the sync layer. PROD persists to SQLite; TEST
 * keeps clients and tabs in memory and never opens a database file.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    static final String PROPERTY = "tabsync.mode";
    static final String ENV_VARIABLE = "TABSYNC_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code tabsync.mode} system property, falling
     * back to the {@code TABSYNC_MODE} environment variable.
     */
    public static ApplicationMode get() {
        String value = System.getProperty(PROPERTY);
        if (value == null || value.isBlank())
            value = System.getenv(ENV_VARIABLE);
        return parse(value);
    }

    /**
     * Parses a mode name, ignoring case and surrounding whitespace. Missing
     * or unknown names resolve to PROD.
     */
    public static ApplicationMode parse(String value) {
        if (value == null || value.isBlank())
            return PROD;

        String name = value.trim().toUpperCase(Locale.ROOT);
        for (ApplicationMode mode : values()) {
            if (mode.name().equals(name))
                return mode;
        }
        LOG.warn("Unknown storage mode '{}', using PROD.", value);
        return PROD;
    }

    public boolean isTest() {
        return this == TEST;
    }
}
