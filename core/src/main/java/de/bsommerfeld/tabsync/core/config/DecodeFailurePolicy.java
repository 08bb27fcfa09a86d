package de.bsommerfeld.tabsync.core.config;

/**
 * What a query does when a stored row cannot be mapped to an entity
 * (missing or malformed required column).
 */
public enum DecodeFailurePolicy {

    /** Fail the whole query with the decode error. */
    ABORT,

    /** Drop the row, report it, and keep reading. */
    SKIP
}
