package de.bsommerfeld.tabsync.db;

import java.sql.SQLException;

/**
 * A unit of work run against a single {@link DatabaseConnection}. Whether it
 * is wrapped in a transaction depends on how it is submitted to
 * {@link BrowserDatabase}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ConnectionWork<T> {

    T apply(DatabaseConnection connection) throws SQLException;
}
