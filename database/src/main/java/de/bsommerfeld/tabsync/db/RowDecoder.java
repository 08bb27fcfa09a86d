package de.bsommerfeld.tabsync.db;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps the current row of a {@link ResultSet} to a value. Implementations
 * must not advance or close the result set.
 *
 * @param <T> decoded type
 */
@FunctionalInterface
public interface RowDecoder<T> {

    T decode(ResultSet row) throws SQLException;
}
