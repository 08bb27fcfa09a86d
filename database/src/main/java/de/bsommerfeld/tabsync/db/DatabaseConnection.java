package de.bsommerfeld.tabsync.db;

import de.bsommerfeld.tabsync.core.config.DecodeFailurePolicy;
import de.bsommerfeld.tabsync.db.codec.RowDecodeException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Statement-level view of one JDBC connection, handed to
 * {@link ConnectionWork}. Tracks the rows-affected count of the most recent
 * change and exposes SQLite's last inserted row id.
 *
 * <p>
 * Instances are confined to the unit of work they were created for and must
 * not escape it.
 */
public final class DatabaseConnection {

    private final Connection connection;
    private final DecodeFailurePolicy decodeFailurePolicy;
    private final SyncStorageObserver observer;
    private int numberOfRowsModified;

    DatabaseConnection(Connection connection, DecodeFailurePolicy decodeFailurePolicy,
            SyncStorageObserver observer) {
        this.connection = connection;
        this.decodeFailurePolicy = decodeFailurePolicy;
        this.observer = observer;
    }

    /**
     * Executes an INSERT, UPDATE or DELETE with positional arguments.
     * {@code null} arguments bind SQL {@code NULL}.
     *
     * @return number of rows affected
     */
    public int executeChange(String sql, Object... args) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, args);
            return recordRowsModified(ps.executeUpdate());
        }
    }

    /**
     * Prepares a change statement for repeated execution within this unit of
     * work. The caller closes it.
     */
    public PreparedChange prepareChange(String sql) throws SQLException {
        return new PreparedChange(this, connection.prepareStatement(sql));
    }

    /** Rows affected by the most recent change on this connection. */
    public int numberOfRowsModified() {
        return numberOfRowsModified;
    }

    /**
     * Row id of the most recent successful INSERT on this connection, or
     * {@code 0} if none happened yet.
     */
    public long lastInsertedRowId() throws SQLException {
        try (Statement stmt = connection.createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("select-last-insert-rowid"))) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    /**
     * Runs a query and decodes every row. Rows the decoder rejects with a
     * {@link RowDecodeException} fail the query under
     * {@link DecodeFailurePolicy#ABORT}; under {@link DecodeFailurePolicy#SKIP}
     * they are reported to the observer and left out.
     */
    public <T> List<T> executeQuery(String sql, RowDecoder<T> decoder, Object... args) throws SQLException {
        List<T> results = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    try {
                        results.add(decoder.decode(rs));
                    } catch (RowDecodeException e) {
                        if (decodeFailurePolicy != DecodeFailurePolicy.SKIP)
                            throw e;
                        observer.onDecodeSkipped(e);
                    }
                }
            }
        }
        return results;
    }

    int recordRowsModified(int rows) {
        numberOfRowsModified = rows;
        return rows;
    }

    static void bind(PreparedStatement ps, Object[] args) throws SQLException {
        if (args == null)
            return;
        for (int i = 0; i < args.length; i++) {
            ps.setObject(i + 1, args[i]);
        }
    }
}
