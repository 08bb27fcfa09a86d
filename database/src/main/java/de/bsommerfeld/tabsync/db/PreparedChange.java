package de.bsommerfeld.tabsync.db;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * A change statement prepared once and executed for many rows inside one
 * unit of work. Every execution updates the owning connection's
 * rows-affected count.
 */
public final class PreparedChange implements AutoCloseable {

    private final DatabaseConnection owner;
    private final PreparedStatement statement;

    PreparedChange(DatabaseConnection owner, PreparedStatement statement) {
        this.owner = owner;
        this.statement = statement;
    }

    /** @return number of rows affected by this execution */
    public int execute(Object... args) throws SQLException {
        statement.clearParameters();
        DatabaseConnection.bind(statement, args);
        return owner.recordRowsModified(statement.executeUpdate());
    }

    @Override
    public void close() throws SQLException {
        statement.close();
    }
}
