package de.bsommerfeld.tabsync.db.codec;

import java.sql.SQLDataException;

/**
 * A stored row could not be mapped to an entity because a required column
 * is missing or holds a value of the wrong shape. Signals corrupt data, not
 * a failing statement.
 */
public class RowDecodeException extends SQLDataException {

    private final String table;
    private final String column;

    public RowDecodeException(String table, String column, String reason) {
        super(table + "." + column + ": " + reason);
        this.table = table;
        this.column = column;
    }

    public RowDecodeException(String table, String column, String reason, Throwable cause) {
        super(table + "." + column + ": " + reason, cause);
        this.table = table;
        this.column = column;
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }
}
