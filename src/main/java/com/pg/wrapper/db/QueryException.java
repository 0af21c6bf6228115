package com.pg.wrapper.db;

/**
 * Thrown when the server rejects a statement.
 */
public class QueryException extends DatabaseException {

    private final String sqlState;

    public QueryException(String message) {
        this(message, null, null);
    }

    public QueryException(String message, String sqlState, Throwable cause) {
        super("Query error: " + message, cause);
        this.sqlState = sqlState;
    }

    /**
     * Returns the five-character SQLState reported by the server, or null if none was reported.
     */
    public String getSqlState() {
        return sqlState;
    }
}
