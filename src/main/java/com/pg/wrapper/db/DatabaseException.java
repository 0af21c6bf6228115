package com.pg.wrapper.db;

import java.sql.SQLException;

/**
 * Base runtime exception for failures reported by the database layer.
 */
public class DatabaseException extends RuntimeException {

    private static final String CONNECTION_STATE_CLASS = "08";

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Maps a driver {@link SQLException} onto the exception taxonomy.
     * SQLState class {@code 08} (connection exception) becomes a {@link ConnectionException},
     * everything else a {@link QueryException}.
     *
     * @param context what was being attempted, prefixed to the message
     * @param e       the driver exception
     */
    public static DatabaseException from(String context, SQLException e) {
        String sqlState = e.getSQLState();
        if (sqlState != null && sqlState.startsWith(CONNECTION_STATE_CLASS)) {
            return new ConnectionException(context + ": " + e.getMessage(), e);
        }
        return new QueryException(context + ": " + e.getMessage(), sqlState, e);
    }
}
