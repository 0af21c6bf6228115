package com.pg.wrapper.db;

/**
 * Thrown when a session to the database server cannot be established or has been lost.
 */
public class ConnectionException extends DatabaseException {

    public ConnectionException(String message) {
        super("Connection error: " + message);
    }

    public ConnectionException(String message, Throwable cause) {
        super("Connection error: " + message, cause);
    }
}
