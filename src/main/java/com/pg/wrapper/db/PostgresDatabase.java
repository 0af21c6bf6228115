package com.pg.wrapper.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link Database} backed by a PostgreSQL JDBC connection.
 */
public class PostgresDatabase implements Database {
    private static final Logger log = LoggerFactory.getLogger(PostgresDatabase.class);

    private final ConnectionTarget target;
    private final Map<String, String> preparedStatements = new HashMap<>();
    private Connection connection;

    /**
     * Opens a new session to {@code target}.
     *
     * @throws ConnectionException if the session cannot be established
     */
    public PostgresDatabase(ConnectionTarget target) {
        this.target = target;
        try {
            this.connection = DriverManager.getConnection(target.toJdbcUrl(), target.toProperties());
        } catch (SQLException e) {
            throw new ConnectionException("Failed to connect to " + target.getHost() + ":" + target.getPort()
                    + " - " + e.getMessage(), e);
        }
        log.debug("Opened connection to {}:{}/{}", target.getHost(), target.getPort(), target.getDatabase());
    }

    /**
     * Wraps an already open JDBC connection.
     */
    public PostgresDatabase(ConnectionTarget target, Connection connection) {
        this.target = target;
        this.connection = connection;
    }

    /**
     * A connection is open until closed locally or until the driver has marked it closed
     * after a fatal I/O error. No round trip is made.
     */
    @Override
    public boolean isOpen() {
        if (connection == null) {
            return false;
        }
        try {
            return !connection.isClosed();
        } catch (SQLException e) {
            log.debug("Connection state check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getDatabaseName() {
        return target.getDatabase();
    }

    @Override
    public String getUserName() {
        return target.getUser();
    }

    @Override
    public String getHostName() {
        return target.getHost();
    }

    @Override
    public int getPort() {
        return target.getPort();
    }

    @Override
    public Transaction beginTransaction() {
        if (!isOpen()) {
            throw new ConnectionException("Connection is not open");
        }
        return new Transaction(connection, preparedStatements);
    }

    @Override
    public void prepare(String name, String sql) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Prepared statement name must not be blank");
        }
        if (!isOpen()) {
            throw new ConnectionException("Connection is not open");
        }
        // let the driver reject malformed text up front
        try {
            connection.prepareStatement(sql).close();
        } catch (SQLException e) {
            throw DatabaseException.from("Failed to prepare '" + name + "'", e);
        }
        preparedStatements.put(name, sql);
        log.debug("Prepared statement '{}'", name);
    }

    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing connection: {}", e.getMessage());
        } finally {
            connection = null;
            preparedStatements.clear();
        }
    }

    @Override
    public String toString() {
        return "PostgresDatabase{" + target.getHost() + ":" + target.getPort() + "/" + target.getDatabase()
                + (isOpen() ? "" : " closed") + '}';
    }
}
