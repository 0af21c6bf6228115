package com.pg.wrapper.db;

import org.postgresql.core.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;

/**
 * A unit of work on one connection. Use with try-with-resources: a transaction that is closed
 * without {@link #commit()} is rolled back.
 *
 * <pre>
 * try (Transaction tx = db.beginTransaction()) {
 *     tx.execParams("UPDATE account SET balance = balance - ? WHERE id = ?", amount, from);
 *     tx.execParams("UPDATE account SET balance = balance + ? WHERE id = ?", amount, to);
 *     tx.commit();
 * }
 * </pre>
 *
 * <p>Not thread-safe; a transaction belongs to the thread that owns its connection.</p>
 */
public final class Transaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Transaction.class);

    private final Connection connection;
    private final Map<String, String> preparedStatements;
    private boolean completed;

    Transaction(Connection connection, Map<String, String> preparedStatements) {
        this.connection = connection;
        this.preparedStatements = preparedStatements;
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw DatabaseException.from("Failed to begin transaction", e);
        }
    }

    /**
     * Executes a statement without parameters.
     */
    public Result exec(String sql) {
        ensureActive();
        log.debug("Executing: {}", sql);
        try (Statement statement = connection.createStatement()) {
            boolean hasResultSet = statement.execute(sql);
            return Result.from(statement, hasResultSet);
        } catch (SQLException e) {
            throw DatabaseException.from("Statement failed", e);
        }
    }

    /**
     * Executes a statement with {@code ?} placeholders bound positionally to {@code params}.
     */
    public Result execParams(String sql, Object... params) {
        ensureActive();
        log.debug("Executing with {} parameter(s): {}", params.length, sql);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            boolean hasResultSet = statement.execute();
            return Result.from(statement, hasResultSet);
        } catch (SQLException e) {
            throw DatabaseException.from("Statement failed", e);
        }
    }

    /**
     * Executes a statement previously registered with {@link Database#prepare(String, String)}.
     *
     * @throws QueryException if no statement is registered under {@code name}
     */
    public Result execPrepared(String name, Object... params) {
        String sql = preparedStatements.get(name);
        if (sql == null) {
            throw new QueryException("Unknown prepared statement: '" + name + "'");
        }
        return execParams(sql, params);
    }

    /**
     * @throws IllegalStateException if the transaction was already committed or aborted
     */
    public void commit() {
        if (completed) {
            throw new IllegalStateException("Transaction already completed");
        }
        try {
            connection.commit();
        } catch (SQLException e) {
            throw DatabaseException.from("Commit failed", e);
        }
        completed = true;
        restoreAutoCommit();
    }

    /**
     * Rolls back the transaction. Has no effect once the transaction has completed.
     */
    public void abort() {
        if (completed) {
            return;
        }
        completed = true;
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw DatabaseException.from("Rollback failed", e);
        } finally {
            restoreAutoCommit();
        }
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Quotes and escapes a string literal, including the surrounding single quotes.
     */
    public String quote(String value) {
        if (value == null) {
            return "NULL";
        }
        try {
            return "'" + Utils.escapeLiteral(null, value, true) + "'";
        } catch (SQLException e) {
            throw new IllegalArgumentException("Value cannot be quoted: " + e.getMessage(), e);
        }
    }

    /**
     * Quotes an identifier, including the surrounding double quotes.
     */
    public String quoteName(String name) {
        try {
            return Utils.escapeIdentifier(null, name).toString();
        } catch (SQLException e) {
            throw new IllegalArgumentException("Identifier cannot be quoted: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!completed) {
            try {
                abort();
            } catch (DatabaseException e) {
                log.warn("Error rolling back transaction on close: {}", e.getMessage());
            }
        }
    }

    private void ensureActive() {
        if (completed) {
            throw new IllegalStateException("Transaction already completed");
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit: {}", e.getMessage());
        }
    }
}
