package com.pg.wrapper.db;

import java.util.List;
import java.util.StringJoiner;

/**
 * One live session to a PostgreSQL server.
 * Abstracts the driver so the pool can be exercised against other implementations.
 *
 * <p>A Database is not thread-safe. When it comes from a pool it is owned by exactly one caller
 * until returned.</p>
 */
public interface Database extends AutoCloseable {

    /**
     * Checks whether the session is still usable. Must not throw.
     *
     * @return true if open
     */
    boolean isOpen();

    String getDatabaseName();

    String getUserName();

    String getHostName();

    int getPort();

    /**
     * Starts a transaction.
     *
     * @throws ConnectionException if the session is not open
     */
    Transaction beginTransaction();

    /**
     * Registers a named statement on this session. The registration is not shared with
     * other sessions, pooled or not.
     *
     * @param name statement name used by {@link #execPrepared(String, Object...)}
     * @param sql  statement text with {@code ?} placeholders
     */
    void prepare(String name, String sql);

    /**
     * Runs a statement in its own transaction and commits.
     */
    default Result exec(String sql) {
        try (Transaction tx = beginTransaction()) {
            Result result = tx.exec(sql);
            tx.commit();
            return result;
        }
    }

    /**
     * Runs a parameterised statement in its own transaction and commits.
     */
    default Result execParams(String sql, Object... params) {
        try (Transaction tx = beginTransaction()) {
            Result result = tx.execParams(sql, params);
            tx.commit();
            return result;
        }
    }

    /**
     * Runs a prepared statement in its own transaction and commits.
     */
    default Result execPrepared(String name, Object... params) {
        try (Transaction tx = beginTransaction()) {
            Result result = tx.execPrepared(name, params);
            tx.commit();
            return result;
        }
    }

    default boolean tableExists(String tableName) {
        Result result = execParams(
                "SELECT EXISTS (SELECT FROM information_schema.tables WHERE table_name = ?)",
                tableName);
        return result.front().get(0, Boolean.class);
    }

    /**
     * Column names of a table in ordinal order; empty if the table does not exist.
     */
    default List<String> getColumns(String tableName) {
        Result result = execParams(
                "SELECT column_name FROM information_schema.columns WHERE table_name = ? ORDER BY ordinal_position",
                tableName);
        return result.toList(row -> row.get(0, String.class));
    }

    /**
     * Inserts one row, binding {@code values} to {@code columns} in order.
     *
     * @throws IllegalArgumentException if the counts differ or an identifier is not a plain name
     */
    default void insert(String table, List<String> columns, Object... values) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("At least one column is required");
        }
        if (values.length != columns.size()) {
            throw new IllegalArgumentException(
                    "Number of values (" + values.length + ") doesn't match number of columns (" + columns.size() + ")");
        }
        SqlIdentifiers.validate(table);
        StringJoiner names = new StringJoiner(", ", " (", ")");
        StringJoiner placeholders = new StringJoiner(", ", " VALUES (", ")");
        for (String column : columns) {
            SqlIdentifiers.validate(column);
            names.add(column);
            placeholders.add("?");
        }
        execParams("INSERT INTO " + table + names + placeholders, values);
    }

    /**
     * Closes the session. Calling close more than once has no effect.
     */
    @Override
    void close();
}
