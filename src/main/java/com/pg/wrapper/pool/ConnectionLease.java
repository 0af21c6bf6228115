package com.pg.wrapper.pool;

import com.pg.wrapper.db.Database;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped ownership of a pooled {@link Database}. Closing the lease returns the session
 * to its pool exactly once, however many times close is called.
 *
 * <pre>
 * try (ConnectionLease lease = pool.lease().orElseThrow()) {
 *     lease.database().exec("VACUUM ANALYZE");
 * }
 * </pre>
 */
public final class ConnectionLease implements AutoCloseable {

    private final ConnectionPool pool;
    private final Database database;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ConnectionLease(ConnectionPool pool, Database database) {
        this.pool = pool;
        this.database = database;
    }

    /**
     * @throws IllegalStateException if the lease has already been closed
     */
    public Database database() {
        if (released.get()) {
            throw new IllegalStateException("Lease already released");
        }
        return database;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(database);
        }
    }
}
