package com.pg.wrapper.pool;

import com.pg.wrapper.db.Database;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Bounded pool of {@link Database} sessions with acquire/release semantics.
 *
 * <p>An acquired session is owned exclusively by the caller until it is passed back to
 * {@link #release(Database)}. Releasing twice or using a session after release are caller errors.
 * Prefer {@link #lease()} or {@link #withConnection(Function)}, which release on every exit path.</p>
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * Takes an idle session, or opens a new one if below capacity. Never blocks on exhaustion.
     *
     * @return a session, or empty if the pool is at capacity with nothing idle
     * @throws com.pg.wrapper.db.ConnectionException if a new session could not be opened
     * @throws IllegalStateException                 if the pool is closed
     */
    Optional<Database> acquire();

    /**
     * Like {@link #acquire()}, but waits up to {@code timeout} for a session to become available.
     *
     * @return a session, or empty if the timeout elapsed
     * @throws IllegalStateException if the pool is closed, or closes while waiting, or the
     *                               thread is interrupted
     */
    Optional<Database> acquire(Duration timeout);

    /**
     * Returns a session to the pool. Null or broken sessions are discarded and free their slot.
     * Never fails because of the session's state.
     *
     * @param database the session to return
     * @throws IllegalStateException if the pool's bookkeeping shows the session cannot be checked out
     */
    void release(Database database);

    /**
     * Returns current pool statistics.
     */
    PoolStats getStats();

    /**
     * Closes the pool and every idle session. Sessions that are checked out stay open until
     * they are released. Idempotent.
     */
    @Override
    void close();

    /**
     * Acquires a session wrapped in a lease that releases it on close.
     *
     * @return a lease, or empty if the pool is exhausted
     */
    default Optional<ConnectionLease> lease() {
        return acquire().map(db -> new ConnectionLease(this, db));
    }

    /**
     * Runs {@code work} against a pooled session and releases it afterwards, whether or not
     * {@code work} completes normally.
     *
     * @return the result of {@code work}, or empty if the pool is exhausted or {@code work} returned null
     */
    default <T> Optional<T> withConnection(Function<Database, T> work) {
        Optional<Database> acquired = acquire();
        if (acquired.isEmpty()) {
            return Optional.empty();
        }
        Database db = acquired.get();
        try {
            return Optional.ofNullable(work.apply(db));
        } finally {
            release(db);
        }
    }
}
