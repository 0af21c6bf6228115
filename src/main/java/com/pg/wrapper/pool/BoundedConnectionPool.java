package com.pg.wrapper.pool;

import com.pg.wrapper.db.ConnectionException;
import com.pg.wrapper.db.ConnectionTarget;
import com.pg.wrapper.db.Database;
import com.pg.wrapper.metrics.DiscardReason;
import com.pg.wrapper.metrics.NoOpPoolMetrics;
import com.pg.wrapper.metrics.PoolMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazily-filled connection pool with a hard limit on live connections.
 *
 * <p>State ({@code idle}, {@code liveCount}, {@code closed} and the counters) is guarded by a
 * single {@link ReentrantLock}; no field is read or written outside it. The invariant
 * {@code 0 <= idle.size() <= liveCount <= maxConnections} holds whenever the lock is free.</p>
 *
 * <p>Idle connections are reused most-recently-returned first. A new connection is opened only
 * when nothing is idle and {@code liveCount < maxConnections}: the slot is reserved under the
 * lock and the connection is opened after the lock is released, so a slow connect does not
 * stall concurrent acquire/release calls. If opening fails the reservation is given back.</p>
 *
 * <p>After {@link #close()} the pool rejects {@code acquire} with {@link IllegalStateException};
 * connections still checked out are closed when they are released.</p>
 */
public class BoundedConnectionPool implements ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(BoundedConnectionPool.class);

    private final PoolConfig config;
    private final DatabaseFactory factory;
    private final PoolMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();

    // guarded by lock
    private final Deque<Database> idle = new ArrayDeque<>();
    private int liveCount;
    private boolean closed;
    private long totalAcquired;
    private long totalReleased;
    private long totalCreated;
    private long totalDiscarded;
    private long totalExhausted;

    public BoundedConnectionPool(ConnectionTarget target, int maxConnections) {
        this(PoolConfig.builder().target(target).maxConnections(maxConnections).build());
    }

    public BoundedConnectionPool(PoolConfig config) {
        this(config, DatabaseFactory.postgres(), new NoOpPoolMetrics());
    }

    public BoundedConnectionPool(PoolConfig config, DatabaseFactory factory) {
        this(config, factory, new NoOpPoolMetrics());
    }

    public BoundedConnectionPool(PoolConfig config, DatabaseFactory factory, PoolMetrics metrics) {
        this.config = config;
        this.factory = factory;
        this.metrics = metrics;
        metrics.bind(this);
        log.info("Connection pool initialized: {}", config);
    }

    @Override
    public Optional<Database> acquire() {
        Database reused;
        boolean reserved = false;

        lock.lock();
        try {
            ensureOpen();
            reused = idle.pollFirst();
            if (reused != null) {
                totalAcquired++;
            } else if (liveCount < config.getMaxConnections()) {
                liveCount++;
                reserved = true;
            } else {
                totalExhausted++;
            }
        } finally {
            lock.unlock();
        }

        return complete(reused, reserved);
    }

    @Override
    public Optional<Database> acquire(Duration timeout) {
        long start = System.nanoTime();
        long remaining = timeout.toNanos();
        Database reused;
        boolean reserved = false;

        lock.lock();
        try {
            ensureOpen();
            while (true) {
                reused = idle.pollFirst();
                if (reused != null) {
                    totalAcquired++;
                    break;
                }
                if (liveCount < config.getMaxConnections()) {
                    liveCount++;
                    reserved = true;
                    break;
                }
                if (remaining <= 0L) {
                    totalExhausted++;
                    break;
                }
                try {
                    remaining = available.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for connection", e);
                }
                ensureOpen();
            }
        } finally {
            lock.unlock();
        }

        metrics.recordAcquireWait(Duration.ofNanos(System.nanoTime() - start));
        return complete(reused, reserved);
    }

    @Override
    public void release(Database database) {
        DiscardReason reason = null;
        if (database == null) {
            reason = DiscardReason.MISSING;
        } else if (!isUsable(database)) {
            reason = DiscardReason.BROKEN;
        }

        lock.lock();
        try {
            if (database != null && isIdle(database)) {
                log.warn("Connection released twice to pool '{}', ignoring", config.getName());
                return;
            }
            totalReleased++;
            if (reason == null && closed) {
                reason = DiscardReason.POOL_CLOSED;
            }
            if (reason == null) {
                if (idle.size() < config.getMaxIdle()) {
                    if (idle.size() >= liveCount) {
                        throw new IllegalStateException("Released connection is not checked out from pool '"
                                + config.getName() + "' (live=" + liveCount + ", idle=" + idle.size() + ")");
                    }
                    idle.addFirst(database);
                    available.signalAll();
                    log.debug("Connection released (live={}, idle={})", liveCount, idle.size());
                    return;
                }
                reason = DiscardReason.IDLE_CAPACITY;
            }
            decrementLive();
            totalDiscarded++;
            available.signalAll();
            log.debug("Connection discarded: {} (live={}, idle={})", reason, liveCount, idle.size());
        } finally {
            lock.unlock();
        }

        metrics.recordConnectionDiscarded(reason);
        if (database != null) {
            closeQuietly(database);
        }
    }

    @Override
    public PoolStats getStats() {
        lock.lock();
        try {
            return new PoolStats(
                    config.getMaxConnections(),
                    liveCount,
                    liveCount - idle.size(),
                    idle.size(),
                    totalAcquired,
                    totalReleased,
                    totalCreated,
                    totalDiscarded,
                    totalExhausted
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        List<Database> drained;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            drained = new ArrayList<>(idle);
            idle.clear();
            for (int i = 0; i < drained.size(); i++) {
                decrementLive();
            }
            totalDiscarded += drained.size();
            available.signalAll();
        } finally {
            lock.unlock();
        }

        log.info("Closing connection pool '{}' ({} idle connection(s))", config.getName(), drained.size());
        for (Database db : drained) {
            metrics.recordConnectionDiscarded(DiscardReason.POOL_CLOSED);
            closeQuietly(db);
        }
        log.info("Connection pool '{}' closed", config.getName());
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public PoolConfig getConfig() {
        return config;
    }

    private Optional<Database> complete(Database reused, boolean reserved) {
        if (reused != null) {
            log.debug("Connection reused from pool '{}'", config.getName());
            return Optional.of(reused);
        }
        if (!reserved) {
            metrics.recordPoolExhausted();
            log.debug("Pool '{}' exhausted (max={})", config.getName(), config.getMaxConnections());
            return Optional.empty();
        }
        return Optional.of(openReserved());
    }

    private Database openReserved() {
        Database db;
        try {
            db = factory.open(config.getTarget());
        } catch (RuntimeException | Error e) {
            returnReservation();
            metrics.recordConnectionOpenFailed();
            log.warn("Failed to open connection for pool '{}': {}", config.getName(), e.getMessage());
            throw e;
        }
        if (db == null) {
            returnReservation();
            metrics.recordConnectionOpenFailed();
            throw new ConnectionException("Connection factory returned no connection");
        }

        int live;
        lock.lock();
        try {
            totalCreated++;
            totalAcquired++;
            live = liveCount;
        } finally {
            lock.unlock();
        }
        metrics.recordConnectionCreated();
        log.debug("Opened new connection for pool '{}' (live={})", config.getName(), live);
        return db;
    }

    private void returnReservation() {
        lock.lock();
        try {
            decrementLive();
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private void decrementLive() {
        if (liveCount <= 0) {
            throw new IllegalStateException("Live connection count underflow in pool '" + config.getName() + "'");
        }
        liveCount--;
    }

    // caller holds lock
    private boolean isIdle(Database database) {
        for (Database candidate : idle) {
            if (candidate == database) {
                return true;
            }
        }
        return false;
    }

    // caller holds lock
    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Pool is closed");
        }
    }

    private boolean isUsable(Database database) {
        try {
            return database.isOpen();
        } catch (RuntimeException e) {
            log.debug("Liveness check failed: {}", e.getMessage());
            return false;
        }
    }

    private void closeQuietly(Database database) {
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing connection: {}", e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "BoundedConnectionPool{" + config.getName() + ", " + getStats() + '}';
    }
}
