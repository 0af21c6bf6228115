package com.pg.wrapper.metrics;

import com.pg.wrapper.pool.ConnectionPool;

import java.time.Duration;

/**
 * Sink for connection pool events.
 * The default {@link NoOpPoolMetrics} does nothing, so the pool works without any metrics
 * library on the classpath.
 */
public interface PoolMetrics {

    /**
     * Called once when a pool is constructed, so implementations can register gauges on it.
     */
    void bind(ConnectionPool pool);

    void recordConnectionCreated();

    void recordConnectionOpenFailed();

    void recordConnectionDiscarded(DiscardReason reason);

    void recordPoolExhausted();

    /**
     * Time a blocking acquire spent waiting, recorded whether or not it obtained a session.
     */
    void recordAcquireWait(Duration waited);
}
