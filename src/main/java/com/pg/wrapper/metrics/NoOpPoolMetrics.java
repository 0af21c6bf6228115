package com.pg.wrapper.metrics;

import com.pg.wrapper.pool.ConnectionPool;

import java.time.Duration;

/**
 * No-op implementation of {@link PoolMetrics}.
 */
public class NoOpPoolMetrics implements PoolMetrics {

    @Override
    public void bind(ConnectionPool pool) {
    }

    @Override
    public void recordConnectionCreated() {
    }

    @Override
    public void recordConnectionOpenFailed() {
    }

    @Override
    public void recordConnectionDiscarded(DiscardReason reason) {
    }

    @Override
    public void recordPoolExhausted() {
    }

    @Override
    public void recordAcquireWait(Duration waited) {
    }
}
