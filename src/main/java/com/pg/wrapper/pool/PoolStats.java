package com.pg.wrapper.pool;

/**
 * Point-in-time statistics for a {@link ConnectionPool}.
 *
 * @param maxConnections    configured upper bound on live connections
 * @param liveConnections   connections that currently exist (active + idle)
 * @param activeConnections connections currently checked out
 * @param idleConnections   connections waiting in the pool
 * @param totalAcquired     cumulative successful acquisitions
 * @param totalReleased     cumulative release calls
 * @param totalCreated      cumulative connections opened
 * @param totalDiscarded    cumulative connections destroyed on release or teardown
 * @param totalExhausted    cumulative acquisitions that found the pool at capacity
 */
public record PoolStats(
        int maxConnections,
        int liveConnections,
        int activeConnections,
        int idleConnections,
        long totalAcquired,
        long totalReleased,
        long totalCreated,
        long totalDiscarded,
        long totalExhausted
) {

    /**
     * Fraction of capacity currently checked out, between 0 and 1.
     */
    public double utilization() {
        return maxConnections > 0 ? (double) activeConnections / maxConnections : 0.0;
    }
}
