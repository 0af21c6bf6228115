package com.pg.wrapper.metrics;

import com.pg.wrapper.pool.ConnectionPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link PoolMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics, all tagged with {@code pool}:</p>
 * <ul>
 *   <li>{@code pg.pool.connections.created}: counter</li>
 *   <li>{@code pg.pool.connections.open.failed}: counter</li>
 *   <li>{@code pg.pool.connections.discarded}: counter (tag: reason)</li>
 *   <li>{@code pg.pool.exhausted}: counter</li>
 *   <li>{@code pg.pool.acquire.wait}: timer</li>
 *   <li>{@code pg.pool.connections.live}, {@code .idle}, {@code .active}, {@code .max}: gauges</li>
 * </ul>
 */
public class MicrometerPoolMetrics implements PoolMetrics {

    private final MeterRegistry registry;
    private final String poolName;
    private final Counter createdCounter;
    private final Counter openFailedCounter;
    private final Counter exhaustedCounter;
    private final Timer acquireWaitTimer;
    private final Map<DiscardReason, Counter> discardCounters = new EnumMap<>(DiscardReason.class);

    public MicrometerPoolMetrics(MeterRegistry registry, String poolName) {
        this.registry = registry;
        this.poolName = poolName;
        this.createdCounter = Counter.builder("pg.pool.connections.created")
                .description("Number of connections opened by the pool")
                .tag("pool", poolName)
                .register(registry);
        this.openFailedCounter = Counter.builder("pg.pool.connections.open.failed")
                .description("Number of failed attempts to open a connection")
                .tag("pool", poolName)
                .register(registry);
        this.exhaustedCounter = Counter.builder("pg.pool.exhausted")
                .description("Number of acquisitions that found the pool at capacity")
                .tag("pool", poolName)
                .register(registry);
        this.acquireWaitTimer = Timer.builder("pg.pool.acquire.wait")
                .description("Time spent waiting in blocking acquire")
                .tag("pool", poolName)
                .register(registry);
        for (DiscardReason reason : DiscardReason.values()) {
            discardCounters.put(reason, Counter.builder("pg.pool.connections.discarded")
                    .description("Number of connections destroyed instead of pooled")
                    .tag("pool", poolName)
                    .tag("reason", reason.name())
                    .register(registry));
        }
    }

    @Override
    public void bind(ConnectionPool pool) {
        Gauge.builder("pg.pool.connections.live", pool, p -> p.getStats().liveConnections())
                .description("Connections currently open (active + idle)")
                .tag("pool", poolName)
                .register(registry);
        Gauge.builder("pg.pool.connections.idle", pool, p -> p.getStats().idleConnections())
                .description("Connections waiting in the pool")
                .tag("pool", poolName)
                .register(registry);
        Gauge.builder("pg.pool.connections.active", pool, p -> p.getStats().activeConnections())
                .description("Connections checked out")
                .tag("pool", poolName)
                .register(registry);
        Gauge.builder("pg.pool.connections.max", pool, p -> p.getStats().maxConnections())
                .description("Configured connection limit")
                .tag("pool", poolName)
                .register(registry);
    }

    @Override
    public void recordConnectionCreated() {
        createdCounter.increment();
    }

    @Override
    public void recordConnectionOpenFailed() {
        openFailedCounter.increment();
    }

    @Override
    public void recordConnectionDiscarded(DiscardReason reason) {
        discardCounters.get(reason).increment();
    }

    @Override
    public void recordPoolExhausted() {
        exhaustedCounter.increment();
    }

    @Override
    public void recordAcquireWait(Duration waited) {
        acquireWaitTimer.record(waited);
    }
}
