package com.pg.wrapper.pool;

import com.pg.wrapper.db.ConnectionException;
import com.pg.wrapper.db.ConnectionTarget;
import com.pg.wrapper.db.Database;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link DatabaseFactory} producing {@link FakeDatabase}s, with switchable failure and a gate
 * that can hold connection opens until released.
 */
class FakeDatabaseFactory implements DatabaseFactory {

    private final AtomicInteger opened = new AtomicInteger(0);
    private final AtomicBoolean failing = new AtomicBoolean(false);
    private final List<FakeDatabase> created = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch gate;
    private volatile CountDownLatch entered;

    @Override
    public Database open(ConnectionTarget target) {
        CountDownLatch g = gate;
        if (g != null) {
            entered.countDown();
            try {
                if (!g.await(5, TimeUnit.SECONDS)) {
                    throw new ConnectionException("gate timed out");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("interrupted", e);
            }
        }
        if (failing.get()) {
            throw new ConnectionException("simulated connect failure to " + target.getHost());
        }
        FakeDatabase db = new FakeDatabase(opened.incrementAndGet());
        created.add(db);
        return db;
    }

    void setFailing(boolean fail) {
        failing.set(fail);
    }

    /**
     * Makes subsequent opens block until {@code release} is counted down.
     *
     * @return latch counted down when an open enters the gate
     */
    CountDownLatch holdOpens(CountDownLatch release) {
        this.entered = new CountDownLatch(1);
        this.gate = release;
        return entered;
    }

    void stopHolding() {
        this.gate = null;
    }

    int openedCount() {
        return opened.get();
    }

    List<FakeDatabase> created() {
        return created;
    }
}
