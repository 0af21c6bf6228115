package com.pg.wrapper.metrics;

/**
 * Why a pool destroyed a connection instead of keeping it idle.
 */
public enum DiscardReason {
    /** Released as null: the caller lost its handle. */
    MISSING,
    /** Released in a state that is no longer usable. */
    BROKEN,
    /** Released while the idle stack was already full. */
    IDLE_CAPACITY,
    /** Released after, or idle at, pool teardown. */
    POOL_CLOSED
}
