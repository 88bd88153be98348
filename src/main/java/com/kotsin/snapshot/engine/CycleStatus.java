package com.kotsin.snapshot.engine;

/**
 * Outcome of one bar-close cycle for one feed.
 */
public enum CycleStatus {
    /** Snapshot records emitted, state advanced */
    EMITTED,
    /** Duplicate or stale bar index, nothing read or emitted */
    SUPPRESSED,
    /** Input unavailable or invalid, diagnostic emitted, state untouched */
    NO_DATA
}
