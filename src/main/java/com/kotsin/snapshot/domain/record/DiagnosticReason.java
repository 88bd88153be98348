package com.kotsin.snapshot.domain.record;

/**
 * Why a diagnostic record was produced. None of these is fatal.
 */
public enum DiagnosticReason {
    /** Source adapter returned no data (or threw) for the requested bar */
    SOURCE_UNAVAILABLE,
    /** Source reported empty array bounds for the feed */
    BOUNDS_EXHAUSTED,
    /** Triplet had a non-positive or non-finite value after normalization */
    INVALID_TRIPLET,
    /** Rescale heuristic divided a price that looked mis-scaled */
    PRICE_RESCALED,
    /** No usable last trade price, bias skipped for this cycle */
    LAST_PRICE_UNAVAILABLE;

    /**
     * True for reasons that leave the feed state untouched for the cycle.
     */
    public boolean isNoData() {
        return this == SOURCE_UNAVAILABLE || this == BOUNDS_EXHAUSTED || this == INVALID_TRIPLET;
    }
}
