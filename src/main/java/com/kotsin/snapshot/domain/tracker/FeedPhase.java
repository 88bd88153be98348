package com.kotsin.snapshot.domain.tracker;

/**
 * Lineage state of one feed. Transitions happen only on a new bar index
 * carrying a valid corrected snapshot.
 */
public enum FeedPhase {
    /** Nothing accepted yet */
    EMPTY,
    /** One bar accepted, nothing to serve as previous */
    HAS_CURRENT,
    /** At least two bars accepted */
    HAS_CURRENT_AND_PREVIOUS;

    static FeedPhase forAcceptedBars(long acceptedBars) {
        if (acceptedBars <= 0) return EMPTY;
        if (acceptedBars == 1) return HAS_CURRENT;
        return HAS_CURRENT_AND_PREVIOUS;
    }
}
