package com.kotsin.snapshot.domain.tracker;

import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Mutable per-feed state. Owned by {@link SnapshotStateTracker}; every access happens
 * while holding this object's monitor.
 */
@Getter(AccessLevel.PACKAGE)
final class FeedState {

    private final String feedId;

    /** null until the first accepted bar */
    private Integer lastEmittedBarIndex;

    /** Last valid corrected snapshot; serves as "previous" on the next accepted bar */
    private CorrectedSnapshot previousSnapshot;

    private long acceptedBars;

    FeedState(String feedId) {
        this.feedId = feedId;
    }

    boolean isStale(int barIndex) {
        return lastEmittedBarIndex != null && barIndex <= lastEmittedBarIndex;
    }

    void advance(int barIndex, CorrectedSnapshot current) {
        this.previousSnapshot = current;
        this.lastEmittedBarIndex = barIndex;
        this.acceptedBars++;
    }

    FeedPhase phase() {
        return FeedPhase.forAcceptedBars(acceptedBars);
    }

    void clear() {
        lastEmittedBarIndex = null;
        previousSnapshot = null;
        acceptedBars = 0;
    }
}
