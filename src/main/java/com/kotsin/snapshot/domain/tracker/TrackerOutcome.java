package com.kotsin.snapshot.domain.tracker;

import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of offering one bar to the state tracker.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TrackerOutcome {

    public enum Status {
        /** New bar with a valid snapshot: state advanced */
        ACCEPTED,
        /** Bar index already seen (or older): nothing changed */
        SUPPRESSED,
        /** Snapshot invalid/unavailable: stale state preserved */
        NO_DATA
    }

    Status status;
    /** Snapshot to emit with scope=previous, null when none is due */
    CorrectedSnapshot previousToEmit;
    CorrectedSnapshot current;
    FeedPhase phase;

    static TrackerOutcome accepted(CorrectedSnapshot previousToEmit, CorrectedSnapshot current, FeedPhase phase) {
        return new TrackerOutcome(Status.ACCEPTED, previousToEmit, current, phase);
    }

    static TrackerOutcome suppressed(FeedPhase phase) {
        return new TrackerOutcome(Status.SUPPRESSED, null, null, phase);
    }

    static TrackerOutcome noData(FeedPhase phase) {
        return new TrackerOutcome(Status.NO_DATA, null, null, phase);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public boolean hasPreviousToEmit() {
        return previousToEmit != null;
    }
}
