package com.kotsin.snapshot.domain.tracker;

import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Snapshot State Tracker
 * Per feed: last processed bar index (dedup) and last valid corrected snapshot (lineage).
 *
 * Contract of {@link #track}:
 * - barIndex <= lastEmittedBarIndex: SUPPRESSED, no state change
 * - snapshot == null (invalid / unavailable): NO_DATA, no state change
 * - otherwise the held previous snapshot is handed back for emission unless its levels equal
 *   the incoming snapshot, then the incoming snapshot becomes the held one and
 *   lastEmittedBarIndex moves to barIndex
 *
 * Thread-Safety: one state cell per feed, mutated only under that cell's monitor.
 * Feeds never share a lock.
 */
@Slf4j
@Component
public class SnapshotStateTracker {

    private final ConcurrentHashMap<String, FeedState> states = new ConcurrentHashMap<>();

    /**
     * Run an action while holding the feed's lock. Reentrant with every other tracker call.
     */
    public <T> T runExclusive(String feedId, Supplier<T> action) {
        FeedState state = stateFor(feedId);
        synchronized (state) {
            return action.get();
        }
    }

    public boolean isSuppressed(String feedId, int barIndex) {
        FeedState state = stateFor(feedId);
        synchronized (state) {
            return state.isStale(barIndex);
        }
    }

    public TrackerOutcome track(String feedId, int barIndex, CorrectedSnapshot snapshot) {
        FeedState state = stateFor(feedId);
        synchronized (state) {
            if (state.isStale(barIndex)) {
                log.debug("Bar {} suppressed for feed {} (last={})", barIndex, feedId, state.getLastEmittedBarIndex());
                return TrackerOutcome.suppressed(state.phase());
            }
            if (snapshot == null) {
                return TrackerOutcome.noData(state.phase());
            }

            CorrectedSnapshot held = state.getPreviousSnapshot();
            CorrectedSnapshot previousToEmit = held != null && !held.hasSameLevels(snapshot) ? held : null;

            state.advance(barIndex, snapshot);
            return TrackerOutcome.accepted(previousToEmit, snapshot, state.phase());
        }
    }

    public OptionalInt lastEmittedBarIndex(String feedId) {
        FeedState state = states.get(feedId);
        if (state == null) {
            return OptionalInt.empty();
        }
        synchronized (state) {
            Integer last = state.getLastEmittedBarIndex();
            return last == null ? OptionalInt.empty() : OptionalInt.of(last);
        }
    }

    public Optional<CorrectedSnapshot> previousSnapshot(String feedId) {
        FeedState state = states.get(feedId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.ofNullable(state.getPreviousSnapshot());
        }
    }

    public FeedPhase phase(String feedId) {
        FeedState state = states.get(feedId);
        if (state == null) {
            return FeedPhase.EMPTY;
        }
        synchronized (state) {
            return state.phase();
        }
    }

    /**
     * Forget everything about a feed (e.g. on a session change).
     */
    public void reset(String feedId) {
        FeedState state = states.get(feedId);
        if (state != null) {
            synchronized (state) {
                state.clear();
            }
            log.info("🔄 Feed state reset: {}", feedId);
        }
    }

    public Set<String> feedIds() {
        return Set.copyOf(states.keySet());
    }

    private FeedState stateFor(String feedId) {
        return states.computeIfAbsent(feedId, FeedState::new);
    }
}
