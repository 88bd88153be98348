package com.kotsin.snapshot.source;

import com.kotsin.snapshot.domain.model.Feed;
import com.kotsin.snapshot.domain.model.RawTriplet;
import com.kotsin.snapshot.domain.model.Scope;

import java.util.Optional;

/**
 * Read-only access to the host's per-bar indicator arrays.
 * Implementations must return immediately; an empty result means "not available".
 */
public interface SnapshotSource {

    BarBounds bounds(Feed feed);

    Optional<RawTriplet> readTriplet(Feed feed, Scope scope, int barIndex);
}
