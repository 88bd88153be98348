package com.kotsin.snapshot.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Feed - one instrument/chart stream.
 *
 * Immutable after configuration. Threaded explicitly through every call of the pipeline
 * instead of branching on "which chart am I".
 */
@Value
public class Feed {

    String id;
    String symbol;
    int chartNumber;

    /** Price grid of the feed. Always > 0. */
    double tickSize;

    /** Host real-time price multiplier. Raw prices are divided by it first. */
    double priceMultiplier;

    /** Per-feed implausibility threshold for the rescale heuristic (null = use global). */
    Double rescaleThreshold;

    @Builder
    private Feed(String id, String symbol, int chartNumber, double tickSize,
                 double priceMultiplier, Double rescaleThreshold) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Feed id must not be blank");
        }
        if (!(tickSize > 0) || Double.isInfinite(tickSize)) {
            throw new IllegalArgumentException("Tick size must be positive for feed " + id + ", got: " + tickSize);
        }
        if (rescaleThreshold != null && !(rescaleThreshold > 0)) {
            throw new IllegalArgumentException("Rescale threshold must be positive for feed " + id);
        }
        this.id = id;
        this.symbol = symbol != null ? symbol : id;
        this.chartNumber = chartNumber;
        this.tickSize = tickSize;
        this.priceMultiplier = priceMultiplier != 0.0 ? priceMultiplier : 1.0;
        this.rescaleThreshold = rescaleThreshold;
    }

    public static Feed of(String id, double tickSize) {
        return Feed.builder().id(id).tickSize(tickSize).priceMultiplier(1.0).build();
    }
}
