package com.kotsin.snapshot.domain.normalizer;

import lombok.Value;

/**
 * Outcome of normalizing one raw host price.
 * A rejected price carries 0.0 so downstream positivity checks discard it.
 */
@Value
public class NormalizedPrice {

    private static final NormalizedPrice REJECTED = new NormalizedPrice(0.0, false, true, Double.NaN);

    double price;
    boolean rescaled;
    boolean rejected;
    /** Value before rescale and rounding (after the feed multiplier), for diagnostics */
    double unscaled;

    static NormalizedPrice accepted(double price, boolean rescaled, double unscaled) {
        return new NormalizedPrice(price, rescaled, false, unscaled);
    }

    static NormalizedPrice rejected(double unscaled) {
        return Double.isNaN(unscaled) ? REJECTED : new NormalizedPrice(0.0, false, true, unscaled);
    }

    public boolean isAvailable() {
        return !rejected;
    }
}
