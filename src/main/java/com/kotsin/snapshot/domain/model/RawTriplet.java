package com.kotsin.snapshot.domain.model;

import lombok.Value;

/**
 * Reference price and its high/low band exactly as read from the host
 * (e.g. VPOC / VAH / VAL). No ordering is guaranteed.
 */
@Value(staticConstructor = "of")
public class RawTriplet {
    double reference;
    double upper;
    double lower;

    public boolean isFinite() {
        return Double.isFinite(reference) && Double.isFinite(upper) && Double.isFinite(lower);
    }

    public boolean isStrictlyPositive() {
        return reference > 0 && upper > 0 && lower > 0;
    }

    @Override
    public String toString() {
        return String.format("RawTriplet{ref=%.4f upper=%.4f lower=%.4f}", reference, upper, lower);
    }
}
