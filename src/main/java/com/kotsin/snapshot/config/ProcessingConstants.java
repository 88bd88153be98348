package com.kotsin.snapshot.config;

/**
 * Central constants for snapshot processing
 *
 * Defaults for everything that is configurable live here so properties,
 * tests and validators share a single source of truth.
 */
public final class ProcessingConstants {

    private ProcessingConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== NORMALIZER CONSTANTS ==========

    /** Prices above this are assumed mis-scaled by the host */
    public static final double DEFAULT_RESCALE_THRESHOLD = 10000.0;
    /** Divisor applied once to a mis-scaled price */
    public static final double DEFAULT_RESCALE_FACTOR = 100.0;
    public static final double DEFAULT_PRICE_MULTIPLIER = 1.0;

    // ========== VALIDATOR CONSTANTS ==========

    /** Fraction of the band width a stray reference is moved inside from the crossed edge */
    public static final double DEFAULT_REPOSITION_FRACTION = 0.1;
    public static final double MAX_REPOSITION_FRACTION = 0.5;

    // ========== BIAS CONSTANTS ==========

    /** Inside the band, confidence reaches zero at this fraction of the range away from the reference */
    public static final double INSIDE_BAND_HALF_RANGE = 0.5;
    public static final double MIN_CONFIDENCE = 0.0;
    public static final double MAX_CONFIDENCE = 1.0;

    // ========== STORE CONSTANTS ==========

    public static final int DEFAULT_MAX_BARS_PER_FEED = 500;

    // ========== SINK CONSTANTS ==========

    public static final String SINK_TYPE_LOG = "log";
    public static final String SINK_TYPE_KAFKA = "kafka";
}
