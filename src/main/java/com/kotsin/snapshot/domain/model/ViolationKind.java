package com.kotsin.snapshot.domain.model;

/**
 * Structural invariant violations detected (and repaired) on a triplet.
 * Listed in the order the corrector resolves them.
 */
public enum ViolationKind {
    /** upper < lower, band bounds swapped */
    ORDER_INVERTED,
    /** reference below the band, moved inside from the lower edge */
    REFERENCE_BELOW_LOWER,
    /** reference above the band, moved inside from the upper edge */
    REFERENCE_ABOVE_UPPER
}
