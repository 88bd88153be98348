package com.kotsin.snapshot.domain.validator;

import com.kotsin.snapshot.config.SnapshotProperties;
import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import com.kotsin.snapshot.domain.model.RawTriplet;
import com.kotsin.snapshot.domain.model.ViolationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ordering and containment repair of reference/upper/lower triplets.
 */
@DisplayName("TripletValidator - invariant repair")
class TripletValidatorTest {

    private TripletValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TripletValidator(new SnapshotProperties());
    }

    // ========== CLEAN INPUT ==========

    @Test
    @DisplayName("Well-formed triplet passes through untouched")
    void testCleanTriplet() {
        ValidationResult result = validator.validate(RawTriplet.of(6440.0, 6454.0, 6430.0), 7);

        assertTrue(result.isValid());
        CorrectedSnapshot snapshot = result.getSnapshot();
        assertEquals(6440.0, snapshot.getReference());
        assertEquals(6454.0, snapshot.getUpper());
        assertEquals(6430.0, snapshot.getLower());
        assertEquals(7, snapshot.getBarIndex());
        assertFalse(snapshot.isCorrected());
        assertTrue(snapshot.getViolations().isEmpty());
    }

    @Test
    @DisplayName("Reference sitting exactly on a band edge is contained")
    void testReferenceOnEdge() {
        ValidationResult onLower = validator.validate(RawTriplet.of(6430.0, 6454.0, 6430.0), 1);
        ValidationResult onUpper = validator.validate(RawTriplet.of(6454.0, 6454.0, 6430.0), 1);

        assertFalse(onLower.getSnapshot().isCorrected());
        assertFalse(onUpper.getSnapshot().isCorrected());
    }

    // ========== ORDER ==========

    @Test
    @DisplayName("Inverted band is swapped and flagged")
    void testOrderInverted() {
        ValidationResult result = validator.validate(RawTriplet.of(6440.0, 6430.75, 6454.0), 3);

        CorrectedSnapshot snapshot = result.getSnapshot();
        assertEquals(6440.0, snapshot.getReference());
        assertEquals(6454.0, snapshot.getUpper());
        assertEquals(6430.75, snapshot.getLower());
        assertTrue(snapshot.isCorrected());
        assertEquals(List.of(ViolationKind.ORDER_INVERTED), snapshot.getViolations());
    }

    // ========== CONTAINMENT ==========

    @Test
    @DisplayName("Reference above the band moves 10% of the width inside the upper edge")
    void testReferenceAboveUpper() {
        ValidationResult result = validator.validate(RawTriplet.of(6500.0, 6454.0, 6430.0), 3);

        CorrectedSnapshot snapshot = result.getSnapshot();
        assertEquals(6451.6, snapshot.getReference(), 1e-9);
        assertEquals(6454.0, snapshot.getUpper());
        assertEquals(6430.0, snapshot.getLower());
        assertEquals(List.of(ViolationKind.REFERENCE_ABOVE_UPPER), snapshot.getViolations());
    }

    @Test
    @DisplayName("Reference below the band moves 10% of the width inside the lower edge")
    void testReferenceBelowLower() {
        ValidationResult result = validator.validate(RawTriplet.of(6400.0, 6454.0, 6430.0), 3);

        CorrectedSnapshot snapshot = result.getSnapshot();
        assertEquals(6432.4, snapshot.getReference(), 1e-9);
        assertEquals(List.of(ViolationKind.REFERENCE_BELOW_LOWER), snapshot.getViolations());
    }

    @Test
    @DisplayName("Order is repaired before containment is checked")
    void testOrderThenContainment() {
        // upper/lower swapped AND reference below the real lower bound
        ValidationResult result = validator.validate(RawTriplet.of(6420.0, 6430.0, 6454.0), 3);

        CorrectedSnapshot snapshot = result.getSnapshot();
        assertEquals(6454.0, snapshot.getUpper());
        assertEquals(6430.0, snapshot.getLower());
        assertEquals(6432.4, snapshot.getReference(), 1e-9);
        assertEquals(List.of(ViolationKind.ORDER_INVERTED, ViolationKind.REFERENCE_BELOW_LOWER),
            snapshot.getViolations());
    }

    @Test
    @DisplayName("Inverted band whose reference is contained after the swap only flags the order")
    void testSwapRestoresContainment() {
        ValidationResult result = validator.validate(RawTriplet.of(6440.0, 6430.0, 6454.0), 3);

        assertEquals(List.of(ViolationKind.ORDER_INVERTED), result.getSnapshot().getViolations());
    }

    @Test
    @DisplayName("Zero-width band pulls the reference onto the band")
    void testZeroWidthBand() {
        ValidationResult result = validator.validate(RawTriplet.of(6440.0, 6430.0, 6430.0), 3);

        CorrectedSnapshot snapshot = result.getSnapshot();
        assertEquals(6430.0, snapshot.getReference());
        assertEquals(List.of(ViolationKind.REFERENCE_ABOVE_UPPER), snapshot.getViolations());
    }

    @Test
    @DisplayName("Configured reposition fraction is used")
    void testCustomFraction() {
        SnapshotProperties properties = new SnapshotProperties();
        properties.getValidator().setRepositionFraction(0.5);
        TripletValidator midpoint = new TripletValidator(properties);

        ValidationResult result = midpoint.validate(RawTriplet.of(6500.0, 6454.0, 6430.0), 3);

        assertEquals(6442.0, result.getSnapshot().getReference(), 1e-9);
        assertEquals(0.5, midpoint.getRepositionFraction());
    }

    // ========== DISCARDED INPUT ==========

    @Test
    @DisplayName("Any non-positive value discards the triplet without correction")
    void testNonPositiveDiscarded() {
        assertFalse(validator.validate(RawTriplet.of(0.0, 6454.0, 6430.0), 3).isValid());
        assertFalse(validator.validate(RawTriplet.of(6440.0, 0.0, 6430.0), 3).isValid());
        assertFalse(validator.validate(RawTriplet.of(6440.0, 6454.0, -1.0), 3).isValid());
        assertFalse(validator.validate(RawTriplet.of(0.0, 0.0, 0.0), 3).isValid());
    }

    @Test
    @DisplayName("Non-finite values discard the triplet")
    void testNonFiniteDiscarded() {
        ValidationResult result = validator.validate(RawTriplet.of(Double.NaN, 6454.0, 6430.0), 3);

        assertFalse(result.isValid());
        assertNull(result.getSnapshot());
        assertNotNull(result.getInvalidReason());
    }

    @Test
    @DisplayName("Null triplet is invalid, not an exception")
    void testNullTriplet() {
        assertFalse(validator.validate(null, 3).isValid());
    }
}
