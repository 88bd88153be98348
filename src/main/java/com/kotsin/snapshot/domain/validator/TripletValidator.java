package com.kotsin.snapshot.domain.validator;

import com.kotsin.snapshot.config.SnapshotProperties;
import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import com.kotsin.snapshot.domain.model.RawTriplet;
import com.kotsin.snapshot.domain.model.ViolationKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * TripletValidator - enforces lower <= reference <= upper on a normalized triplet
 *
 * Rules, in fixed order:
 * - every value finite and > 0, otherwise the triplet is discarded (never corrected)
 * - upper < lower: swap the bounds (ORDER_INVERTED)
 * - reference < lower: move it to lower + f * width (REFERENCE_BELOW_LOWER)
 * - reference > upper: move it to upper - f * width (REFERENCE_ABOVE_UPPER)
 *
 * f is the reposition fraction (0.1 by default): the reference lands near the edge it
 * escaped from, not at the band midpoint.
 */
@Slf4j
@Component
public class TripletValidator {

    private final double repositionFraction;

    public TripletValidator(SnapshotProperties properties) {
        this.repositionFraction = properties.getValidator().getRepositionFraction();
    }

    public ValidationResult validate(RawTriplet triplet, int barIndex) {
        if (triplet == null) {
            return ValidationResult.invalid(null, "triplet is null");
        }
        if (!triplet.isFinite()) {
            return ValidationResult.invalid(triplet, "non-finite value in " + triplet);
        }
        if (!triplet.isStrictlyPositive()) {
            return ValidationResult.invalid(triplet, "non-positive value in " + triplet);
        }

        CorrectedSnapshot.CorrectedSnapshotBuilder builder = CorrectedSnapshot.builder().barIndex(barIndex);

        double reference = triplet.getReference();
        double upper = triplet.getUpper();
        double lower = triplet.getLower();

        // Order first: containment is meaningless on an inverted band
        if (upper < lower) {
            double tmp = upper;
            upper = lower;
            lower = tmp;
            builder.violation(ViolationKind.ORDER_INVERTED);
        }

        double width = upper - lower;
        if (reference < lower) {
            reference = lower + repositionFraction * width;
            builder.violation(ViolationKind.REFERENCE_BELOW_LOWER);
        } else if (reference > upper) {
            reference = upper - repositionFraction * width;
            builder.violation(ViolationKind.REFERENCE_ABOVE_UPPER);
        }

        CorrectedSnapshot snapshot = builder
            .reference(reference)
            .upper(upper)
            .lower(lower)
            .build();

        if (snapshot.isCorrected()) {
            log.debug("Corrected bar {}: {} -> ref={} upper={} lower={} {}",
                barIndex, triplet, reference, upper, lower, snapshot.getViolations());
        }
        return ValidationResult.valid(triplet, snapshot);
    }

    public double getRepositionFraction() {
        return repositionFraction;
    }
}
