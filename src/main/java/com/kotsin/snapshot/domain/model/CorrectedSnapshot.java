package com.kotsin.snapshot.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * CorrectedSnapshot - a triplet that satisfies lower <= reference <= upper.
 *
 * Carries the audit trail of what was repaired. Construction fails if the
 * containment invariant does not hold, so no broken snapshot can reach the tracker.
 */
@Value
public class CorrectedSnapshot {

    double reference;
    double upper;
    double lower;
    int barIndex;
    boolean corrected;
    List<ViolationKind> violations;

    @Builder
    private CorrectedSnapshot(double reference, double upper, double lower, int barIndex,
                              @Singular List<ViolationKind> violations) {
        if (!(lower <= reference && reference <= upper)) {
            throw new IllegalArgumentException(String.format(
                "Snapshot violates lower <= reference <= upper: lower=%.4f ref=%.4f upper=%.4f",
                lower, reference, upper));
        }
        this.reference = reference;
        this.upper = upper;
        this.lower = lower;
        this.barIndex = barIndex;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
        this.corrected = !this.violations.isEmpty();
    }

    public double getBandWidth() {
        return upper - lower;
    }

    /**
     * Numeric equality on reference/upper/lower only (bar index and audit trail ignored).
     */
    public boolean hasSameLevels(CorrectedSnapshot other) {
        return other != null
            && Double.compare(reference, other.reference) == 0
            && Double.compare(upper, other.upper) == 0
            && Double.compare(lower, other.lower) == 0;
    }
}
