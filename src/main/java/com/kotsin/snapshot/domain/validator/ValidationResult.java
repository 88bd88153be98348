package com.kotsin.snapshot.domain.validator;

import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import com.kotsin.snapshot.domain.model.RawTriplet;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either a corrected snapshot or the reason the triplet was discarded.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    CorrectedSnapshot snapshot;
    RawTriplet input;
    String invalidReason;

    public static ValidationResult valid(RawTriplet input, CorrectedSnapshot snapshot) {
        return new ValidationResult(snapshot, input, null);
    }

    public static ValidationResult invalid(RawTriplet input, String reason) {
        return new ValidationResult(null, input, reason);
    }

    public boolean isValid() {
        return snapshot != null;
    }
}
