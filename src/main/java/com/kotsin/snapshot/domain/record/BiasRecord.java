package com.kotsin.snapshot.domain.record;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.kotsin.snapshot.domain.model.Bias;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Directional bias derived from one corrected snapshot and the latest trade price.
 *
 * targets = [primary, secondary]; confidence is always within [0, 1].
 */
@Value
public class BiasRecord implements EngineRecord {

    String feedId;
    int barIndex;
    double lastPrice;
    Bias bias;
    List<Double> targets;
    double confidence;

    @Builder
    private BiasRecord(String feedId, int barIndex, double lastPrice, Bias bias,
                       double primaryTarget, double secondaryTarget, double confidence) {
        if (bias == null) {
            throw new IllegalArgumentException("Bias must not be null");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1, got: " + confidence);
        }
        this.feedId = feedId;
        this.barIndex = barIndex;
        this.lastPrice = lastPrice;
        this.bias = bias;
        this.targets = List.of(primaryTarget, secondaryTarget);
        this.confidence = confidence;
    }

    @JsonIgnore
    public double getPrimaryTarget() {
        return targets.get(0);
    }

    @JsonIgnore
    public double getSecondaryTarget() {
        return targets.get(1);
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.BIAS;
    }
}
