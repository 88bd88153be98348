package com.kotsin.snapshot.domain.signal;

import com.kotsin.snapshot.config.ProcessingConstants;
import com.kotsin.snapshot.domain.model.Bias;
import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import com.kotsin.snapshot.domain.model.Feed;
import com.kotsin.snapshot.domain.record.BiasRecord;
import org.springframework.stereotype.Component;

/**
 * BiasSignalGenerator - classifies the last trade price against the band.
 *
 * range = max(tickSize, upper - lower)
 *
 * | lastPrice         | bias          | targets             | confidence                               |
 * |-------------------|---------------|---------------------|------------------------------------------|
 * | > upper           | BREAKOUT_UP   | [reference, upper]  | min(1, (lastPrice - upper) / range)      |
 * | < lower           | BREAKOUT_DOWN | [reference, lower]  | min(1, (lower - lastPrice) / range)      |
 * | within [lower, upper] | INSIDE_BAND | [reference, reference] | 1 - abs(lastPrice - reference) / (0.5 * range), clamped |
 *
 * A price equal to a band edge is INSIDE_BAND. Pure function of its inputs.
 */
@Component
public class BiasSignalGenerator {

    public BiasRecord generate(Feed feed, CorrectedSnapshot snapshot, double lastPrice) {
        double reference = snapshot.getReference();
        double upper = snapshot.getUpper();
        double lower = snapshot.getLower();
        double range = Math.max(feed.getTickSize(), upper - lower);

        Bias bias;
        double secondary;
        double confidence;

        if (lastPrice > upper) {
            bias = Bias.BREAKOUT_UP;
            secondary = upper;
            confidence = Math.min(ProcessingConstants.MAX_CONFIDENCE, Math.abs(lastPrice - upper) / range);
        } else if (lastPrice < lower) {
            bias = Bias.BREAKOUT_DOWN;
            secondary = lower;
            confidence = Math.min(ProcessingConstants.MAX_CONFIDENCE, Math.abs(lastPrice - lower) / range);
        } else {
            bias = Bias.INSIDE_BAND;
            secondary = reference;
            confidence = 1.0 - Math.abs(lastPrice - reference) / (ProcessingConstants.INSIDE_BAND_HALF_RANGE * range);
        }

        return BiasRecord.builder()
            .feedId(feed.getId())
            .barIndex(snapshot.getBarIndex())
            .lastPrice(lastPrice)
            .bias(bias)
            .primaryTarget(reference)
            .secondaryTarget(secondary)
            .confidence(clamp(confidence))
            .build();
    }

    private static double clamp(double value) {
        return Math.max(ProcessingConstants.MIN_CONFIDENCE, Math.min(ProcessingConstants.MAX_CONFIDENCE, value));
    }
}
