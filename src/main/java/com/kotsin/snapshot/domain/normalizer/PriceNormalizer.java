package com.kotsin.snapshot.domain.normalizer;

import com.kotsin.snapshot.config.SnapshotProperties;
import com.kotsin.snapshot.domain.model.Feed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Price Normalizer
 * Maps raw host prices onto the feed's tick grid.
 *
 * Steps, in order:
 * 1. reject NaN / infinite
 * 2. divide by the feed's real-time price multiplier
 * 3. if enabled and above the (feed or global) threshold, divide by the rescale factor once
 * 4. round half-up to the nearest tick multiple
 * 5. reject anything <= 0
 *
 * Step 3 targets a known host mis-scaling bug and also hits legitimately large prices.
 * Threshold is per feed (falling back to the global one); callers get a rescaled flag.
 */
@Slf4j
@Component
public class PriceNormalizer {

    private final SnapshotProperties.Normalizer config;

    public PriceNormalizer(SnapshotProperties properties) {
        this.config = properties.getNormalizer();
    }

    public NormalizedPrice normalize(double raw, Feed feed) {
        if (!Double.isFinite(raw)) {
            return NormalizedPrice.rejected(Double.NaN);
        }

        double px = raw / feed.getPriceMultiplier();
        double unscaled = px;

        boolean rescaled = false;
        double threshold = effectiveThreshold(feed);
        if (config.isRescaleEnabled() && px > threshold) {
            px /= config.getRescaleFactor();
            rescaled = true;
            log.debug("Rescaled price for feed {}: {} -> {} (threshold={})", feed.getId(), unscaled, px, threshold);
        }

        px = roundToTick(px, feed.getTickSize());

        if (px <= 0) {
            return NormalizedPrice.rejected(unscaled);
        }
        return NormalizedPrice.accepted(px, rescaled, unscaled);
    }

    public double effectiveThreshold(Feed feed) {
        return feed.getRescaleThreshold() != null ? feed.getRescaleThreshold() : config.getRescaleThreshold();
    }

    /**
     * Round to the nearest multiple of tickSize, snapped to the tick's decimal scale
     * so that e.g. 6430.75 stays 6430.75 and not 6430.750000000001.
     */
    static double roundToTick(double price, double tickSize) {
        double ticks = Math.round(price / tickSize);
        BigDecimal tick = BigDecimal.valueOf(tickSize);
        int scale = Math.max(tick.stripTrailingZeros().scale(), 0);
        return BigDecimal.valueOf(ticks).multiply(tick).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
