package com.kotsin.snapshot.config;

import com.kotsin.snapshot.domain.model.Feed;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * SnapshotProperties - all tunables of the snapshot engine.
 *
 * Bound from application.yml:
 * snapshot.normalizer.rescale-threshold=10000
 * snapshot.validator.reposition-fraction=0.1
 * snapshot.feeds[0].id=ES-CH4
 * etc.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "snapshot")
public class SnapshotProperties {

    private Normalizer normalizer = new Normalizer();

    private Validator validator = new Validator();

    private Store store = new Store();

    private Sink sink = new Sink();

    private Host host = new Host();

    /**
     * Instrument feeds, created at startup and immutable afterwards.
     */
    private List<FeedDefinition> feeds = new ArrayList<>();

    @Data
    public static class Normalizer {
        /**
         * Whether mis-scaled prices are divided by rescaleFactor.
         * Default: true
         */
        private boolean rescaleEnabled = true;

        /**
         * Global implausibility threshold. Feeds may override it.
         * Default: 10000
         */
        private double rescaleThreshold = ProcessingConstants.DEFAULT_RESCALE_THRESHOLD;

        /**
         * Divisor applied once above the threshold.
         * Default: 100
         */
        private double rescaleFactor = ProcessingConstants.DEFAULT_RESCALE_FACTOR;
    }

    @Data
    public static class Validator {
        /**
         * Inward repositioning of a stray reference, as a fraction of band width.
         * Default: 10% (0.1)
         */
        private double repositionFraction = ProcessingConstants.DEFAULT_REPOSITION_FRACTION;
    }

    @Data
    public static class Store {
        private int maxBarsPerFeed = ProcessingConstants.DEFAULT_MAX_BARS_PER_FEED;
    }

    @Data
    public static class Sink {
        /**
         * log | kafka
         */
        private String type = ProcessingConstants.SINK_TYPE_LOG;

        /**
         * Drop a record equal to the last one forwarded for the same feed/kind/scope.
         */
        private boolean dropUnchanged = true;

        private String snapshotTopic = KafkaTopics.INDICATOR_SNAPSHOTS;
        private String diagnosticTopic = KafkaTopics.INDICATOR_DIAGNOSTICS;
        private String biasTopic = KafkaTopics.INDICATOR_BIAS;
    }

    @Data
    public static class Host {
        private Listener listener = new Listener();
        private String topic = KafkaTopics.HOST_INDICATOR_BARS;

        @Data
        public static class Listener {
            private boolean enabled = false;
        }
    }

    @Data
    public static class FeedDefinition {
        private String id;
        private String symbol;
        private int chartNumber;
        private double tickSize;
        private double priceMultiplier = ProcessingConstants.DEFAULT_PRICE_MULTIPLIER;
        private Double rescaleThreshold;

        public Feed toFeed() {
            return Feed.builder()
                .id(id)
                .symbol(symbol)
                .chartNumber(chartNumber)
                .tickSize(tickSize)
                .priceMultiplier(priceMultiplier)
                .rescaleThreshold(rescaleThreshold)
                .build();
        }
    }
}
