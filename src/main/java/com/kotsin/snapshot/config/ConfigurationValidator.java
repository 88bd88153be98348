package com.kotsin.snapshot.config;

import com.kotsin.snapshot.domain.model.Feed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fails fast on startup when the snapshot configuration cannot work.
 */
@Component
@Slf4j
public class ConfigurationValidator {

    private final SnapshotProperties properties;

    @Value("${spring.profiles.active:default}")
    private String activeProfile;

    @Value("${spring.kafka.bootstrap-servers:}")
    private String bootstrapServers;

    public ConfigurationValidator(SnapshotProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        if ("test".equals(activeProfile)) {
            log.info("⏭️ Skipping configuration validation in test mode");
            return;
        }

        log.info("🔍 Validating snapshot engine configuration...");

        List<String> errors = collectErrors();
        if (!errors.isEmpty()) {
            log.error("❌ Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed. Please fix the errors above.");
        }

        log.info("✅ Configuration validation passed");
        logConfigurationSummary();
    }

    List<String> collectErrors() {
        List<String> errors = new ArrayList<>();

        SnapshotProperties.Normalizer normalizer = properties.getNormalizer();
        if (!(normalizer.getRescaleThreshold() > 0)) {
            errors.add("snapshot.normalizer.rescale-threshold must be positive");
        }
        if (!(normalizer.getRescaleFactor() > 1.0)) {
            errors.add("snapshot.normalizer.rescale-factor must be greater than 1");
        }

        double fraction = properties.getValidator().getRepositionFraction();
        if (fraction < 0 || fraction > ProcessingConstants.MAX_REPOSITION_FRACTION) {
            errors.add("snapshot.validator.reposition-fraction must be within [0, "
                + ProcessingConstants.MAX_REPOSITION_FRACTION + "], got " + fraction);
        }

        if (properties.getStore().getMaxBarsPerFeed() < 2) {
            errors.add("snapshot.store.max-bars-per-feed must be at least 2");
        }

        String sinkType = properties.getSink().getType();
        boolean kafkaSink = ProcessingConstants.SINK_TYPE_KAFKA.equalsIgnoreCase(sinkType);
        if (!kafkaSink && !ProcessingConstants.SINK_TYPE_LOG.equalsIgnoreCase(sinkType)) {
            errors.add("snapshot.sink.type must be 'log' or 'kafka', got " + sinkType);
        }
        if ((kafkaSink || properties.getHost().getListener().isEnabled()) && isNullOrEmpty(bootstrapServers)) {
            errors.add("spring.kafka.bootstrap-servers is required by the Kafka sink or host listener");
        }

        if (properties.getFeeds().isEmpty()) {
            errors.add("snapshot.feeds is empty: at least one feed must be configured");
        }
        Set<String> ids = new HashSet<>();
        for (SnapshotProperties.FeedDefinition definition : properties.getFeeds()) {
            try {
                Feed feed = definition.toFeed();
                if (!ids.add(feed.getId())) {
                    errors.add("Duplicate feed id: " + feed.getId());
                }
            } catch (IllegalArgumentException e) {
                errors.add("Invalid feed definition: " + e.getMessage());
            }
        }
        return errors;
    }

    private void logConfigurationSummary() {
        log.info("📋 Configuration Summary:");
        log.info("  Feeds: {}", properties.getFeeds().size());
        log.info("  Rescale: enabled={} threshold={} factor={}",
            properties.getNormalizer().isRescaleEnabled(),
            properties.getNormalizer().getRescaleThreshold(),
            properties.getNormalizer().getRescaleFactor());
        log.info("  Reposition fraction: {}", properties.getValidator().getRepositionFraction());
        log.info("  Sink: type={} dropUnchanged={}",
            properties.getSink().getType(), properties.getSink().isDropUnchanged());
        log.info("  Host listener: enabled={} topic={}",
            properties.getHost().getListener().isEnabled(), properties.getHost().getTopic());
    }

    private boolean isNullOrEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }
}
