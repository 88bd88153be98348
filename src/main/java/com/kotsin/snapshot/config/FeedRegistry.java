package com.kotsin.snapshot.config;

import com.kotsin.snapshot.domain.model.Feed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves configured feeds by id. Built once at startup, read-only afterwards.
 */
@Slf4j
@Component
public class FeedRegistry {

    private final Map<String, Feed> feeds;

    public FeedRegistry(SnapshotProperties properties) {
        Map<String, Feed> byId = new LinkedHashMap<>();
        for (SnapshotProperties.FeedDefinition definition : properties.getFeeds()) {
            Feed feed = definition.toFeed();
            if (byId.putIfAbsent(feed.getId(), feed) != null) {
                throw new IllegalStateException("Duplicate feed id in configuration: " + feed.getId());
            }
            log.info("📡 Feed registered: id={} symbol={} chart={} tick={} multiplier={}",
                feed.getId(), feed.getSymbol(), feed.getChartNumber(),
                feed.getTickSize(), feed.getPriceMultiplier());
        }
        this.feeds = Collections.unmodifiableMap(byId);
    }

    public Optional<Feed> find(String feedId) {
        return feedId == null ? Optional.empty() : Optional.ofNullable(feeds.get(feedId));
    }

    public Collection<Feed> all() {
        return feeds.values();
    }

    public int size() {
        return feeds.size();
    }
}
