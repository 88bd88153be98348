package com.kotsin.snapshot.source;

import com.kotsin.snapshot.config.SnapshotProperties;
import com.kotsin.snapshot.domain.model.Feed;
import com.kotsin.snapshot.domain.model.RawTriplet;
import com.kotsin.snapshot.domain.model.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded store of host-provided indicator triplets and last trade prices.
 *
 * Design Pattern: Adapter (fed by the host bridge, read by the engine)
 * Purpose: keep the most recent maxBarsPerFeed bars per feed so the engine can read
 *          any bar inside the reported bounds.
 * Thread-Safety: per-feed monitor; feeds do not contend.
 */
@Slf4j
@Component
public class InMemoryBarStore implements SnapshotSource, TradePriceSource {

    private final int maxBarsPerFeed;
    private final Map<String, FeedBars> feeds = new ConcurrentHashMap<>();

    @Autowired
    public InMemoryBarStore(SnapshotProperties properties) {
        this(properties.getStore().getMaxBarsPerFeed());
    }

    public InMemoryBarStore(int maxBarsPerFeed) {
        if (maxBarsPerFeed < 1) {
            throw new IllegalArgumentException("maxBarsPerFeed must be positive, got: " + maxBarsPerFeed);
        }
        this.maxBarsPerFeed = maxBarsPerFeed;
    }

    // ========== WRITE SIDE (host bridge) ==========

    public void putTriplet(String feedId, Scope scope, int barIndex, RawTriplet triplet) {
        if (feedId == null || scope == null || triplet == null || barIndex < 0) {
            log.debug("Ignoring incomplete bar for feed {} scope {} index {}", feedId, scope, barIndex);
            return;
        }
        FeedBars bars = feeds.computeIfAbsent(feedId, k -> new FeedBars());
        synchronized (bars) {
            bars.byIndex.computeIfAbsent(barIndex, k -> new EnumMap<>(Scope.class)).put(scope, triplet);
            while (bars.byIndex.size() > maxBarsPerFeed) {
                bars.byIndex.pollFirstEntry();
            }
        }
    }

    public void updateLastPrice(String feedId, double price) {
        if (feedId == null || !Double.isFinite(price)) {
            return;
        }
        FeedBars bars = feeds.computeIfAbsent(feedId, k -> new FeedBars());
        synchronized (bars) {
            bars.lastPrice = price;
        }
    }

    public void clear(String feedId) {
        feeds.remove(feedId);
    }

    // ========== READ SIDE (engine) ==========

    @Override
    public BarBounds bounds(Feed feed) {
        FeedBars bars = feeds.get(feed.getId());
        if (bars == null) {
            return BarBounds.empty();
        }
        synchronized (bars) {
            if (bars.byIndex.isEmpty()) {
                return BarBounds.empty();
            }
            return BarBounds.of(bars.byIndex.firstKey(), bars.byIndex.lastKey());
        }
    }

    @Override
    public Optional<RawTriplet> readTriplet(Feed feed, Scope scope, int barIndex) {
        FeedBars bars = feeds.get(feed.getId());
        if (bars == null) {
            return Optional.empty();
        }
        synchronized (bars) {
            Map<Scope, RawTriplet> byScope = bars.byIndex.get(barIndex);
            return byScope == null ? Optional.empty() : Optional.ofNullable(byScope.get(scope));
        }
    }

    @Override
    public OptionalDouble lastPrice(Feed feed) {
        FeedBars bars = feeds.get(feed.getId());
        if (bars == null) {
            return OptionalDouble.empty();
        }
        synchronized (bars) {
            return bars.lastPrice == null ? OptionalDouble.empty() : OptionalDouble.of(bars.lastPrice);
        }
    }

    public int size(String feedId) {
        FeedBars bars = feeds.get(feedId);
        if (bars == null) {
            return 0;
        }
        synchronized (bars) {
            return bars.byIndex.size();
        }
    }

    private static final class FeedBars {
        private final TreeMap<Integer, Map<Scope, RawTriplet>> byIndex = new TreeMap<>();
        private Double lastPrice;
    }
}
