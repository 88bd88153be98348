package com.kotsin.snapshot.host;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.snapshot.config.FeedRegistry;
import com.kotsin.snapshot.config.KafkaTopics;
import com.kotsin.snapshot.domain.model.Feed;
import com.kotsin.snapshot.engine.CycleResult;
import com.kotsin.snapshot.engine.SnapshotEngine;
import com.kotsin.snapshot.source.InMemoryBarStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * HostBarListener - bridge from the charting host to the engine
 *
 * Input: host-indicator-bars (JSON {@link HostBarMessage}, keyed by feed id)
 *
 * Every message refreshes the bar store; a message flagged barClosed then
 * triggers one engine cycle for that feed and bar.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HostBarListener {

    private final InMemoryBarStore barStore;
    private final FeedRegistry feedRegistry;
    private final SnapshotEngine engine;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${snapshot.host.topic:" + KafkaTopics.HOST_INDICATOR_BARS + "}",
        groupId = "${kafka.consumer.group-id:indicator-snapshot-engine}",
        containerFactory = "hostBarListenerContainerFactory",
        autoStartup = "${snapshot.host.listener.enabled:false}"
    )
    public void onMessage(String payload) {
        HostBarMessage message;
        try {
            message = objectMapper.readValue(payload, HostBarMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Dropping malformed host message: {}", e.getOriginalMessage());
            return;
        }
        handle(message);
    }

    public Optional<CycleResult> handle(HostBarMessage message) {
        if (message == null || message.getFeedId() == null) {
            log.warn("⚠️ Dropping host message without feed id");
            return Optional.empty();
        }

        Optional<Feed> feed = feedRegistry.find(message.getFeedId());
        if (feed.isEmpty()) {
            log.warn("⚠️ Unknown feed id from host: {}", message.getFeedId());
            return Optional.empty();
        }

        if (message.hasTriplet()) {
            barStore.putTriplet(message.getFeedId(), message.scopeOrDefault(), message.getBarIndex(), message.toTriplet());
        }
        if (message.getLastPrice() != null) {
            barStore.updateLastPrice(message.getFeedId(), message.getLastPrice());
        }

        if (!message.isBarClosed() || message.getBarIndex() == null) {
            return Optional.empty();
        }

        CycleResult result = engine.onBarClose(feed.get(), message.getBarIndex());
        log.debug("Cycle {} for feed {} bar {}: {} record(s)",
            result.getStatus(), result.getFeedId(), result.getBarIndex(), result.getRecords().size());
        return Optional.of(result);
    }
}
