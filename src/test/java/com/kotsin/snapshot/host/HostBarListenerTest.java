package com.kotsin.snapshot.host;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.snapshot.audit.AuditLogger;
import com.kotsin.snapshot.config.CommonKafkaConfig;
import com.kotsin.snapshot.config.FeedRegistry;
import com.kotsin.snapshot.config.SnapshotProperties;
import com.kotsin.snapshot.domain.model.Feed;
import com.kotsin.snapshot.domain.model.Scope;
import com.kotsin.snapshot.domain.normalizer.PriceNormalizer;
import com.kotsin.snapshot.domain.signal.BiasSignalGenerator;
import com.kotsin.snapshot.domain.tracker.SnapshotStateTracker;
import com.kotsin.snapshot.domain.validator.TripletValidator;
import com.kotsin.snapshot.engine.CycleResult;
import com.kotsin.snapshot.engine.CycleStatus;
import com.kotsin.snapshot.engine.SnapshotEngine;
import com.kotsin.snapshot.monitoring.SnapshotQualityMetrics;
import com.kotsin.snapshot.sink.CollectingEmissionSink;
import com.kotsin.snapshot.source.InMemoryBarStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Host bridge: messages refresh the bar store, closed bars drive the engine.
 */
@DisplayName("HostBarListener")
class HostBarListenerTest {

    private static final Feed ES = Feed.of("ES-CH4", 0.25);

    private InMemoryBarStore store;
    private CollectingEmissionSink sink;
    private HostBarListener listener;

    @BeforeEach
    void setUp() {
        SnapshotProperties properties = new SnapshotProperties();
        SnapshotProperties.FeedDefinition definition = new SnapshotProperties.FeedDefinition();
        definition.setId("ES-CH4");
        definition.setSymbol("ESZ25");
        definition.setChartNumber(4);
        definition.setTickSize(0.25);
        properties.getFeeds().add(definition);

        store = new InMemoryBarStore(properties);
        sink = new CollectingEmissionSink();
        SnapshotEngine engine = new SnapshotEngine(store, store,
            new PriceNormalizer(properties),
            new TripletValidator(properties),
            new SnapshotStateTracker(),
            new BiasSignalGenerator(),
            sink,
            new SnapshotQualityMetrics(),
            new AuditLogger());
        ObjectMapper objectMapper = new CommonKafkaConfig().commonObjectMapper();

        listener = new HostBarListener(store, new FeedRegistry(properties), engine, objectMapper);
    }

    private static HostBarMessage.HostBarMessageBuilder message(int barIndex) {
        return HostBarMessage.builder()
            .feedId("ES-CH4")
            .barIndex(barIndex)
            .reference(6440.0)
            .upper(6454.0)
            .lower(6430.0)
            .lastPrice(6443.0);
    }

    @Test
    @DisplayName("Open bar updates the store without running a cycle")
    void testOpenBarStoredOnly() {
        Optional<CycleResult> result = listener.handle(message(10).build());

        assertTrue(result.isEmpty());
        assertEquals(1, store.size("ES-CH4"));
        assertTrue(store.readTriplet(ES, Scope.CURRENT, 10).isPresent());
        assertEquals(6443.0, store.lastPrice(ES).getAsDouble());
        assertTrue(sink.getRecords().isEmpty());
    }

    @Test
    @DisplayName("Closed bar runs one engine cycle")
    void testClosedBarRunsCycle() {
        Optional<CycleResult> result = listener.handle(message(10).barClosed(true).build());

        assertTrue(result.isPresent());
        assertEquals(CycleStatus.EMITTED, result.get().getStatus());
        assertEquals(10, result.get().getBarIndex());
        assertFalse(sink.getRecords().isEmpty());
    }

    @Test
    @DisplayName("Unknown feed id is dropped")
    void testUnknownFeed() {
        Optional<CycleResult> result = listener.handle(message(10).feedId("NQ-CH1").barClosed(true).build());

        assertTrue(result.isEmpty());
        assertEquals(0, store.size("NQ-CH1"));
    }

    @Test
    @DisplayName("Message without feed id is dropped")
    void testMissingFeedId() {
        assertTrue(listener.handle(message(10).feedId(null).build()).isEmpty());
        assertTrue(listener.handle(null).isEmpty());
    }

    @Test
    @DisplayName("Price-only message refreshes last price")
    void testPriceOnly() {
        listener.handle(HostBarMessage.builder().feedId("ES-CH4").lastPrice(6450.25).build());

        assertEquals(6450.25, store.lastPrice(ES).getAsDouble());
        assertEquals(0, store.size("ES-CH4"));
    }

    @Test
    @DisplayName("JSON payload is parsed, scope defaults to CURRENT")
    void testJsonPayload() {
        listener.onMessage("{\"feedId\":\"ES-CH4\",\"barIndex\":812,\"reference\":6440.0,"
            + "\"upper\":6454.0,\"lower\":6430.75,\"lastPrice\":6441.25,\"barClosed\":true,\"extra\":1}");

        assertTrue(store.readTriplet(ES, Scope.CURRENT, 812).isPresent());
        assertEquals(2, sink.getRecords().size());
    }

    @Test
    @DisplayName("Malformed payload is dropped without throwing")
    void testMalformedPayload() {
        assertDoesNotThrow(() -> listener.onMessage("{not json"));
        assertEquals(0, store.size("ES-CH4"));
    }
}
