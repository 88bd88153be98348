package com.kotsin.snapshot.sink;

import com.kotsin.snapshot.config.KafkaTopics;
import com.kotsin.snapshot.config.SnapshotProperties;
import com.kotsin.snapshot.domain.model.Bias;
import com.kotsin.snapshot.domain.model.Scope;
import com.kotsin.snapshot.domain.record.BiasRecord;
import com.kotsin.snapshot.domain.record.DiagnosticReason;
import com.kotsin.snapshot.domain.record.DiagnosticRecord;
import com.kotsin.snapshot.domain.record.SnapshotRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("KafkaEmissionSink")
class KafkaEmissionSinkTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private SnapshotProperties.Sink config;
    private KafkaEmissionSink sink;

    @BeforeEach
    void setUp() {
        config = new SnapshotProperties.Sink();
        sink = new KafkaEmissionSink(kafkaTemplate, config);
    }

    @Test
    @DisplayName("Snapshot is published to the snapshot topic keyed by feed id")
    void testSnapshotPublished() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));
        SnapshotRecord record = SnapshotRecord.builder()
            .feedId("ES-CH4").barIndex(10).scope(Scope.CURRENT)
            .reference(6440.0).upper(6454.0).lower(6430.0).violations(List.of())
            .build();

        sink.emit(record);

        verify(kafkaTemplate).send(KafkaTopics.INDICATOR_SNAPSHOTS, "ES-CH4", record);
    }

    @Test
    @DisplayName("Each record kind has its own topic")
    void testTopicRouting() {
        config.setBiasTopic("custom-bias");

        assertEquals(KafkaTopics.INDICATOR_DIAGNOSTICS,
            sink.topicFor(DiagnosticRecord.of("ES-CH4", 1, DiagnosticReason.BOUNDS_EXHAUSTED, "none")));
        assertEquals("custom-bias", sink.topicFor(BiasRecord.builder()
            .feedId("ES-CH4").barIndex(1).bias(Bias.INSIDE_BAND).confidence(0.5).build()));
    }

    @Test
    @DisplayName("Failed send is logged, not thrown")
    void testFailedSendSwallowedByCallback() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertDoesNotThrow(() ->
            sink.emit(DiagnosticRecord.of("ES-CH4", 1, DiagnosticReason.SOURCE_UNAVAILABLE, "no data")));
    }
}
