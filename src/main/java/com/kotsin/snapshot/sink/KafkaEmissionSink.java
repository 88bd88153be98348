package com.kotsin.snapshot.sink;

import com.kotsin.snapshot.config.SnapshotProperties;
import com.kotsin.snapshot.domain.record.EngineRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Publishes records as JSON, one topic per record kind, keyed by feed id
 * so that a feed's records stay ordered within a partition.
 */
@Slf4j
public class KafkaEmissionSink implements EmissionSink {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final SnapshotProperties.Sink config;

    public KafkaEmissionSink(KafkaTemplate<String, Object> kafkaTemplate, SnapshotProperties.Sink config) {
        this.kafkaTemplate = kafkaTemplate;
        this.config = config;
    }

    @Override
    public void emit(EngineRecord record) {
        String topic = topicFor(record);
        kafkaTemplate.send(topic, record.getFeedId(), record)
            .whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("❌ Failed to publish {} for feed {} bar {} to {}: {}",
                        record.getKind(), record.getFeedId(), record.getBarIndex(), topic, ex.getMessage());
                } else {
                    log.debug("Published {} for feed {} bar {} to {}",
                        record.getKind(), record.getFeedId(), record.getBarIndex(), topic);
                }
            });
    }

    String topicFor(EngineRecord record) {
        switch (record.getKind()) {
            case SNAPSHOT:
                return config.getSnapshotTopic();
            case DIAGNOSTIC:
                return config.getDiagnosticTopic();
            case BIAS:
                return config.getBiasTopic();
            default:
                throw new IllegalArgumentException("Unknown record kind: " + record.getKind());
        }
    }
}
