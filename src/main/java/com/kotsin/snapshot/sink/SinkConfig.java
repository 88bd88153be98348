package com.kotsin.snapshot.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.snapshot.config.ProcessingConstants;
import com.kotsin.snapshot.config.SnapshotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Selects the emission sink from snapshot.sink.type and applies change filtering.
 */
@Slf4j
@Configuration
public class SinkConfig {

    @Bean
    public EmissionSink emissionSink(SnapshotProperties properties,
                                     ObjectMapper objectMapper,
                                     ObjectProvider<KafkaTemplate<String, Object>> kafkaTemplate) {
        SnapshotProperties.Sink config = properties.getSink();

        EmissionSink sink;
        if (ProcessingConstants.SINK_TYPE_KAFKA.equalsIgnoreCase(config.getType())) {
            sink = new KafkaEmissionSink(kafkaTemplate.getObject(), config);
            log.info("📤 Emission sink: Kafka (snapshots={}, diagnostics={}, bias={})",
                config.getSnapshotTopic(), config.getDiagnosticTopic(), config.getBiasTopic());
        } else {
            sink = new LoggingEmissionSink(objectMapper);
            log.info("📤 Emission sink: log");
        }

        return config.isDropUnchanged() ? new ChangeFilteringSink(sink) : sink;
    }
}
