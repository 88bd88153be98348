package com.kotsin.snapshot.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.snapshot.domain.record.EngineRecord;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes each record as one JSON line through the application log.
 */
@Slf4j
public class LoggingEmissionSink implements EmissionSink {

    private final ObjectMapper objectMapper;

    public LoggingEmissionSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void emit(EngineRecord record) {
        try {
            log.info("📤 {} {}", record.getKind(), objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + record.getKind() + " record for feed "
                + record.getFeedId(), e);
        }
    }
}
