package com.kotsin.snapshot.engine;

import com.kotsin.snapshot.domain.record.EngineRecord;
import com.kotsin.snapshot.domain.tracker.FeedPhase;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What one cycle did: its status, the (clamped) bar index and every record handed to the sink,
 * in emission order.
 */
@Value
public class CycleResult {

    String feedId;
    int barIndex;
    CycleStatus status;
    List<EngineRecord> records;
    FeedPhase phase;

    CycleResult(String feedId, int barIndex, CycleStatus status, List<EngineRecord> records, FeedPhase phase) {
        this.feedId = feedId;
        this.barIndex = barIndex;
        this.status = status;
        this.records = List.copyOf(records);
        this.phase = phase;
    }

    public <T extends EngineRecord> List<T> recordsOf(Class<T> type) {
        return records.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
