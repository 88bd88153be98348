package com.kotsin.snapshot.sink;

import com.kotsin.snapshot.domain.record.EngineRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decorator that drops a record identical to the last one forwarded on the same
 * stream (feed + kind + scope). Typical hit: the same diagnostic repeated while
 * the host keeps calling for a bar whose data is missing.
 */
@Slf4j
public class ChangeFilteringSink implements EmissionSink {

    private final EmissionSink delegate;
    private final Map<String, EngineRecord> lastByStream = new ConcurrentHashMap<>();

    public ChangeFilteringSink(EmissionSink delegate) {
        this.delegate = delegate;
    }

    @Override
    public void emit(EngineRecord record) {
        String key = record.getStreamKey();
        EngineRecord last = lastByStream.get(key);
        if (record.equals(last)) {
            log.debug("Dropping unchanged {} on {}", record.getKind(), key);
            return;
        }
        delegate.emit(record);
        lastByStream.put(key, record);
    }

    public EmissionSink getDelegate() {
        return delegate;
    }
}
