package com.kotsin.snapshot.sink;

import com.kotsin.snapshot.domain.record.EngineRecord;

/**
 * Append-only receiver of engine records. Owns serialization and persistence.
 */
public interface EmissionSink {

    void emit(EngineRecord record);
}
