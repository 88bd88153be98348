package com.kotsin.snapshot.domain.record;

import lombok.Value;

/**
 * Diagnostic for unavailable/invalid input and for heuristic interventions.
 * Downstream consumers may alert on repeated reasons for a feed.
 */
@Value(staticConstructor = "of")
public class DiagnosticRecord implements EngineRecord {

    String feedId;
    int barIndex;
    DiagnosticReason reason;
    String detail;

    @Override
    public RecordKind getKind() {
        return RecordKind.DIAGNOSTIC;
    }
}
