package com.kotsin.snapshot.domain.record;

import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import com.kotsin.snapshot.domain.model.Scope;
import com.kotsin.snapshot.domain.model.ViolationKind;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A corrected snapshot as emitted for one feed, bar and scope.
 */
@Value
@Builder
public class SnapshotRecord implements EngineRecord {

    String feedId;
    int barIndex;
    Scope scope;
    double reference;
    double upper;
    double lower;
    boolean corrected;
    List<ViolationKind> violations;

    public static SnapshotRecord of(String feedId, Scope scope, CorrectedSnapshot snapshot) {
        return SnapshotRecord.builder()
            .feedId(feedId)
            .barIndex(snapshot.getBarIndex())
            .scope(scope)
            .reference(snapshot.getReference())
            .upper(snapshot.getUpper())
            .lower(snapshot.getLower())
            .corrected(snapshot.isCorrected())
            .violations(snapshot.getViolations())
            .build();
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.SNAPSHOT;
    }
}
