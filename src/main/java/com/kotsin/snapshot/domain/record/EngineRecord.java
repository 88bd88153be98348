package com.kotsin.snapshot.domain.record;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.kotsin.snapshot.domain.model.Scope;

/**
 * Common contract of every structured value the engine emits.
 * The sink owns serialization and persistence.
 */
public interface EngineRecord {

    String getFeedId();

    int getBarIndex();

    RecordKind getKind();

    /**
     * Scope of the record, null for kinds that are not scoped.
     */
    default Scope getScope() {
        return null;
    }

    /**
     * Key identifying the logical stream a record belongs to: feed, kind and scope.
     */
    @JsonIgnore
    default String getStreamKey() {
        Scope scope = getScope();
        return getFeedId() + ":" + getKind() + (scope != null ? ":" + scope : "");
    }
}
