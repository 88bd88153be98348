package com.kotsin.snapshot.domain.record;

/**
 * The three record kinds handed to the emission sink.
 */
public enum RecordKind {
    SNAPSHOT,
    DIAGNOSTIC,
    BIAS
}
