package com.kotsin.snapshot.domain.model;

/**
 * Scope - which aggregation period a snapshot describes.
 */
public enum Scope {
    /** The currently-forming period */
    CURRENT,
    /** The immediately preceding period */
    PREVIOUS
}
