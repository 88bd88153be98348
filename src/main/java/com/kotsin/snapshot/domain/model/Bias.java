package com.kotsin.snapshot.domain.model;

/**
 * Position of the latest trade price relative to the band.
 */
public enum Bias {
    INSIDE_BAND,
    BREAKOUT_UP,
    BREAKOUT_DOWN;

    public boolean isBreakout() {
        return this != INSIDE_BAND;
    }
}
