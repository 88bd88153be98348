package com.kotsin.snapshot.source;

import lombok.Value;

/**
 * Inclusive bar index range a source can currently serve for a feed.
 */
@Value(staticConstructor = "of")
public class BarBounds {

    private static final BarBounds EMPTY = new BarBounds(0, -1);

    int first;
    int last;

    public static BarBounds empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return last < first;
    }

    /**
     * Clamp a requested index into [first, last]. Only meaningful when not empty.
     */
    public int clamp(int barIndex) {
        return Math.max(first, Math.min(last, barIndex));
    }
}
