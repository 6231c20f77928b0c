package com.scaniq.collector.entity;

/**
 * Priority of an evidence gap. Declaration order is the sort order (HIGH first).
 */
public enum GapPriority {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Derives the priority of a category that holds {@code current} of {@code target} items.
     * A category with no positive target is never a gap worth chasing and rates LOW.
     */
    public static GapPriority of(int current, int target, int importance) {
        if (target <= 0) return LOW;
        double ratio = (double) current / target;
        if (ratio < 0.2 && importance >= 2) return HIGH;
        if (ratio < 0.5) return MEDIUM;
        return LOW;
    }
}
