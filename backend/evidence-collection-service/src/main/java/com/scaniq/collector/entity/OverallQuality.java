package com.scaniq.collector.entity;

/**
 * Overall rating of a processed evidence set.
 */
public enum OverallQuality {
    EXCELLENT,
    HIGH,
    GOOD,
    MEDIUM,
    LOW;

    /**
     * @param total number of processed items
     * @param highScoring number of items scoring above 0.8
     */
    public static OverallQuality rate(int total, long highScoring) {
        if (total > 200 && highScoring > 100) return EXCELLENT;
        if (total > 150 && highScoring > 50) return HIGH;
        if (total > 100 && highScoring > 30) return GOOD;
        if (total > 50) return MEDIUM;
        return LOW;
    }
}
