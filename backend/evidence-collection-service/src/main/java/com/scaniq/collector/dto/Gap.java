package com.scaniq.collector.dto;

import com.scaniq.collector.entity.GapPriority;

/**
 * A category whose evidence count falls short of its target.
 */
public record Gap(
        String category,
        int current,
        int target,
        int deficit,
        GapPriority priority
) {
    public static Gap of(String category, int current, int target, int importance) {
        return new Gap(category, current, target, target - current, GapPriority.of(current, target, importance));
    }

    public static Gap required(String category, int current, int target) {
        return new Gap(category, current, target, target - current, GapPriority.HIGH);
    }
}
