package com.scaniq.collector.entity;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * How far a collection run goes. Each depth maps to a profile in configuration.
 */
public enum CollectionDepth {
    SHALLOW,
    DEEP,
    COMPREHENSIVE;

    @JsonCreator
    public static CollectionDepth fromValue(String value) {
        if (value == null || value.isBlank()) {
            return COMPREHENSIVE;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
