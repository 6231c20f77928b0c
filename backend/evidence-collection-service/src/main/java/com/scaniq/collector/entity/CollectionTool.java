package com.scaniq.collector.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named collection capabilities the decision engine can choose for a page.
 */
public enum CollectionTool {
    HTML_COLLECTOR("html-collector", "Basic HTML fetch"),
    RENDERED_FETCH("rendered-fetch", "Headless rendered DOM fetch"),
    TECH_ANALYZER("tech-analyzer", "Technology signature scan"),
    SECURITY_SCAN("security-scanner", "Security header and TLS scan"),
    API_EXTRACTOR("api-extractor", "API documentation extraction");

    private final String code;
    private final String description;

    CollectionTool(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<CollectionTool> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(tool -> tool.code.equalsIgnoreCase(code) || tool.name().equalsIgnoreCase(code))
                .findFirst();
    }

    @Override
    public String toString() {
        return code;
    }
}
