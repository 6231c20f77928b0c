package com.scaniq.collector.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.scaniq.collector.entity.EvidenceCategory;

import java.util.Objects;
import java.util.UUID;

/**
 * A single typed, sourced, confidence-scored fact.
 *
 * Items are created without a score; {@code score} is only set by the evidence processor
 * through {@link #withScore(double)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvidenceItem(
        String id,
        String type,
        JsonNode value,
        String sourceUrl,
        double confidence,
        Double score
) {
    public EvidenceItem {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }

    public static EvidenceItem of(String type, JsonNode value, String sourceUrl, double confidence) {
        return new EvidenceItem(UUID.randomUUID().toString(), type, value, sourceUrl, confidence, null);
    }

    public static EvidenceItem of(String type, String value, String sourceUrl, double confidence) {
        return of(type, TextNode.valueOf(value), sourceUrl, confidence);
    }

    public EvidenceItem withScore(double score) {
        return new EvidenceItem(id, type, value, sourceUrl, confidence, score);
    }

    /**
     * Category tag this item counts under for gap analysis.
     */
    @JsonIgnore
    public String category() {
        return EvidenceCategory.tagOf(type);
    }
}
