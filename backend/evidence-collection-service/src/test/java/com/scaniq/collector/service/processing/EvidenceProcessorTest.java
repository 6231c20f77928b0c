package com.scaniq.collector.service.processing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.entity.OverallQuality;
import com.scaniq.collector.exception.AggregationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EvidenceProcessorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EvidenceProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new EvidenceProcessor(new EvidenceCollectionConfig(), objectMapper);
    }

    @Test
    @DisplayName("duplicate values keep the most confident item")
    void dedupeKeepsMostConfident() {
        // given
        EvidenceItem low = EvidenceItem.of("frontend-framework", "React", "https://acme.io/", 0.6);
        EvidenceItem high = EvidenceItem.of("frontend-framework", "React", "https://acme.io/app", 0.9);
        EvidenceItem other = EvidenceItem.of("frontend-framework", "Vue", "https://acme.io/", 0.7);

        // when
        List<EvidenceItem> unique = processor.dedupe(List.of(low, high, other));

        // then
        assertThat(unique).containsExactly(high, other);
    }

    @Test
    @DisplayName("ties keep the earliest item")
    void dedupeTieKeepsFirst() {
        EvidenceItem first = EvidenceItem.of("cms", "WordPress", "https://acme.io/a", 0.8);
        EvidenceItem second = EvidenceItem.of("cms", "WordPress", "https://acme.io/b", 0.8);

        assertThat(processor.dedupe(List.of(first, second))).containsExactly(first);
    }

    @Test
    @DisplayName("object values compare independent of field order")
    void dedupeIgnoresFieldOrder() {
        ObjectNode a = objectMapper.createObjectNode().put("name", "Jane").put("role", "CTO");
        ObjectNode b = objectMapper.createObjectNode().put("role", "CTO").put("name", "Jane");

        List<EvidenceItem> unique = processor.dedupe(List.of(
                EvidenceItem.of("team-member", a, "https://acme.io/team", 0.8),
                EvidenceItem.of("team-member", b, "https://acme.io/about", 0.8)));

        assertThat(unique).hasSize(1);
    }

    @Test
    @DisplayName("items with a null value are dropped")
    void malformedValuesDropped() {
        EvidenceItem broken = EvidenceItem.of("database", NullNode.getInstance(), "https://acme.io/", 0.8);
        EvidenceItem fine = EvidenceItem.of("database", "PostgreSQL", "https://acme.io/", 0.8);

        assertThat(processor.dedupe(List.of(broken, fine))).containsExactly(fine);
        assertThatThrownBy(() -> processor.contentKey(broken)).isInstanceOf(AggregationException.class);
    }

    @Test
    @DisplayName("high value categories are boosted and capped at 1.0")
    void boostAndCap() {
        // given
        EvidenceItem tech = EvidenceItem.of("frontend-framework", "React", "https://acme.io/", 0.6);
        EvidenceItem team = EvidenceItem.of("team-member", "Jane Doe", "https://acme.io/team", 0.9);
        EvidenceItem security = EvidenceItem.of("security-header", "hsts", "https://acme.io/", 0.95);

        // when
        List<EvidenceItem> processed = processor.process(List.of(tech, team, security));

        // then
        assertThat(processed).extracting(EvidenceItem::type)
                .containsExactly("team-member", "security-header", "frontend-framework");
        assertThat(processed.get(0).score()).isEqualTo(1.0);
        assertThat(processed.get(1).score()).isCloseTo(0.95, within(1e-9));
        assertThat(processed.get(2).score()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    @DisplayName("processing twice yields the same result")
    void idempotent() {
        List<EvidenceItem> raw = List.of(
                EvidenceItem.of("database", "MySQL", "https://acme.io/", 0.7),
                EvidenceItem.of("database", "MySQL", "https://acme.io/x", 0.5),
                EvidenceItem.of("revenue", "$10M ARR", "https://acme.io/", 0.6));

        List<EvidenceItem> once = processor.process(raw);
        List<EvidenceItem> twice = processor.process(once);

        assertThat(twice).extracting(EvidenceItem::id).containsExactlyElementsOf(
                once.stream().map(EvidenceItem::id).toList());
    }

    @Test
    @DisplayName("quality follows total and high scoring counts")
    void rateQuality() {
        List<EvidenceItem> strong = new ArrayList<>();
        for (int i = 0; i < 210; i++) {
            strong.add(EvidenceItem.of("page-content", "page " + i, "https://acme.io/" + i, 0.9).withScore(0.9));
        }
        List<EvidenceItem> weak = strong.subList(0, 60).stream().map(item -> item.withScore(0.5)).toList();

        assertThat(processor.rateQuality(strong)).isEqualTo(OverallQuality.EXCELLENT);
        assertThat(processor.rateQuality(weak)).isEqualTo(OverallQuality.MEDIUM);
        assertThat(processor.rateQuality(List.of())).isEqualTo(OverallQuality.LOW);
    }
}
