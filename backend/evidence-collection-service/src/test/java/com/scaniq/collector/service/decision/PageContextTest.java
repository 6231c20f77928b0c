package com.scaniq.collector.service.decision;

import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.ToolResult;
import com.scaniq.collector.entity.CollectionTool;
import com.scaniq.collector.entity.ToolFailureReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageContextTest {

    @Test
    @DisplayName("advance appends the tool, merges characteristics and counts evidence")
    void advance() {
        PageContext initial = PageContext.initial("https://acme.io/");
        ToolResult result = ToolResult.success(CollectionTool.HTML_COLLECTOR,
                List.of(EvidenceItem.of("page-content", "Acme", "https://acme.io/", 1.0),
                        EvidenceItem.of("revenue", "$5M revenue", "https://acme.io/", 0.7)),
                Map.of(PageCharacteristics.HAS_JAVASCRIPT, true), 12);

        PageContext next = initial.advance(CollectionTool.HTML_COLLECTOR, result);

        assertThat(next.toolsRun()).containsExactly(CollectionTool.HTML_COLLECTOR);
        assertThat(next.loopCount()).isEqualTo(1);
        assertThat(next.evidenceCount()).isEqualTo(2);
        assertThat(next.flag(PageCharacteristics.HAS_JAVASCRIPT)).isTrue();
        assertThat(initial.toolsRun()).isEmpty();
    }

    @Test
    @DisplayName("failed tools are still recorded as run")
    void failedToolRecorded() {
        PageContext next = PageContext.initial("https://acme.io/")
                .advance(CollectionTool.SECURITY_SCAN,
                        ToolResult.failure(CollectionTool.SECURITY_SCAN, "refused", ToolFailureReason.CONNECTION_REFUSED, 3));

        assertThat(next.hasRun(CollectionTool.SECURITY_SCAN)).isTrue();
        assertThat(next.evidenceCount()).isZero();
    }

    @Test
    @DisplayName("negative counters are rejected")
    void rejectsNegativeCounters() {
        assertThatThrownBy(() -> new PageContext("https://acme.io/", List.of(), Map.of(), -1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
