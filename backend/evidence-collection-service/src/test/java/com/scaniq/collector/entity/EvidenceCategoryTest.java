package com.scaniq.collector.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceCategoryTest {

    @Test
    @DisplayName("evidence types roll up into their category")
    void tagOf() {
        assertThat(EvidenceCategory.tagOf("frontend-framework")).isEqualTo("tech-stack");
        assertThat(EvidenceCategory.tagOf("search-team")).isEqualTo("team-info");
        assertThat(EvidenceCategory.tagOf("security-tls")).isEqualTo("security");
        assertThat(EvidenceCategory.tagOf("tech-stack")).isEqualTo("tech-stack");
    }

    @Test
    @DisplayName("unclassified types count under themselves")
    void unknownTypes() {
        assertThat(EvidenceCategory.tagOf("legacy-tech")).isEqualTo("legacy-tech");
        assertThat(EvidenceCategory.classify("page-content")).isEmpty();
    }

    @Test
    @DisplayName("each category tag belongs to its own category only")
    void tagsAreExclusive() {
        for (EvidenceCategory category : EvidenceCategory.values()) {
            assertThat(Arrays.stream(EvidenceCategory.values()).filter(c -> c.contains(category.getTag())))
                    .containsExactly(category);
            assertThat(EvidenceCategory.fromTag(category.getTag())).contains(category);
        }
    }

    @Test
    @DisplayName("coverage tracks eight categories")
    void coverageSet() {
        assertThat(EvidenceCategory.COVERAGE_SET).hasSize(8)
                .doesNotContain(EvidenceCategory.INTEGRATION, EvidenceCategory.BUSINESS_MODEL);
    }
}
