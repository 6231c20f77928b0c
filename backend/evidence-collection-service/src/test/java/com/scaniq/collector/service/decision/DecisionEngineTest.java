package com.scaniq.collector.service.decision;

import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.dto.Decision;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.ToolResult;
import com.scaniq.collector.entity.CollectionTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionEngineTest {

    private DecisionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DecisionEngine(new EvidenceCollectionConfig());
    }

    private static PageContext contextWith(String url, List<CollectionTool> tools, Map<String, Object> characteristics,
                                           int loops, int evidence) {
        return new PageContext(url, tools, characteristics, loops, evidence);
    }

    @Nested
    @DisplayName("decide")
    class Decide {

        @Test
        @DisplayName("fresh page gets the basic HTML collector")
        void freshPageStartsWithHtml() {
            Decision decision = engine.decide(PageContext.initial("https://acme.io/pricing"), List.of());

            assertThat(decision.tool()).isEqualTo(CollectionTool.HTML_COLLECTOR);
            assertThat(decision.priority()).isEqualTo(10);
            assertThat(decision.expectedEvidence()).isEqualTo(10);
        }

        @Test
        @DisplayName("JavaScript characteristic selects rendered fetch first")
        void javascriptPageGetsRenderedFetch() {
            PageContext context = contextWith("https://acme.io/", List.of(CollectionTool.HTML_COLLECTOR),
                    Map.of(PageCharacteristics.HAS_JAVASCRIPT, true), 1, 1);

            Decision decision = engine.decide(context, List.of());

            assertThat(decision.tool()).isEqualTo(CollectionTool.RENDERED_FETCH);
            assertThat(decision.priority()).isEqualTo(9);
            assertThat(decision.expectedEvidence()).isEqualTo(20);
        }

        @ParameterizedTest
        @ValueSource(strings = {"https://app.acme.io/", "https://dashboard.acme.io/home", "https://acme.io/console/login"})
        @DisplayName("application URLs need rendering")
        void applicationUrlsNeedRendering(String url) {
            assertThat(engine.decide(PageContext.initial(url), List.of()).tool())
                    .isEqualTo(CollectionTool.RENDERED_FETCH);
        }

        @Test
        @DisplayName("API docs path without API evidence selects the API extractor")
        void apiDocsWithoutApiEvidence() {
            Decision decision = engine.decide(PageContext.initial("https://acme.io/docs/reference"), List.of());

            assertThat(decision.tool()).isEqualTo(CollectionTool.API_EXTRACTOR);
            assertThat(decision.priority()).isEqualTo(8);
            assertThat(decision.expectedEvidence()).isEqualTo(30);
        }

        @Test
        @DisplayName("API docs path with API evidence falls through to HTML")
        void apiDocsWithApiEvidence() {
            List<EvidenceItem> evidence = List.of(
                    EvidenceItem.of("api-endpoints", "/api/v1/users", "https://acme.io/docs", 0.6));

            Decision decision = engine.decide(PageContext.initial("https://acme.io/docs"), evidence);

            assertThat(decision.tool()).isEqualTo(CollectionTool.HTML_COLLECTOR);
        }

        @Test
        @DisplayName("observed security headers select the security scan")
        void securityHeadersSelectScan() {
            PageContext context = contextWith("https://acme.io/", List.of(CollectionTool.HTML_COLLECTOR),
                    Map.of(PageCharacteristics.HAS_SECURITY_HEADERS, true), 1, 1);

            Decision decision = engine.decide(context, List.of());

            assertThat(decision.tool()).isEqualTo(CollectionTool.SECURITY_SCAN);
            assertThat(decision.priority()).isEqualTo(7);
            assertThat(decision.expectedEvidence()).isEqualTo(15);
        }

        @Test
        @DisplayName("technology pages select the tech analyzer")
        void techPageSelectsAnalyzer() {
            Decision decision = engine.decide(PageContext.initial("https://acme.io/engineering/blog"), List.of());

            assertThat(decision.tool()).isEqualTo(CollectionTool.TECH_ANALYZER);
            assertThat(decision.expectedEvidence()).isEqualTo(25);
        }

        @Test
        @DisplayName("no applicable tool yields a terminal decision")
        void exhaustedPageStops() {
            PageContext context = contextWith("https://acme.io/", List.of(CollectionTool.HTML_COLLECTOR), Map.of(), 1, 1);

            Decision decision = engine.decide(context, List.of());

            assertThat(decision.isTerminal()).isTrue();
            assertThat(engine.shouldContinue(context, decision)).isFalse();
        }

        @Test
        @DisplayName("a page never gets the same tool twice")
        void toolsNeverRepeat() {
            // given
            PageContext context = PageContext.initial("https://app.acme.io/docs/engineering");
            context = new PageContext(context.url(), context.toolsRun(),
                    Map.of(PageCharacteristics.HAS_JAVASCRIPT, true, PageCharacteristics.HAS_SECURITY_HEADERS, true), 0, 0);
            List<CollectionTool> chosen = new ArrayList<>();

            // when
            Decision decision = engine.decide(context, List.of());
            while (engine.shouldContinue(context, decision)) {
                chosen.add(decision.tool());
                context = context.advance(decision.tool(),
                        ToolResult.failure(decision.tool(), "boom", null, 1));
                decision = engine.decide(context, List.of());
            }

            // then
            assertThat(chosen).doesNotHaveDuplicates();
            assertThat(chosen).containsExactly(
                    CollectionTool.RENDERED_FETCH,
                    CollectionTool.API_EXTRACTOR,
                    CollectionTool.SECURITY_SCAN,
                    CollectionTool.TECH_ANALYZER,
                    CollectionTool.HTML_COLLECTOR);
            assertThat(context.toolsRun()).containsExactlyElementsOf(chosen);
        }
    }

    @Nested
    @DisplayName("shouldContinue")
    class ShouldContinue {

        private final Decision html = Decision.run(CollectionTool.HTML_COLLECTOR, "basic", 10, 10);

        @Test
        @DisplayName("stops at the loop limit regardless of expected evidence")
        void stopsAtMaxLoops() {
            PageContext context = contextWith("https://acme.io/", List.of(), Map.of(), 10, 0);

            assertThat(engine.shouldContinue(context, Decision.run(CollectionTool.API_EXTRACTOR, "r", 8, 30))).isFalse();
        }

        @Test
        @DisplayName("continues below the loop limit")
        void continuesBelowLimit() {
            PageContext context = contextWith("https://acme.io/", List.of(), Map.of(), 9, 0);

            assertThat(engine.shouldContinue(context, html)).isTrue();
        }

        @Test
        @DisplayName("stops once the page evidence ceiling is passed")
        void stopsAboveEvidenceCeiling() {
            assertThat(engine.shouldContinue(contextWith("https://acme.io/", List.of(), Map.of(), 1, 50), html)).isTrue();
            assertThat(engine.shouldContinue(contextWith("https://acme.io/", List.of(), Map.of(), 1, 51), html)).isFalse();
        }

        @Test
        @DisplayName("skips low value decisions after diminishing returns")
        void skipsLowValueDecisions() {
            Decision lowValue = Decision.run(CollectionTool.HTML_COLLECTOR, "low", 1, 4);

            assertThat(engine.shouldContinue(contextWith("https://acme.io/", List.of(), Map.of(), 1, 21), lowValue)).isFalse();
            assertThat(engine.shouldContinue(contextWith("https://acme.io/", List.of(), Map.of(), 1, 20), lowValue)).isTrue();
        }

        @Test
        @DisplayName("honours configured thresholds")
        void usesConfiguredThresholds() {
            EvidenceCollectionConfig config = new EvidenceCollectionConfig();
            config.getDecision().setMaxLoops(2);
            DecisionEngine strict = new DecisionEngine(config);

            assertThat(strict.shouldContinue(contextWith("https://acme.io/", List.of(), Map.of(), 2, 0), html)).isFalse();
        }
    }
}
