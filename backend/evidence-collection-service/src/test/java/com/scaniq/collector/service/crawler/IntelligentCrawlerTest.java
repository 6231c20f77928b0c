package com.scaniq.collector.service.crawler;

import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.config.EvidenceCollectionConfig.DepthProfile;
import com.scaniq.collector.dto.AuditEntry;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.entity.CollectionTool;
import com.scaniq.collector.service.CollectionContext;
import com.scaniq.collector.service.audit.AuditTrail;
import com.scaniq.collector.service.decision.DecisionEngine;
import com.scaniq.collector.service.decision.PageCharacteristics;
import com.scaniq.collector.service.decision.PageContext;
import com.scaniq.collector.service.tool.CapabilityOutput;
import com.scaniq.collector.service.tool.CollectionCapability;
import com.scaniq.collector.service.tool.ToolExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class IntelligentCrawlerTest {

    private EvidenceCollectionConfig config;
    private CollectionContext context;
    private final AtomicInteger securityCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        config = new EvidenceCollectionConfig();
        context = CollectionContext.create("run-1", "acme.io", "Acme", null, new DepthProfile(300, 5, true));
    }

    private IntelligentCrawler crawler() {
        CollectionCapability html = new CollectionCapability() {
            @Override
            public CollectionTool tool() {
                return CollectionTool.HTML_COLLECTOR;
            }

            @Override
            public Mono<CapabilityOutput> execute(String url, PageContext ctx) {
                return Mono.just(new CapabilityOutput(
                        List.of(EvidenceItem.of("page-content", "Acme " + url, url, 1.0),
                                EvidenceItem.of("customer-count", "500+ customers", url, 0.7)),
                        Map.of(PageCharacteristics.HAS_SECURITY_HEADERS, true)));
            }
        };
        CollectionCapability security = new CollectionCapability() {
            @Override
            public CollectionTool tool() {
                return CollectionTool.SECURITY_SCAN;
            }

            @Override
            public Mono<CapabilityOutput> execute(String url, PageContext ctx) {
                securityCalls.incrementAndGet();
                return Mono.error(new IllegalStateException("tls probe failed"));
            }
        };
        ToolExecutor executor = new ToolExecutor(List.of(html, security), config, new SimpleMeterRegistry());
        return new IntelligentCrawler(new DecisionEngine(config), executor, config);
    }

    @Test
    @DisplayName("runs tools in decision order and never retries a failed tool")
    void processUrl() {
        StepVerifier.create(crawler().processUrl("https://acme.io/", context))
                .assertNext(evidence -> assertThat(evidence).hasSize(2))
                .verifyComplete();

        assertThat(securityCalls).hasValue(1);
        assertThat(context.getEvidenceStore().forSource("https://acme.io/")).hasSize(2);
        assertThat(context.getUrlsProcessed()).hasValue(1);

        List<AuditEntry> entries = context.getAuditTrail().getEntries();
        assertThat(entries).extracting(AuditEntry::action)
                .containsExactly(AuditTrail.ACTION_DECISION, "tool-execution", AuditTrail.ACTION_DECISION, "tool-execution");
        assertThat(entries).extracting(AuditEntry::tool)
                .containsExactly("html-collector", "html-collector", "security-scanner", "security-scanner");
        assertThat(entries.get(3).output()).containsEntry("success", false);
    }

    @Test
    @DisplayName("crawl aggregates evidence across URLs")
    void crawl() {
        StepVerifier.create(crawler().crawl(List.of("https://acme.io/", "https://acme.io/about", "https://acme.io/pricing"), context))
                .assertNext(report -> {
                    assertThat(report.urlsProcessed()).isEqualTo(3);
                    assertThat(report.evidenceCollected()).isEqualTo(6);
                })
                .verifyComplete();

        assertThat(context.getEvidenceStore().size()).isEqualTo(6);
        assertThat(context.getAuditTrail().decisionsByTool())
                .containsEntry("html-collector", 3)
                .containsEntry("security-scanner", 3);
    }

    @Test
    @DisplayName("a URL cut off before its loop finishes is not counted as processed")
    void cancelledUrlNotCounted() {
        CollectionCapability hanging = new CollectionCapability() {
            @Override
            public CollectionTool tool() {
                return CollectionTool.HTML_COLLECTOR;
            }

            @Override
            public Mono<CapabilityOutput> execute(String url, PageContext ctx) {
                return Mono.never();
            }
        };
        ToolExecutor executor = new ToolExecutor(List.of(hanging), config, new SimpleMeterRegistry());
        IntelligentCrawler crawler = new IntelligentCrawler(new DecisionEngine(config), executor, config);

        StepVerifier.create(crawler.processUrl("https://acme.io/", context).timeout(Duration.ofMillis(200)))
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(5));

        assertThat(context.getUrlsProcessed()).hasValue(0);
    }

    @Test
    @DisplayName("no tool runs once the run-wide evidence ceiling is reached")
    void globalCeiling() {
        config.getDecision().setGlobalEvidenceCeiling(0);

        StepVerifier.create(crawler().processUrl("https://acme.io/", context))
                .assertNext(evidence -> assertThat(evidence).isEmpty())
                .verifyComplete();

        assertThat(context.getAuditTrail().size()).isZero();
    }
}
