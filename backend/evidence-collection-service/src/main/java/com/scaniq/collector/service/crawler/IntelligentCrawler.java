package com.scaniq.collector.service.crawler;

import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.dto.AuditEntry;
import com.scaniq.collector.dto.Decision;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.ToolResult;
import com.scaniq.collector.entity.CollectionPhase;
import com.scaniq.collector.service.CollectionContext;
import com.scaniq.collector.service.audit.AuditTrail;
import com.scaniq.collector.service.decision.DecisionEngine;
import com.scaniq.collector.service.decision.PageContext;
import com.scaniq.collector.service.tool.ToolExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the adaptive decide/execute loop for every discovered URL.
 *
 * A single URL is processed sequentially, one tool at a time; different URLs run concurrently.
 * Evidence is appended to the run's store as soon as a tool returns, so an interrupted crawl
 * keeps what it already found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntelligentCrawler {

    private final DecisionEngine decisionEngine;
    private final ToolExecutor toolExecutor;
    private final EvidenceCollectionConfig config;

    public Mono<CrawlReport> crawl(List<String> urls, CollectionContext context) {
        int concurrency = Math.max(1, config.getTools().getUrlConcurrency());
        return Flux.fromIterable(urls)
                .flatMap(url -> processUrl(url, context)
                        .onErrorResume(e -> {
                            log.warn("Processing failed for {}: {}", url, e.getMessage());
                            return Mono.just(List.of());
                        }), concurrency)
                .map(List::size)
                .reduce(0, Integer::sum)
                .map(total -> {
                    log.info("[{}] Crawled {} URLs, {} evidence items",
                            context.getCollectionId(), urls.size(), total);
                    return new CrawlReport(urls.size(), total);
                });
    }

    public Mono<List<EvidenceItem>> processUrl(String url, CollectionContext context) {
        return Mono.defer(() -> loop(PageContext.initial(url), new ArrayList<>(), context, CollectionPhase.CRAWL))
                .doFinally(signal -> {
                    if (signal == SignalType.ON_COMPLETE) {
                        context.getUrlsProcessed().incrementAndGet();
                    }
                });
    }

    /**
     * Same loop as {@link #processUrl} but audited under another phase; used for re-probes.
     */
    public Mono<List<EvidenceItem>> processUrl(String url, CollectionContext context, CollectionPhase phase) {
        return Mono.defer(() -> loop(PageContext.initial(url), new ArrayList<>(), context, phase));
    }

    private Mono<List<EvidenceItem>> loop(PageContext page, List<EvidenceItem> collected,
                                          CollectionContext context, CollectionPhase phase) {
        if (context.getEvidenceStore().size() >= config.getDecision().getGlobalEvidenceCeiling()) {
            log.debug("Global evidence ceiling reached, stopping {}", page.url());
            return Mono.just(List.copyOf(collected));
        }

        Decision decision = decisionEngine.decide(page, context.getEvidenceStore().forSource(page.url()));
        if (!decisionEngine.shouldContinue(page, decision)) {
            log.debug("Stopping {} after {} loops: {}", page.url(), page.loopCount(), decision.reasoning());
            return Mono.just(List.copyOf(collected));
        }

        AuditTrail audit = context.getAuditTrail();
        audit.log(AuditEntry.builder()
                .phase(phase.getCode())
                .action(AuditTrail.ACTION_DECISION)
                .tool(decision.tool().getCode())
                .input(Map.of("url", page.url(), "loop", page.loopCount()))
                .output(Map.of("priority", decision.priority(), "expectedEvidence", decision.expectedEvidence()))
                .reasoning(decision.reasoning()));

        return toolExecutor.execute(decision.tool(), page.url(), page)
                .flatMap(result -> {
                    collected.addAll(result.evidence());
                    context.getEvidenceStore().add(page.url(), result.evidence());
                    audit.log(AuditEntry.builder()
                            .phase(phase.getCode())
                            .action("tool-execution")
                            .tool(decision.tool().getCode())
                            .input(Map.of("url", page.url()))
                            .output(outputOf(result))
                            .reasoning(decision.reasoning())
                            .evidenceCount(result.evidence().size())
                            .durationMs(result.durationMs()));
                    return loop(page.advance(decision.tool(), result), collected, context, phase);
                });
    }

    private static Map<String, Object> outputOf(ToolResult result) {
        Map<String, Object> output = new HashMap<>();
        output.put("success", result.success());
        output.put("characteristics", List.copyOf(result.characteristics().keySet()));
        if (!result.success()) {
            output.put("error", result.error());
            output.put("failureReason", String.valueOf(result.failureReason()));
        }
        return output;
    }
}
