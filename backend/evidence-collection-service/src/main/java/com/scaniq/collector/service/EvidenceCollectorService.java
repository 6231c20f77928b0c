package com.scaniq.collector.service;

import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.config.EvidenceCollectionConfig.DepthProfile;
import com.scaniq.collector.dto.AuditEntry;
import com.scaniq.collector.dto.AuditSummary;
import com.scaniq.collector.dto.CollectionRequest;
import com.scaniq.collector.dto.CollectionResult;
import com.scaniq.collector.dto.CollectionSummary;
import com.scaniq.collector.dto.CoverageReport;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.Gap;
import com.scaniq.collector.entity.CollectionDepth;
import com.scaniq.collector.entity.CollectionPhase;
import com.scaniq.collector.entity.InvestmentThesis;
import com.scaniq.collector.exception.InvalidCollectionRequestException;
import com.scaniq.collector.service.crawler.IntelligentCrawler;
import com.scaniq.collector.service.discovery.UrlDiscoveryService;
import com.scaniq.collector.service.monitor.EvidenceMonitor;
import com.scaniq.collector.service.processing.EvidenceProcessor;
import com.scaniq.collector.service.search.AgenticSearchService;
import com.scaniq.collector.service.sink.EvidenceSink;
import com.scaniq.collector.service.targeted.TargetedCollectionService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates a collection run.
 *
 * Phases:
 * 1. URL discovery
 * 2. Adaptive per-URL crawl
 * 3. Agentic search (plus thesis-specific searches)
 * 4. Gap analysis
 * 5. Targeted collection for gaps (skipped for SHALLOW runs)
 * 6. Deduplication, scoring and summary
 *
 * Each phase has a deadline; a phase that runs out of time keeps what it already stored and
 * the run moves on. Any other failure ends the run with {@code success=false} but still returns
 * the evidence and audit trail gathered up to that point.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceCollectorService {

    private final UrlDiscoveryService urlDiscoveryService;
    private final IntelligentCrawler intelligentCrawler;
    private final AgenticSearchService agenticSearchService;
    private final EvidenceMonitor evidenceMonitor;
    private final TargetedCollectionService targetedCollectionService;
    private final EvidenceProcessor evidenceProcessor;
    private final EvidenceSink evidenceSink;
    private final EvidenceCollectionConfig config;
    private final MeterRegistry meterRegistry;

    private Counter completedCounter;
    private Counter failedCounter;
    private Timer collectionTimer;

    @PostConstruct
    public void initMetrics() {
        completedCounter = Counter.builder("collector.collections")
                .description("Collection runs")
                .tag("outcome", "completed")
                .register(meterRegistry);
        failedCounter = Counter.builder("collector.collections")
                .description("Collection runs")
                .tag("outcome", "failed")
                .register(meterRegistry);
        collectionTimer = Timer.builder("collector.collection.duration")
                .description("Collection run duration")
                .register(meterRegistry);
    }

    public Mono<CollectionResult> collect(CollectionRequest request) {
        return Mono.defer(() -> {
            validate(request);

            String domain = normalizeDomain(request.getDomain());
            InvestmentThesis thesis = resolveThesis(request.getInvestmentThesis());
            CollectionDepth depth = request.getDepth() != null ? request.getDepth() : CollectionDepth.COMPREHENSIVE;
            DepthProfile profile = config.profileFor(depth);
            CollectionContext context = CollectionContext.create(
                    UUID.randomUUID().toString(), domain, request.getCompanyName().trim(), thesis, profile);

            log.info("[{}] Starting {} collection for {} ({}), thesis={}", context.getCollectionId(), depth,
                    request.getCompanyName(), domain, thesis != null ? thesis.getTag() : "none");

            AtomicReference<List<Gap>> gaps = new AtomicReference<>(List.of());

            Mono<Void> pipeline = phase(CollectionPhase.DISCOVERY,
                            urlDiscoveryService.discover(domain, profile.getMaxUrls(), context.getDiscoveredUrls()::add), context)
                    .then(Mono.defer(() -> phase(CollectionPhase.CRAWL,
                            intelligentCrawler.crawl(List.copyOf(context.getDiscoveredUrls()), context), context)))
                    .then(Mono.defer(() -> phase(CollectionPhase.SEARCH,
                            agenticSearchService.search(context, profile.getSearchDepth()), context)))
                    .then(Mono.defer(() -> phase(CollectionPhase.THESIS_SEARCH,
                            agenticSearchService.searchThesis(context), context)))
                    .then(Mono.fromRunnable(() -> gaps.set(evidenceMonitor.analyzeGaps(context))))
                    .then(Mono.defer(() -> targetedPass(profile, gaps, context)));

            return pipeline
                    .then(Mono.fromCallable(() -> buildResult(context, gaps.get(), null)))
                    .onErrorResume(e -> {
                        log.error("[{}] Collection failed: {}", context.getCollectionId(), e.getMessage(), e);
                        return Mono.fromCallable(() -> buildResult(context, gaps.get(), e));
                    })
                    .doOnNext(result -> {
                        evidenceSink.store(result);
                        (result.success() ? completedCounter : failedCounter).increment();
                        collectionTimer.record(Duration.between(context.getStartedAt(), Instant.now()));
                    });
        });
    }

    private Mono<Void> targetedPass(DepthProfile profile, AtomicReference<List<Gap>> gaps, CollectionContext context) {
        if (!profile.isTargetedPass() || gaps.get().isEmpty()) {
            log.debug("[{}] Targeted collection skipped", context.getCollectionId());
            return Mono.empty();
        }
        return phase(CollectionPhase.TARGETED, targetedCollectionService.collect(gaps.get(), context), context)
                .then(Mono.fromRunnable(() -> gaps.set(evidenceMonitor.analyzeGaps(context))));
    }

    /**
     * Applies the phase deadline. On timeout the phase completes empty and the run continues.
     */
    private <T> Mono<T> phase(CollectionPhase phase, Mono<T> work, CollectionContext context) {
        long start = System.currentTimeMillis();
        return work
                .timeout(config.getPhaseTimeout())
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("[{}] Phase {} reached its deadline of {}; keeping {} items collected so far",
                            context.getCollectionId(), phase, config.getPhaseTimeout(), context.getEvidenceStore().size());
                    context.getAuditTrail().log(AuditEntry.builder()
                            .phase(phase.getCode())
                            .action("deadline-reached")
                            .reasoning("Phase exceeded " + config.getPhaseTimeout())
                            .durationMs(System.currentTimeMillis() - start));
                    return Mono.empty();
                })
                .doOnSuccess(v -> log.info("[{}] Phase {} done in {} ms, {} items stored", context.getCollectionId(),
                        phase, System.currentTimeMillis() - start, context.getEvidenceStore().size()));
    }

    private CollectionResult buildResult(CollectionContext context, List<Gap> gaps, Throwable failure) {
        long start = System.currentTimeMillis();
        List<EvidenceItem> raw = context.getEvidenceStore().all();
        List<EvidenceItem> processed = evidenceProcessor.process(raw);

        context.getAuditTrail().log(AuditEntry.builder()
                .phase(CollectionPhase.PROCESSING.getCode())
                .action("process-evidence")
                .input(Map.of("raw", raw.size()))
                .output(Map.of("processed", processed.size()))
                .reasoning("Deduplicate, score and rank evidence")
                .evidenceCount(processed.size())
                .durationMs(System.currentTimeMillis() - start));

        CoverageReport coverage = evidenceMonitor.coverage(processed);
        AuditSummary audit = context.getAuditTrail().summarize();
        long durationMs = Duration.between(context.getStartedAt(), Instant.now()).toMillis();

        CollectionSummary summary = CollectionSummary.builder()
                .totalActions(audit.totalActions())
                .totalRawEvidence(raw.size())
                .totalEvidence(processed.size())
                .evidenceByPhase(audit.evidenceByPhase())
                .evidenceByTool(audit.evidenceByTool())
                .decisionsByTool(context.getAuditTrail().decisionsByTool())
                .urlsDiscovered(context.getDiscoveredUrls().size())
                .urlsProcessed(context.getUrlsProcessed().get())
                .coveragePercentage(coverage.percentage())
                .foundCategories(coverage.foundCategories())
                .missingCategories(coverage.missingCategories())
                .gaps(gaps)
                .overallQuality(evidenceProcessor.rateQuality(processed))
                .timeline(audit.timeline())
                .durationMs(durationMs)
                .build();

        log.info("[{}] Collection {}: {} raw / {} processed items, coverage {}%, quality {}",
                context.getCollectionId(), failure == null ? "completed" : "failed",
                raw.size(), processed.size(), coverage.percentage(), summary.getOverallQuality());

        return new CollectionResult(
                context.getCollectionId(),
                failure == null,
                failure == null ? null : String.valueOf(failure.getMessage()),
                processed,
                context.getAuditTrail().getEntries(),
                summary);
    }

    private void validate(CollectionRequest request) {
        if (request == null) {
            throw new InvalidCollectionRequestException("Request body is required");
        }
        if (request.getDomain() == null || request.getDomain().isBlank()) {
            throw new InvalidCollectionRequestException("Domain is required");
        }
        if (request.getCompanyName() == null || request.getCompanyName().isBlank()) {
            throw new InvalidCollectionRequestException("Company name is required");
        }
        if (normalizeDomain(request.getDomain()).isEmpty()) {
            throw new InvalidCollectionRequestException("Domain is not valid: " + request.getDomain());
        }
    }

    private InvestmentThesis resolveThesis(String tag) {
        if (tag == null || tag.isBlank()) return null;
        return InvestmentThesis.fromTag(tag).orElseGet(() -> {
            log.warn("Unknown investment thesis '{}', collecting without thesis requirements", tag);
            return null;
        });
    }

    /**
     * Reduces user input such as "https://www.Example.com/about" to "www.example.com".
     */
    static String normalizeDomain(String input) {
        String domain = input.trim().toLowerCase(Locale.ROOT);
        int scheme = domain.indexOf("://");
        if (scheme >= 0) {
            domain = domain.substring(scheme + 3);
        }
        int slash = domain.indexOf('/');
        if (slash >= 0) {
            domain = domain.substring(0, slash);
        }
        int query = domain.indexOf('?');
        if (query >= 0) {
            domain = domain.substring(0, query);
        }
        return domain;
    }
}
