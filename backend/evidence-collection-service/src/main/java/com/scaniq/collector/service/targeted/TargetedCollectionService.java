package com.scaniq.collector.service.targeted;

import com.scaniq.collector.dto.AuditEntry;
import com.scaniq.collector.dto.Gap;
import com.scaniq.collector.entity.AuditQuality;
import com.scaniq.collector.entity.CollectionPhase;
import com.scaniq.collector.entity.EvidenceCategory;
import com.scaniq.collector.service.CollectionContext;
import com.scaniq.collector.service.crawler.IntelligentCrawler;
import com.scaniq.collector.service.search.AgenticSearchService;
import com.scaniq.collector.service.search.SearchQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Second pass that goes after specific gaps: re-probes likely pages on the domain and runs
 * category searches until each gap's deficit is covered or its steps run out.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TargetedCollectionService {

    private final IntelligentCrawler crawler;
    private final AgenticSearchService searchService;

    /**
     * A re-probe of {@code path} on the domain, or a search.
     */
    public record TargetedStep(String path, SearchQuery query) {

        static TargetedStep probe(String path) {
            return new TargetedStep(path, null);
        }

        static TargetedStep search(SearchQuery query) {
            return new TargetedStep(null, query);
        }

        boolean isProbe() {
            return path != null;
        }
    }

    public Mono<Integer> collect(List<Gap> gaps, CollectionContext context) {
        return Flux.fromIterable(gaps)
                .concatMap(gap -> collectForGap(gap, context))
                .reduce(0, Integer::sum)
                .doOnNext(total -> log.info("[{}] Targeted collection added {} items for {} gaps",
                        context.getCollectionId(), total, gaps.size()));
    }

    Mono<Integer> collectForGap(Gap gap, CollectionContext context) {
        List<TargetedStep> steps = stepsFor(gap.category());
        // items are already counted by the crawl and search entries; the gap total goes in output only
        long start = System.currentTimeMillis();
        return runSteps(steps, 0, 0, gap, context)
                .doOnNext(collected -> context.getAuditTrail().log(AuditEntry.builder()
                        .phase(CollectionPhase.TARGETED.getCode())
                        .action("fill-gap: " + gap.category())
                        .input(Map.of("category", gap.category(), "deficit", gap.deficit(),
                                "priority", gap.priority().name()))
                        .output(Map.of("collected", collected, "steps", steps.size()))
                        .reasoning("Targeted collection for " + gap.priority() + " priority gap")
                        .quality(AuditQuality.fromEvidenceCount(collected))
                        .durationMs(System.currentTimeMillis() - start)));
    }

    private Mono<Integer> runSteps(List<TargetedStep> steps, int index, int collected,
                                   Gap gap, CollectionContext context) {
        if (index >= steps.size() || collected >= gap.deficit()) {
            return Mono.just(collected);
        }
        return runStep(steps.get(index), gap, context)
                .onErrorResume(e -> {
                    log.warn("Targeted step for {} failed: {}", gap.category(), e.getMessage());
                    return Mono.just(0);
                })
                .flatMap(found -> runSteps(steps, index + 1, collected + found, gap, context));
    }

    private Mono<Integer> runStep(TargetedStep step, Gap gap, CollectionContext context) {
        if (step.isProbe()) {
            String url = "https://" + context.getDomain() + step.path();
            return crawler.processUrl(url, context, CollectionPhase.TARGETED).map(List::size);
        }
        return searchService.runQuery(step.query(), "targeted-" + gap.category(), context, CollectionPhase.TARGETED)
                .map(List::size);
    }

    static List<TargetedStep> stepsFor(String category) {
        return EvidenceCategory.fromTag(category)
                .map(TargetedCollectionService::plan)
                .orElseGet(() -> List.of(TargetedStep.search(
                        SearchQuery.forCategory("{company} " + category.replace('-', ' '), category))));
    }

    private static List<TargetedStep> plan(EvidenceCategory category) {
        return switch (category) {
            case TECH_STACK -> List.of(
                    TargetedStep.probe("/technology"),
                    TargetedStep.probe("/engineering"),
                    TargetedStep.probe("/stack"));
            case TEAM_INFO -> List.of(
                    TargetedStep.search(SearchQuery.of("site:linkedin.com/in {company}", "team")),
                    TargetedStep.search(SearchQuery.of("{company} leadership team", "leadership")));
            case API_ENDPOINT -> List.of(
                    TargetedStep.probe("/api"),
                    TargetedStep.probe("/docs"),
                    TargetedStep.probe("/developers"));
            case FINANCIAL_METRIC -> List.of(
                    TargetedStep.probe("/investors"),
                    TargetedStep.probe("/about"),
                    TargetedStep.search(SearchQuery.of("{company} funding round valuation", "funding")));
            case SECURITY -> List.of(
                    TargetedStep.probe("/security"),
                    TargetedStep.probe("/trust"));
            case CUSTOMER -> List.of(
                    TargetedStep.search(SearchQuery.of("{company} customers case studies", "customers")));
            case COMPETITOR -> List.of(
                    TargetedStep.search(SearchQuery.of("{company} competitors alternatives", "competitive")));
            default -> List.of(TargetedStep.search(
                    SearchQuery.forCategory("{company} " + category.getTag().replace('-', ' '), category.getTag())));
        };
    }
}
