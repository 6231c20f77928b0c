package com.scaniq.collector.service.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scaniq.collector.client.SearchProvider;
import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.dto.AuditEntry;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.SearchHit;
import com.scaniq.collector.entity.CollectionPhase;
import com.scaniq.collector.entity.EvidenceCategory;
import com.scaniq.collector.service.CollectionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Phased web search that extends its own plan when a phase comes back thin.
 *
 * Queries within a phase run in parallel; phases run one after another so each phase can see
 * what the previous one yielded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgenticSearchService {

    private static final String TOOL = "agentic-search";

    private final SearchProvider searchProvider;
    private final EvidenceCollectionConfig config;
    private final ObjectMapper objectMapper;

    /**
     * Runs the standard plan plus any adaptive phases. Completes with the number of items found.
     */
    public Mono<Integer> search(CollectionContext context, int maxDepth) {
        return Mono.defer(() -> {
            PlanState state = new PlanState(SearchPhase.standardPlan(), maxDepth);
            return runPlan(state, context, CollectionPhase.SEARCH)
                    .then(Mono.fromSupplier(() -> {
                        log.info("[{}] Agentic search finished: {} phases, {} items, depth {}",
                                context.getCollectionId(), state.phasesRun, state.total, state.depth);
                        return state.total;
                    }));
        });
    }

    /**
     * Runs the thesis-specific phase, if the run has a thesis.
     */
    public Mono<Integer> searchThesis(CollectionContext context) {
        if (context.getThesis() == null) {
            return Mono.just(0);
        }
        return runPhase(SearchPhase.forThesis(context.getThesis()), context, CollectionPhase.THESIS_SEARCH)
                .map(List::size);
    }

    public Mono<List<EvidenceItem>> runPhase(SearchPhase phase, CollectionContext context, CollectionPhase auditPhase) {
        int concurrency = Math.max(1, config.getSearch().getQueryConcurrency());
        return Flux.fromIterable(phase.queries())
                .flatMap(query -> runQuery(query, phase.name(), context, auditPhase), concurrency)
                .flatMapIterable(items -> items)
                .collectList();
    }

    /**
     * Executes one query, storing and auditing its evidence. A failing query yields no evidence.
     */
    public Mono<List<EvidenceItem>> runQuery(SearchQuery query, String phaseName,
                                             CollectionContext context, CollectionPhase auditPhase) {
        String text = query.render(context.getCompanyName(), context.getDomain());
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return searchProvider.search(text, config.getSearch().getResultsPerQuery())
                    .map(hits -> toEvidence(hits, query))
                    .onErrorResume(e -> {
                        log.warn("Search query failed '{}': {}", text, e.getMessage());
                        return Mono.just(List.of());
                    })
                    .doOnNext(items -> {
                        context.getEvidenceStore().add("search:" + text, items);
                        Map<String, Object> input = new LinkedHashMap<>();
                        input.put("query", text);
                        input.put("type", query.type());
                        input.put("searchPhase", phaseName);
                        context.getAuditTrail().log(AuditEntry.builder()
                                .phase(auditPhase.getCode())
                                .action("search: " + text)
                                .tool(TOOL)
                                .input(input)
                                .output(Map.of("evidence", items.size()))
                                .reasoning(query.type() + " search to gather " + phaseName + " evidence")
                                .evidenceCount(items.size())
                                .durationMs(System.currentTimeMillis() - start));
                    });
        });
    }

    private Mono<Void> runPlan(PlanState state, CollectionContext context, CollectionPhase auditPhase) {
        SearchPhase phase = state.plan.poll();
        if (phase == null) {
            return Mono.empty();
        }
        return runPhase(phase, context, auditPhase)
                .doOnNext(items -> {
                    state.phasesRun++;
                    state.total += items.size();
                    if (items.size() < config.getSearch().getMinPhaseYield() && state.depth < state.maxDepth) {
                        adapt(state, items, context);
                    }
                })
                .then(Mono.defer(() -> runPlan(state, context, auditPhase)));
    }

    private void adapt(PlanState state, List<EvidenceItem> phaseEvidence, CollectionContext context) {
        List<String> added = new ArrayList<>();
        for (String name : gapPhases(phaseEvidence)) {
            if (state.depth >= state.maxDepth) break;
            if (state.queued.add(name)) {
                // one unit of depth per appended phase
                SearchPhase.adaptive(name).ifPresent(p -> {
                    state.plan.add(p);
                    state.depth++;
                    added.add(name);
                });
            }
        }
        if (!added.isEmpty()) {
            log.debug("[{}] Search plan extended with {}", context.getCollectionId(), added);
        }
    }

    static List<String> gapPhases(List<EvidenceItem> evidence) {
        Set<String> categories = new HashSet<>();
        evidence.forEach(item -> categories.add(item.category()));

        List<String> phases = new ArrayList<>();
        if (!categories.contains(EvidenceCategory.TECH_STACK.getTag())) phases.add(SearchPhase.TECHNICAL_DEEP_DIVE);
        if (!categories.contains(EvidenceCategory.FINANCIAL_METRIC.getTag())) phases.add(SearchPhase.FINANCIAL_DEEP_DIVE);
        if (!categories.contains(EvidenceCategory.TEAM_INFO.getTag())) phases.add(SearchPhase.TEAM_DEEP_DIVE);
        return phases;
    }

    private List<EvidenceItem> toEvidence(List<SearchHit> hits, SearchQuery query) {
        double confidence = config.getSearch().getConfidence();
        List<EvidenceItem> items = new ArrayList<>(hits.size());
        for (SearchHit hit : hits) {
            ObjectNode value = objectMapper.createObjectNode()
                    .put("title", hit.title())
                    .put("snippet", hit.snippet())
                    .put("url", hit.url());
            items.add(EvidenceItem.of(query.evidenceType(), value, hit.url(), confidence));
        }
        return items;
    }

    private static final class PlanState {
        private final Deque<SearchPhase> plan;
        private final Set<String> queued = new HashSet<>();
        private final int maxDepth;
        private int depth;
        private int phasesRun;
        private int total;

        private PlanState(List<SearchPhase> phases, int maxDepth) {
            this.plan = new ArrayDeque<>(phases);
            this.maxDepth = maxDepth;
            phases.forEach(p -> queued.add(p.name()));
        }
    }
}
