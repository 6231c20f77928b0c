package com.scaniq.collector.service.decision;

import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.dto.Decision;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.entity.CollectionTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Chooses the next capability for a page from what has been observed so far.
 *
 * Rules are checked in order and the first match wins. A rule never picks a tool that already
 * ran for the page, so each tool runs at most once per URL.
 */
@Service
@RequiredArgsConstructor
public class DecisionEngine {

    private static final Set<String> APP_HOST_PREFIXES = Set.of("app.", "dashboard.", "console.");
    private static final Set<String> APP_PATH_SEGMENTS = Set.of("app", "dashboard", "console");
    private static final List<String> API_PATH_MARKERS = List.of("/api", "/docs", "/developer", "/reference");
    private static final List<String> TECH_PATH_MARKERS = List.of("/tech", "/stack", "/engineering", "/technology", "/platform");

    private final EvidenceCollectionConfig config;

    public Decision decide(PageContext context, List<EvidenceItem> evidenceForUrl) {
        String url = context.url();

        if (!context.hasRun(CollectionTool.RENDERED_FETCH)
                && (context.flag(PageCharacteristics.HAS_JAVASCRIPT) || impliesApplication(url))) {
            return Decision.run(CollectionTool.RENDERED_FETCH,
                    "Page relies on JavaScript; rendered DOM needed", 9, 20);
        }

        if (!context.hasRun(CollectionTool.API_EXTRACTOR)
                && looksLikeApiDocs(url)
                && evidenceForUrl.stream().noneMatch(e -> e.type().contains("api"))) {
            return Decision.run(CollectionTool.API_EXTRACTOR,
                    "API documentation path without API evidence", 8, 30);
        }

        if (!context.hasRun(CollectionTool.SECURITY_SCAN)
                && context.flag(PageCharacteristics.HAS_SECURITY_HEADERS)) {
            return Decision.run(CollectionTool.SECURITY_SCAN,
                    "Security headers observed; scanning posture", 7, 15);
        }

        if (!context.hasRun(CollectionTool.TECH_ANALYZER) && looksTechRelated(url)) {
            return Decision.run(CollectionTool.TECH_ANALYZER,
                    "Technology related page", 8, 25);
        }

        if (!context.hasRun(CollectionTool.HTML_COLLECTOR)) {
            return Decision.run(CollectionTool.HTML_COLLECTOR,
                    "Basic HTML not yet collected", 10, 10);
        }

        return Decision.stop("No applicable tool left for page");
    }

    public boolean shouldContinue(PageContext context, Decision decision) {
        EvidenceCollectionConfig.Decision limits = config.getDecision();

        if (context.loopCount() >= limits.getMaxLoops()) return false;
        if (context.evidenceCount() > limits.getEvidenceCeiling()) return false;
        if (decision.isTerminal()) return false;
        return !(decision.expectedEvidence() < limits.getLowValueThreshold()
                && context.evidenceCount() > limits.getDiminishingReturnsThreshold());
    }

    static boolean impliesApplication(String url) {
        URI uri = parse(url);
        if (uri == null) return false;
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        if (APP_HOST_PREFIXES.stream().anyMatch(host::startsWith)) return true;
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        for (String segment : path.split("/")) {
            if (APP_PATH_SEGMENTS.contains(segment)) return true;
        }
        return false;
    }

    static boolean looksLikeApiDocs(String url) {
        return pathContainsAny(url, API_PATH_MARKERS);
    }

    static boolean looksTechRelated(String url) {
        return pathContainsAny(url, TECH_PATH_MARKERS);
    }

    private static boolean pathContainsAny(String url, List<String> markers) {
        URI uri = parse(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(path::contains);
    }

    private static URI parse(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
