package com.scaniq.collector.config;

import com.scaniq.collector.entity.CollectionDepth;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables of the evidence collection engine.
 *
 * Every threshold the engine uses to stop, prioritize or score lives here so that it can be
 * adjusted per environment without code changes. Defaults reproduce the behaviour of a
 * COMPREHENSIVE run.
 */
@Configuration
@ConfigurationProperties(prefix = "collector.evidence")
@Data
public class EvidenceCollectionConfig {

    /**
     * Deadline for each run phase. Evidence appended before the deadline is kept.
     */
    private Duration phaseTimeout = Duration.ofMinutes(5);

    private Discovery discovery = new Discovery();

    private Decision decision = new Decision();

    private Tools tools = new Tools();

    private Search search = new Search();

    private Monitor monitor = new Monitor();

    private Processing processing = new Processing();

    private Map<CollectionDepth, DepthProfile> depthProfiles = defaultProfiles();

    public DepthProfile profileFor(CollectionDepth depth) {
        DepthProfile profile = depthProfiles.get(depth == null ? CollectionDepth.COMPREHENSIVE : depth);
        return profile != null ? profile : new DepthProfile(discovery.getMaxUrls(), search.getMaxDepth(), true);
    }

    private static Map<CollectionDepth, DepthProfile> defaultProfiles() {
        Map<CollectionDepth, DepthProfile> profiles = new EnumMap<>(CollectionDepth.class);
        profiles.put(CollectionDepth.SHALLOW, new DepthProfile(50, 1, false));
        profiles.put(CollectionDepth.DEEP, new DepthProfile(150, 3, true));
        profiles.put(CollectionDepth.COMPREHENSIVE, new DepthProfile(300, 5, true));
        return profiles;
    }

    @Data
    public static class Discovery {
        /** Upper bound of discovered URLs per run */
        private int maxUrls = 300;

        /** Parallel fetches per discovery batch */
        private int concurrency = 5;

        /** Paths probed right after the domain root */
        private List<String> importantPaths = new ArrayList<>(List.of(
                "/about", "/team", "/technology", "/tech-stack", "/engineering",
                "/api", "/docs", "/documentation", "/developers", "/careers",
                "/jobs", "/investors", "/press", "/customers", "/case-studies",
                "/testimonials", "/pricing", "/features", "/security", "/privacy"));
    }

    @Data
    public static class Decision {
        /** Loop iterations allowed per URL */
        private int maxLoops = 10;

        /** Evidence per URL after which the loop stops */
        private int evidenceCeiling = 50;

        /** Decisions expecting fewer items than this are low value */
        private int lowValueThreshold = 5;

        /** Evidence per URL after which low value decisions are skipped */
        private int diminishingReturnsThreshold = 20;

        /** Evidence per run after which no URL loop starts another tool */
        private int globalEvidenceCeiling = 5000;
    }

    @Data
    public static class Tools {
        private Duration timeout = Duration.ofSeconds(30);

        /** URLs processed concurrently by the crawler */
        private int urlConcurrency = 5;
    }

    @Data
    public static class Search {
        private int maxDepth = 5;

        /** A phase yielding fewer items than this triggers adaptive phases */
        private int minPhaseYield = 5;

        private int queryConcurrency = 4;

        private int resultsPerQuery = 5;

        private double confidence = 0.7;
    }

    @Data
    public static class Monitor {
        /** Target item count per category, in reporting order */
        private Map<String, Integer> targets = orderedCounts(
                "tech-stack", 30,
                "team-info", 20,
                "financial-metric", 15,
                "api-endpoint", 20,
                "security", 15,
                "customer", 20,
                "competitor", 15,
                "integration", 10,
                "performance", 10,
                "business-model", 10);

        /** Category weight; categories not listed weigh 1 */
        private Map<String, Integer> importance = orderedCounts(
                "tech-stack", 3,
                "team-info", 3,
                "financial-metric", 3,
                "api-endpoint", 2,
                "security", 2,
                "customer", 2,
                "business-model", 2);

        /** Required categories below this count become HIGH gaps */
        private int requiredMinimum = 5;

        private int requiredTarget = 10;
    }

    private static Map<String, Integer> orderedCounts(Object... pairs) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            counts.put((String) pairs[i], (Integer) pairs[i + 1]);
        }
        return counts;
    }

    @Data
    public static class Processing {
        private double highValueBoost = 1.5;

        private List<String> highValueCategories = new ArrayList<>(List.of(
                "tech-stack", "financial-metric", "team-info"));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DepthProfile {
        private int maxUrls;
        private int searchDepth;
        private boolean targetedPass;
    }
}
