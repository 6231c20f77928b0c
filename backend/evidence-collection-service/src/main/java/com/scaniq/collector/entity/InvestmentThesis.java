package com.scaniq.collector.entity;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Investment theses a collection can be tuned for. Each thesis names the evidence categories
 * it requires and the extra search topics worth running for it.
 */
public enum InvestmentThesis {
    ACCELERATE_ORGANIC_GROWTH("accelerate-organic-growth",
            List.of("growth-metric", "marketing-tech", "customer-acquisition"),
            List.of("marketing automation tools", "growth strategy", "customer acquisition cost")),
    BUY_AND_BUILD("buy-and-build",
            List.of("acquisition-history", "integration-api", "market-position"),
            List.of("acquisition history", "integration capabilities", "M&A strategy")),
    DIGITAL_TRANSFORMATION("digital-transformation",
            List.of("legacy-tech", "cloud-migration", "api-strategy"),
            List.of("legacy system migration", "cloud adoption", "API strategy")),
    GENERATIVE_AI_ADOPTION("generative-ai-adoption",
            List.of("ai-implementation", "data-pipeline", "ml-infrastructure"),
            List.of("generative AI features", "machine learning platform", "data infrastructure")),
    TURN_AROUND("turn-around",
            List.of("performance-issue", "tech-debt", "cost-optimization"),
            List.of("layoffs restructuring", "technical debt", "cost reduction"));

    private final String tag;
    private final List<String> requiredCategories;
    private final List<String> searchTopics;

    InvestmentThesis(String tag, List<String> requiredCategories, List<String> searchTopics) {
        this.tag = tag;
        this.requiredCategories = requiredCategories;
        this.searchTopics = searchTopics;
    }

    public String getTag() {
        return tag;
    }

    public List<String> getRequiredCategories() {
        return requiredCategories;
    }

    public List<String> getSearchTopics() {
        return searchTopics;
    }

    public static Optional<InvestmentThesis> fromTag(String tag) {
        if (tag == null || tag.isBlank()) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.tag.equalsIgnoreCase(tag.trim()))
                .findFirst();
    }
}
