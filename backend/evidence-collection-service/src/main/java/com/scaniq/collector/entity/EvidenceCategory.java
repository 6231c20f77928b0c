package com.scaniq.collector.entity;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * Evidence categories tracked by gap analysis and coverage.
 *
 * Capabilities and searches emit fine-grained evidence types (e.g. "frontend-framework",
 * "search-team"); each type rolls up into at most one category. The category tag itself is
 * always a member of its category.
 */
public enum EvidenceCategory {
    TECH_STACK("tech-stack", Set.of(
            "frontend-framework", "backend-language", "cloud-provider", "database",
            "containerization", "ci-cd", "web-server", "cdn", "cms", "dynamic-content",
            "client-side-routing", "search-tech", "search-oss", "search-blog",
            "search-architecture", "search-technical")),
    TEAM_INFO("team-info", Set.of(
            "team-member", "search-team", "search-leadership", "search-hiring")),
    FINANCIAL_METRIC("financial-metric", Set.of(
            "revenue", "growth-rate", "search-financial", "search-investor", "search-funding")),
    API_ENDPOINT("api-endpoint", Set.of(
            "api-endpoints", "api-documentation", "api-auth", "api-rate-limit", "search-api")),
    SECURITY("security", Set.of(
            "security-header", "security-missing-header", "security-tls")),
    CUSTOMER("customer", Set.of(
            "customer-count", "search-business", "search-customers")),
    COMPETITOR("competitor", Set.of(
            "search-competitive", "search-market", "search-reviews")),
    INTEGRATION("integration", Set.of(
            "search-integration", "search-strategic")),
    PERFORMANCE("performance", Set.of(
            "search-performance")),
    BUSINESS_MODEL("business-model", Set.of(
            "pricing", "search-pricing"));

    /**
     * Categories counted by the coverage percentage.
     */
    public static final Set<EvidenceCategory> COVERAGE_SET = Set.of(
            TECH_STACK, TEAM_INFO, FINANCIAL_METRIC, API_ENDPOINT,
            SECURITY, CUSTOMER, COMPETITOR, PERFORMANCE);

    private final String tag;
    private final Set<String> memberTypes;

    EvidenceCategory(String tag, Set<String> memberTypes) {
        this.tag = tag;
        this.memberTypes = memberTypes;
    }

    public String getTag() {
        return tag;
    }

    public boolean contains(String type) {
        return type != null && (tag.equals(type) || memberTypes.contains(type));
    }

    public static Optional<EvidenceCategory> classify(String type) {
        return Arrays.stream(values()).filter(c -> c.contains(type)).findFirst();
    }

    public static Optional<EvidenceCategory> fromTag(String tag) {
        return Arrays.stream(values()).filter(c -> c.tag.equals(tag)).findFirst();
    }

    /**
     * Category tag an evidence type counts under; unclassified types count as themselves.
     */
    public static String tagOf(String type) {
        return classify(type).map(EvidenceCategory::getTag).orElse(type);
    }
}
