package com.scaniq.collector.service.search;

import com.scaniq.collector.entity.InvestmentThesis;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A named group of queries run together.
 */
public record SearchPhase(String name, List<SearchQuery> queries) {

    public static final String TECHNICAL_DEEP_DIVE = "technical-deep-dive";
    public static final String FINANCIAL_DEEP_DIVE = "financial-deep-dive";
    public static final String TEAM_DEEP_DIVE = "team-deep-dive";
    public static final String THESIS_SPECIFIC = "thesis-specific";

    public SearchPhase {
        queries = List.copyOf(queries);
    }

    public static List<SearchPhase> standardPlan() {
        return List.of(
                new SearchPhase("initial-discovery", List.of(
                        SearchQuery.of("{company} technology stack", "tech"),
                        SearchQuery.of("{company} engineering team", "team"),
                        SearchQuery.of("{company} funding investors", "financial"),
                        SearchQuery.of("{company} customers case studies", "business"))),
                new SearchPhase("deep-technical", List.of(
                        SearchQuery.of("site:{domain} API documentation", "api"),
                        SearchQuery.of("{company} github open source", "oss"),
                        SearchQuery.of("{company} technical blog engineering", "blog"),
                        SearchQuery.of("{company} job postings developer", "hiring"))),
                new SearchPhase("competitive-analysis", List.of(
                        SearchQuery.of("{company} vs competitors comparison", "competitive"),
                        SearchQuery.of("{company} market share industry", "market"),
                        SearchQuery.of("{company} reviews g2 capterra", "reviews"))),
                new SearchPhase("investor-network", List.of(
                        SearchQuery.of("{company} investors portfolio", "investor"),
                        SearchQuery.of("{company} board members advisors", "leadership"),
                        SearchQuery.of("{company} acquisition rumors", "strategic"))));
    }

    public static Optional<SearchPhase> adaptive(String name) {
        return switch (name) {
            case TECHNICAL_DEEP_DIVE -> Optional.of(new SearchPhase(name, List.of(
                    SearchQuery.of("{company} architecture diagram", "architecture"),
                    SearchQuery.of("{company} scalability performance", "technical"))));
            case FINANCIAL_DEEP_DIVE -> Optional.of(new SearchPhase(name, List.of(
                    SearchQuery.of("{company} funding round raised", "funding"),
                    SearchQuery.of("{company} annual revenue", "financial"))));
            case TEAM_DEEP_DIVE -> Optional.of(new SearchPhase(name, List.of(
                    SearchQuery.of("{company} leadership team executives", "leadership"),
                    SearchQuery.of("{company} linkedin engineers", "team"))));
            default -> Optional.empty();
        };
    }

    /**
     * One query per thesis topic; results count toward the matching required category.
     */
    public static SearchPhase forThesis(InvestmentThesis thesis) {
        List<SearchQuery> queries = new ArrayList<>();
        List<String> topics = thesis.getSearchTopics();
        List<String> categories = thesis.getRequiredCategories();
        for (int i = 0; i < topics.size(); i++) {
            String category = i < categories.size() ? categories.get(i) : thesis.getTag();
            queries.add(SearchQuery.forCategory("{company} " + topics.get(i), category));
        }
        return new SearchPhase(THESIS_SPECIFIC, queries);
    }
}
