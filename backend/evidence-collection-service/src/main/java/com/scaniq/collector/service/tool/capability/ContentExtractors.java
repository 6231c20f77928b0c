package com.scaniq.collector.service.tool.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.FetchedPage;
import com.scaniq.collector.exception.FetchException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern based extractors shared by the page capabilities.
 */
@Component
@RequiredArgsConstructor
public class ContentExtractors {

    public static final List<String> SECURITY_HEADERS = List.of(
            "strict-transport-security",
            "content-security-policy",
            "x-frame-options",
            "x-content-type-options");

    private static final Map<String, Pattern> TECH_PATTERNS = new LinkedHashMap<>();

    static {
        TECH_PATTERNS.put("frontend-framework", Pattern.compile("\\b(react|vue|angular|svelte|next\\.js|nuxt)\\b", Pattern.CASE_INSENSITIVE));
        TECH_PATTERNS.put("backend-language", Pattern.compile("\\b(node\\.js|python|ruby|java|golang|php|\\.net)\\b", Pattern.CASE_INSENSITIVE));
        TECH_PATTERNS.put("cloud-provider", Pattern.compile("\\b(aws|azure|gcp|google cloud)\\b", Pattern.CASE_INSENSITIVE));
        TECH_PATTERNS.put("database", Pattern.compile("\\b(mongodb|postgres(?:ql)?|mysql|redis|elasticsearch)\\b", Pattern.CASE_INSENSITIVE));
        TECH_PATTERNS.put("containerization", Pattern.compile("\\b(kubernetes|docker|k8s)\\b", Pattern.CASE_INSENSITIVE));
        TECH_PATTERNS.put("ci-cd", Pattern.compile("\\b(jenkins|circleci|github actions|gitlab ci)\\b", Pattern.CASE_INSENSITIVE));
    }

    private static final Pattern TEAM_MEMBER = Pattern.compile(
            "\\b(CEO|CTO|CFO|COO|VP|Director|Founder|Engineer|Designer)\\b[^.\\n]{0,60}?\\b([A-Z][a-z]+ [A-Z][a-z]+)");
    private static final Pattern API_PATH = Pattern.compile("(?:/api/|/v\\d+/)[a-zA-Z0-9\\-_/]+");

    private static final Map<String, Pattern> METRIC_PATTERNS = new LinkedHashMap<>();

    static {
        METRIC_PATTERNS.put("customer-count", Pattern.compile("(\\d[\\d,]*[KMB]?\\+?) customers", Pattern.CASE_INSENSITIVE));
        METRIC_PATTERNS.put("growth-rate", Pattern.compile("(\\d+%?) growth", Pattern.CASE_INSENSITIVE));
        METRIC_PATTERNS.put("revenue", Pattern.compile("\\$(\\d+(?:\\.\\d+)?[KMB]?) (?:in )?revenue", Pattern.CASE_INSENSITIVE));
    }

    private static final int MAX_TEAM_MEMBERS = 20;
    private static final int MAX_API_PATHS = 10;

    private final ObjectMapper objectMapper;

    /**
     * One item per technology family mentioned in the content, listing distinct matches.
     */
    public List<EvidenceItem> techSignatures(String content, String url) {
        List<EvidenceItem> evidence = new ArrayList<>();
        TECH_PATTERNS.forEach((type, pattern) -> {
            Set<String> matches = distinctMatches(pattern, content, 0, Integer.MAX_VALUE, true);
            if (!matches.isEmpty()) {
                evidence.add(EvidenceItem.of(type, toArray(matches), url, 0.8));
            }
        });
        return evidence;
    }

    /**
     * Named people with a role, only on team, about and leadership pages.
     */
    public List<EvidenceItem> teamMembers(String text, String url) {
        String path = pathOf(url);
        if (!(path.contains("/team") || path.contains("/about") || path.contains("/leadership"))) {
            return List.of();
        }
        List<EvidenceItem> evidence = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Matcher m = TEAM_MEMBER.matcher(text);
        while (m.find() && evidence.size() < MAX_TEAM_MEMBERS) {
            String name = m.group(2);
            if (seen.add(name)) {
                ObjectNode value = objectMapper.createObjectNode()
                        .put("name", name)
                        .put("role", m.group(1));
                evidence.add(EvidenceItem.of("team-member", value, url, 0.7));
            }
        }
        return evidence;
    }

    public List<EvidenceItem> apiPaths(String content, String url) {
        Set<String> paths = distinctMatches(API_PATH, content, 0, MAX_API_PATHS, false);
        if (paths.isEmpty()) return List.of();
        return List.of(EvidenceItem.of("api-endpoints", toArray(paths), url, 0.6));
    }

    /**
     * First mention of each business metric.
     */
    public List<EvidenceItem> businessMetrics(String text, String url) {
        List<EvidenceItem> evidence = new ArrayList<>();
        METRIC_PATTERNS.forEach((type, pattern) -> {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                evidence.add(EvidenceItem.of(type, m.group(), url, 0.7));
            }
        });
        return evidence;
    }

    public boolean hasSecurityHeaders(FetchedPage page) {
        return SECURITY_HEADERS.stream().anyMatch(page::hasHeader);
    }

    public boolean hasApiReferences(String html) {
        return html.contains("/api/");
    }

    /**
     * Rejects non-2xx pages so the executor reports them as failures.
     */
    public FetchedPage requireSuccess(FetchedPage page) {
        if (!page.isSuccessful()) {
            throw new FetchException(page.requestedUrl(), page.statusCode());
        }
        return page;
    }

    public ArrayNode toArray(Iterable<String> values) {
        ArrayNode array = objectMapper.createArrayNode();
        values.forEach(array::add);
        return array;
    }

    public ObjectNode object() {
        return objectMapper.createObjectNode();
    }

    static Set<String> distinctMatches(Pattern pattern, String content, int group, int limit, boolean lowerCase) {
        Set<String> matches = new LinkedHashSet<>();
        if (content == null) return matches;
        Matcher m = pattern.matcher(content);
        while (m.find() && matches.size() < limit) {
            String match = m.group(group);
            matches.add(lowerCase ? match.toLowerCase(Locale.ROOT) : match);
        }
        return matches;
    }

    static String pathOf(String url) {
        try {
            String path = URI.create(url).getPath();
            return path == null ? "" : path.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
