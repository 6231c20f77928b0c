package com.scaniq.collector.service.tool.capability;

import com.scaniq.collector.client.PageFetcher;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.FetchedPage;
import com.scaniq.collector.entity.CollectionTool;
import com.scaniq.collector.service.decision.PageCharacteristics;
import com.scaniq.collector.service.decision.PageContext;
import com.scaniq.collector.service.tool.CapabilityOutput;
import com.scaniq.collector.service.tool.CollectionCapability;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts API surface details from documentation pages.
 */
@Component
@RequiredArgsConstructor
public class ApiExtractorCapability implements CollectionCapability {

    private static final Map<String, Pattern> DOC_FORMATS = new LinkedHashMap<>();
    private static final Map<String, Pattern> AUTH_SCHEMES = new LinkedHashMap<>();

    static {
        DOC_FORMATS.put("openapi", Pattern.compile("openapi(?:\\.json|\\.ya?ml)?|\"openapi\"\\s*:", Pattern.CASE_INSENSITIVE));
        DOC_FORMATS.put("swagger", Pattern.compile("swagger(?:-ui|\\.json)?", Pattern.CASE_INSENSITIVE));
        DOC_FORMATS.put("graphql", Pattern.compile("\\bgraphql\\b", Pattern.CASE_INSENSITIVE));
        DOC_FORMATS.put("postman", Pattern.compile("postman collection|run in postman", Pattern.CASE_INSENSITIVE));
        DOC_FORMATS.put("redoc", Pattern.compile("\\bredoc\\b", Pattern.CASE_INSENSITIVE));

        AUTH_SCHEMES.put("oauth2", Pattern.compile("oauth\\s?2(?:\\.0)?", Pattern.CASE_INSENSITIVE));
        AUTH_SCHEMES.put("bearer", Pattern.compile("bearer token|authorization: bearer", Pattern.CASE_INSENSITIVE));
        AUTH_SCHEMES.put("api-key", Pattern.compile("\\bapi[ _-]?key\\b", Pattern.CASE_INSENSITIVE));
        AUTH_SCHEMES.put("jwt", Pattern.compile("\\bjwt\\b|json web token", Pattern.CASE_INSENSITIVE));
        AUTH_SCHEMES.put("basic", Pattern.compile("basic auth(?:entication)?", Pattern.CASE_INSENSITIVE));
    }

    private static final Pattern RATE_LIMIT = Pattern.compile(
            "(\\d[\\d,]*)\\s*(?:requests|calls|req)\\s*(?:per|/|a)\\s*(second|sec|minute|min|hour|day)",
            Pattern.CASE_INSENSITIVE);

    private final PageFetcher pageFetcher;
    private final ContentExtractors extractors;

    @Override
    public CollectionTool tool() {
        return CollectionTool.API_EXTRACTOR;
    }

    @Override
    public Mono<CapabilityOutput> execute(String url, PageContext context) {
        return pageFetcher.fetch(url)
                .map(extractors::requireSuccess)
                .map(page -> extract(url, page));
    }

    private CapabilityOutput extract(String url, FetchedPage page) {
        String html = page.body();
        String text = Jsoup.parse(html).text();
        List<EvidenceItem> evidence = new ArrayList<>(extractors.apiPaths(html, url));

        Set<String> formats = matchingKeys(DOC_FORMATS, html);
        if (!formats.isEmpty()) {
            evidence.add(EvidenceItem.of("api-documentation", extractors.toArray(formats), url, 0.8));
        }

        Set<String> schemes = matchingKeys(AUTH_SCHEMES, text);
        if (!schemes.isEmpty()) {
            evidence.add(EvidenceItem.of("api-auth", extractors.toArray(schemes), url, 0.7));
        }

        Matcher rate = RATE_LIMIT.matcher(text);
        if (rate.find()) {
            evidence.add(EvidenceItem.of("api-rate-limit", rate.group(), url, 0.7));
        } else if (page.hasHeader("x-ratelimit-limit")) {
            evidence.add(EvidenceItem.of("api-rate-limit",
                    "x-ratelimit-limit: " + page.header("x-ratelimit-limit"), url, 0.8));
        }

        return new CapabilityOutput(evidence,
                Map.of(PageCharacteristics.HAS_API_REFERENCES, extractors.hasApiReferences(html)));
    }

    private static Set<String> matchingKeys(Map<String, Pattern> patterns, String content) {
        Set<String> keys = new LinkedHashSet<>();
        patterns.forEach((key, pattern) -> {
            if (pattern.matcher(content).find()) keys.add(key);
        });
        return keys;
    }
}
