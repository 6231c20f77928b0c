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
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Technology signature scan over page content and response headers.
 */
@Component
@RequiredArgsConstructor
public class TechStackCapability implements CollectionCapability {

    // response header -> CDN
    private static final Map<String, String> CDN_HEADERS = Map.of(
            "cf-ray", "cloudflare",
            "x-amz-cf-id", "cloudfront",
            "x-fastly-request-id", "fastly",
            "x-akamai-transformed", "akamai",
            "x-vercel-id", "vercel");

    private final PageFetcher pageFetcher;
    private final ContentExtractors extractors;

    @Override
    public CollectionTool tool() {
        return CollectionTool.TECH_ANALYZER;
    }

    @Override
    public Mono<CapabilityOutput> execute(String url, PageContext context) {
        return pageFetcher.fetch(url)
                .map(extractors::requireSuccess)
                .map(page -> analyze(url, page));
    }

    private CapabilityOutput analyze(String url, FetchedPage page) {
        List<EvidenceItem> evidence = new ArrayList<>(extractors.techSignatures(page.body(), url));

        String server = page.header("server");
        if (server != null && !server.isBlank()) {
            evidence.add(EvidenceItem.of("web-server", server.trim(), url, 0.9));
        }
        String poweredBy = page.header("x-powered-by");
        if (poweredBy != null && !poweredBy.isBlank()) {
            evidence.add(EvidenceItem.of("backend-language", extractors.toArray(List.of(poweredBy.trim().toLowerCase(Locale.ROOT))), url, 0.85));
        }

        Set<String> cdns = new LinkedHashSet<>();
        CDN_HEADERS.forEach((header, cdn) -> {
            if (page.hasHeader(header)) cdns.add(cdn);
        });
        if (!cdns.isEmpty()) {
            evidence.add(EvidenceItem.of("cdn", extractors.toArray(cdns), url, 0.9));
        }

        Document doc = Jsoup.parse(page.body(), page.finalUrl());
        String generator = doc.select("meta[name=generator]").attr("content");
        if (!generator.isBlank()) {
            evidence.add(EvidenceItem.of("cms", generator.trim(), url, 0.9));
        }

        Map<String, Object> characteristics = new LinkedHashMap<>();
        characteristics.put(PageCharacteristics.STATUS_CODE, page.statusCode());
        characteristics.put(PageCharacteristics.HAS_SECURITY_HEADERS, extractors.hasSecurityHeaders(page));
        return new CapabilityOutput(evidence, characteristics);
    }
}
