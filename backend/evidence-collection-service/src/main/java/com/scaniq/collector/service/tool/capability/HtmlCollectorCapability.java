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
import java.util.List;
import java.util.Map;

/**
 * Plain HTTP fetch. Reports the characteristics the decision engine branches on.
 */
@Component
@RequiredArgsConstructor
public class HtmlCollectorCapability implements CollectionCapability {

    private final PageFetcher pageFetcher;
    private final ContentExtractors extractors;

    @Override
    public CollectionTool tool() {
        return CollectionTool.HTML_COLLECTOR;
    }

    @Override
    public Mono<CapabilityOutput> execute(String url, PageContext context) {
        return pageFetcher.fetch(url)
                .map(extractors::requireSuccess)
                .map(page -> collect(url, page));
    }

    private CapabilityOutput collect(String url, FetchedPage page) {
        String html = page.body();
        Document doc = Jsoup.parse(html, page.finalUrl());
        String text = doc.text();

        Map<String, Object> characteristics = new LinkedHashMap<>();
        characteristics.put(PageCharacteristics.TITLE, doc.title());
        characteristics.put(PageCharacteristics.STATUS_CODE, page.statusCode());
        characteristics.put(PageCharacteristics.HAS_JAVASCRIPT, !doc.select("script").isEmpty());
        characteristics.put(PageCharacteristics.HAS_API_REFERENCES, extractors.hasApiReferences(html));
        characteristics.put(PageCharacteristics.HAS_SECURITY_HEADERS, extractors.hasSecurityHeaders(page));

        List<EvidenceItem> evidence = new ArrayList<>();
        evidence.add(EvidenceItem.of("page-content", extractors.object()
                .put("url", page.finalUrl())
                .put("title", doc.title())
                .put("description", doc.select("meta[name=description]").attr("content"))
                .put("contentLength", html.length()), url, 1.0));
        evidence.addAll(extractors.teamMembers(text, url));
        evidence.addAll(extractors.businessMetrics(text, url));

        return new CapabilityOutput(evidence, characteristics);
    }
}
