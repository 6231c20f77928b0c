package com.scaniq.collector.service.tool.capability;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scaniq.collector.client.RenderingServiceClient;
import com.scaniq.collector.client.RenderingServiceClient.RenderedPage;
import com.scaniq.collector.dto.EvidenceItem;
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
import java.util.Map;
import java.util.Set;

/**
 * Rendered DOM through the headless rendering service. Finds client-side frameworks and routes
 * that a plain fetch cannot see.
 */
@Component
@RequiredArgsConstructor
public class RenderedPageCapability implements CollectionCapability {

    private static final Map<String, String> FRAMEWORK_MARKERS = new LinkedHashMap<>();

    static {
        FRAMEWORK_MARKERS.put("[data-reactroot], #root[data-reactroot], [data-react-helmet]", "react");
        FRAMEWORK_MARKERS.put("#__next", "next.js");
        FRAMEWORK_MARKERS.put("[ng-version]", "angular");
        FRAMEWORK_MARKERS.put("[data-v-app], #__nuxt", "vue");
        FRAMEWORK_MARKERS.put("#___gatsby", "gatsby");
        FRAMEWORK_MARKERS.put("[class*=svelte-]", "svelte");
    }

    private final RenderingServiceClient renderingClient;
    private final ContentExtractors extractors;

    @Override
    public CollectionTool tool() {
        return CollectionTool.RENDERED_FETCH;
    }

    @Override
    public boolean isAvailable() {
        return renderingClient.isEnabled();
    }

    @Override
    public Mono<CapabilityOutput> execute(String url, PageContext context) {
        return renderingClient.render(url).map(page -> collect(url, page));
    }

    private CapabilityOutput collect(String url, RenderedPage page) {
        Document doc = Jsoup.parse(page.html(), url);
        String text = doc.text();

        Set<String> frameworks = new LinkedHashSet<>();
        FRAMEWORK_MARKERS.forEach((selector, framework) -> {
            if (!doc.select(selector).isEmpty()) frameworks.add(framework);
        });

        Set<String> routes = new LinkedHashSet<>();
        for (String link : page.links()) {
            if (link.startsWith("#/") || link.contains("/#/")) routes.add(link);
        }
        doc.select("a[href^='#/']").forEach(a -> routes.add(a.attr("href")));

        List<EvidenceItem> evidence = new ArrayList<>();
        if (!frameworks.isEmpty()) {
            ObjectNode value = extractors.object().put("url", url);
            value.set("frameworks", extractors.toArray(frameworks));
            evidence.add(EvidenceItem.of("dynamic-content", value, url, 0.9));
        }
        if (!routes.isEmpty()) {
            evidence.add(EvidenceItem.of("client-side-routing", extractors.toArray(routes), url, 0.8));
        }
        evidence.addAll(extractors.techSignatures(page.html(), url));
        evidence.addAll(extractors.teamMembers(text, url));
        evidence.addAll(extractors.businessMetrics(text, url));

        Map<String, Object> characteristics = new LinkedHashMap<>();
        if (page.title() != null) {
            characteristics.put(PageCharacteristics.TITLE, page.title());
        }
        characteristics.put(PageCharacteristics.FRAMEWORKS, List.copyOf(frameworks));
        characteristics.put(PageCharacteristics.CLIENT_ROUTES, routes.size());
        characteristics.put(PageCharacteristics.HAS_API_REFERENCES, extractors.hasApiReferences(page.html()));
        return new CapabilityOutput(evidence, characteristics);
    }
}
