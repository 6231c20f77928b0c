package com.scaniq.collector.service.tool.capability;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scaniq.collector.client.PageFetcher;
import com.scaniq.collector.client.TlsInspector;
import com.scaniq.collector.client.TlsInspector.TlsInfo;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.FetchedPage;
import com.scaniq.collector.entity.CollectionTool;
import com.scaniq.collector.service.decision.PageCharacteristics;
import com.scaniq.collector.service.decision.PageContext;
import com.scaniq.collector.service.tool.CapabilityOutput;
import com.scaniq.collector.service.tool.CollectionCapability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Security header audit plus a TLS handshake against the page's host.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SecurityScanCapability implements CollectionCapability {

    private static final int HTTPS_PORT = 443;

    private final PageFetcher pageFetcher;
    private final TlsInspector tlsInspector;
    private final ContentExtractors extractors;

    @Override
    public CollectionTool tool() {
        return CollectionTool.SECURITY_SCAN;
    }

    @Override
    public Mono<CapabilityOutput> execute(String url, PageContext context) {
        return pageFetcher.fetch(url)
                .map(extractors::requireSuccess)
                .flatMap(page -> inspectTls(url, page)
                        .map(tls -> {
                            List<EvidenceItem> evidence = new ArrayList<>(headerEvidence(url, page));
                            evidence.add(tls);
                            return new CapabilityOutput(evidence,
                                    Map.of(PageCharacteristics.HAS_SECURITY_HEADERS, extractors.hasSecurityHeaders(page)));
                        }));
    }

    List<EvidenceItem> headerEvidence(String url, FetchedPage page) {
        List<EvidenceItem> evidence = new ArrayList<>();
        for (String header : ContentExtractors.SECURITY_HEADERS) {
            String value = page.header(header);
            if (value != null) {
                evidence.add(EvidenceItem.of("security-header",
                        extractors.object().put("header", header).put("value", value), url, 0.9));
            } else {
                evidence.add(EvidenceItem.of("security-missing-header",
                        extractors.object().put("header", header), url, 0.9));
            }
        }
        return evidence;
    }

    private Mono<EvidenceItem> inspectTls(String url, FetchedPage page) {
        String host = URI.create(page.finalUrl()).getHost();
        return tlsInspector.inspect(host, HTTPS_PORT)
                .map(info -> EvidenceItem.of("security-tls", describe(info), url, 0.95))
                .onErrorResume(e -> {
                    log.debug("TLS inspection failed for {}: {}", host, e.getMessage());
                    ObjectNode value = extractors.object()
                            .put("host", host)
                            .put("secure", false)
                            .put("error", String.valueOf(e.getMessage()));
                    return Mono.just(EvidenceItem.of("security-tls", value, url, 0.6));
                });
    }

    private ObjectNode describe(TlsInfo info) {
        ObjectNode value = extractors.object()
                .put("host", info.host())
                .put("secure", !info.isExpired())
                .put("protocol", info.protocol())
                .put("cipherSuite", info.cipherSuite())
                .put("issuer", info.issuer());
        if (info.notAfter() != null) {
            value.put("notAfter", info.notAfter().toString());
        }
        return value;
    }
}
