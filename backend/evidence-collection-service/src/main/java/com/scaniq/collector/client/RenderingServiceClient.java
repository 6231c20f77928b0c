package com.scaniq.collector.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scaniq.collector.exception.ExtractionException;
import com.scaniq.collector.exception.FetchException;
import com.scaniq.collector.exception.ToolExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for a Crawl4AI compatible headless rendering service.
 * Calls /crawl at the configured base URL and returns the rendered DOM.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RenderingServiceClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${collector.rendering.enabled:false}")
    private boolean enabled;

    @Value("${collector.rendering.base-url:http://web-crawler:11235}")
    private String baseUrl;

    @Value("${collector.rendering.timeout:25000}")
    private int timeoutMs;

    public record RenderedPage(String url, String title, String html, List<String> links) {}

    public boolean isEnabled() {
        return enabled;
    }

    public Mono<RenderedPage> render(String targetUrl) {
        if (!enabled) {
            return Mono.error(ToolExecutionException.unavailable("rendered-fetch", "Rendering service is disabled"));
        }
        String endpoint = baseUrl.endsWith("/") ? baseUrl + "crawl" : baseUrl + "/crawl";

        return webClient.get()
                .uri(uriBuilder -> {
                    URI uri = URI.create(endpoint);
                    return uriBuilder
                            .scheme(uri.getScheme())
                            .host(uri.getHost())
                            .port(uri.getPort())
                            .path(uri.getPath())
                            .queryParam("url", targetUrl)
                            .build();
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(Math.max(1000, timeoutMs)))
                .map(body -> parseResponse(targetUrl, body))
                .onErrorMap(e -> !(e instanceof ExtractionException),
                        e -> new FetchException(targetUrl, "Rendering failed for " + targetUrl + ": " + e.getMessage(), e));
    }

    /**
     * Accepts both the wrapped {@code {"result": {...}}} shape and a flat document.
     */
    RenderedPage parseResponse(String targetUrl, String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode result = node.has("result") ? node.get("result") : node;
            if (result.isArray() && !result.isEmpty()) {
                result = result.get(0);
            }

            String html = firstNonBlank(textOf(result, "html"), textOf(result, "cleaned_html"));
            if (html == null) {
                throw new ExtractionException("Rendering response for " + targetUrl + " has no html", null);
            }
            String title = textOf(result.path("metadata"), "title");

            List<String> links = new ArrayList<>();
            JsonNode linkNode = result.path("links");
            // Crawl4AI groups links as {"internal": [...], "external": [...]}
            JsonNode internal = linkNode.isObject() ? linkNode.path("internal") : linkNode;
            for (JsonNode link : internal) {
                String href = link.isTextual() ? link.asText() : textOf(link, "href");
                if (href != null) links.add(href);
            }
            return new RenderedPage(targetUrl, title, html, links);
        } catch (ExtractionException e) {
            throw e;
        } catch (Exception e) {
            throw new ExtractionException("Malformed rendering response for " + targetUrl, e);
        }
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private static String textOf(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        return v.isTextual() ? v.asText() : v.toString();
    }
}
