package com.scaniq.collector.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scaniq.collector.dto.SearchHit;
import com.scaniq.collector.exception.ExtractionException;
import com.scaniq.collector.exception.FetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the Brave Search web API.
 * Without an API key every query completes empty, so collection still runs on crawling alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BraveSearchClient implements SearchProvider {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${collector.search.brave.base-url:https://api.search.brave.com/res/v1/web/search}")
    private String baseUrl;

    @Value("${collector.search.brave.api-key:}")
    private String apiKey;

    @Value("${collector.search.brave.timeout:15000}")
    private int timeoutMs;

    @Override
    public Mono<List<SearchHit>> search(String query, int limit) {
        if (!isAvailable()) {
            log.debug("Brave search not configured, skipping query: {}", query);
            return Mono.just(List.of());
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("q", query)
                .queryParam("count", Math.max(1, Math.min(limit, 20)))
                .encode()
                .build()
                .toUri();

        return webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .header("X-Subscription-Token", apiKey)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(timeoutMs))
                .map(body -> parseResults(body, limit))
                .defaultIfEmpty(List.of())
                .onErrorMap(e -> !(e instanceof ExtractionException),
                        e -> new FetchException(baseUrl, "Brave search failed for '" + query + "': " + e.getMessage(), e));
    }

    /**
     * Reads {@code web.results[]} of a Brave response body.
     */
    List<SearchHit> parseResults(String body, int limit) {
        try {
            JsonNode results = objectMapper.readTree(body).path("web").path("results");
            List<SearchHit> hits = new ArrayList<>();
            for (JsonNode node : results) {
                if (hits.size() >= limit) break;
                String url = node.path("url").asText(null);
                if (url == null || url.isBlank()) continue;
                hits.add(new SearchHit(
                        node.path("title").asText(""),
                        url,
                        node.path("description").asText("")));
            }
            return hits;
        } catch (Exception e) {
            throw new ExtractionException("Malformed Brave search response", e);
        }
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String getName() {
        return "brave";
    }
}
