package com.scaniq.collector.service.discovery;

import com.scaniq.collector.client.PageFetcher;
import com.scaniq.collector.config.EvidenceCollectionConfig;
import com.scaniq.collector.dto.FetchedPage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Breadth-first discovery of a domain's pages.
 *
 * Seeds are the https and http roots followed by the configured important paths. Each batch of
 * queued URLs is fetched in parallel; responses are absorbed one by one in queue order as they
 * arrive, so the queue and the discovered set are only touched from a single thread at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UrlDiscoveryService {

    private final PageFetcher pageFetcher;
    private final LinkExtractor linkExtractor;
    private final EvidenceCollectionConfig config;

    public Mono<List<String>> discover(String domain, int maxUrls) {
        return discover(domain, maxUrls, url -> { });
    }

    /**
     * Same as {@link #discover(String, int)}, handing each page to {@code onDiscovered} as soon as
     * it is confirmed. A caller that cancels the discovery keeps every URL it was handed.
     */
    public Mono<List<String>> discover(String domain, int maxUrls, Consumer<String> onDiscovered) {
        return Mono.defer(() -> {
            DiscoveryState state = new DiscoveryState(seeds(domain), onDiscovered);
            return drain(state, domain, maxUrls)
                    .then(Mono.fromSupplier(() -> {
                        log.info("Discovered {} URLs for {} ({} fetched)", state.discovered.size(), domain, state.fetched);
                        return List.copyOf(state.discovered);
                    }));
        });
    }

    List<String> seeds(String domain) {
        List<String> seeds = new ArrayList<>();
        seeds.add("https://" + domain);
        seeds.add("http://" + domain);
        for (String path : config.getDiscovery().getImportantPaths()) {
            seeds.add("https://" + domain + (path.startsWith("/") ? path : "/" + path));
        }
        return seeds;
    }

    private Mono<Void> drain(DiscoveryState state, String domain, int maxUrls) {
        if (state.queue.isEmpty() || state.discovered.size() >= maxUrls) {
            return Mono.empty();
        }
        int concurrency = Math.max(1, config.getDiscovery().getConcurrency());
        List<String> batch = state.nextBatch(concurrency);

        return Flux.fromIterable(batch)
                .flatMapSequential(url -> pageFetcher.fetch(url)
                        .map(Optional::of)
                        .onErrorResume(e -> {
                            log.debug("Discovery fetch failed for {}: {}", url, e.getMessage());
                            return Mono.just(Optional.empty());
                        }), concurrency)
                .doOnNext(page -> page.ifPresent(p -> absorb(state, p, domain, maxUrls)))
                .then(Mono.defer(() -> drain(state, domain, maxUrls)));
    }

    private void absorb(DiscoveryState state, FetchedPage page, String domain, int maxUrls) {
        state.fetched++;
        if (!page.isSuccessful()) {
            log.debug("Discovery skipped {} (status {})", page.requestedUrl(), page.statusCode());
            return;
        }
        String finalUrl = page.finalUrl() != null ? page.finalUrl() : page.requestedUrl();
        if (!LinkExtractor.isSameDomain(hostOf(finalUrl), domain)) {
            log.debug("Discovery skipped off-domain redirect {} -> {}", page.requestedUrl(), finalUrl);
            return;
        }
        if (state.discovered.size() < maxUrls && state.discovered.add(finalUrl)) {
            state.onDiscovered.accept(finalUrl);
        }
        state.visited.add(finalUrl);

        for (String link : linkExtractor.extract(page.body(), finalUrl, domain)) {
            if (state.visited.add(link)) {
                state.queue.add(link);
            }
        }
    }

    private static String hostOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static final class DiscoveryState {
        private final Deque<String> queue = new ArrayDeque<>();
        private final Set<String> visited = new HashSet<>();
        private final Set<String> discovered = new LinkedHashSet<>();
        private final Consumer<String> onDiscovered;
        private int fetched;

        private DiscoveryState(List<String> seeds, Consumer<String> onDiscovered) {
            this.onDiscovered = onDiscovered;
            for (String seed : seeds) {
                if (visited.add(seed)) queue.add(seed);
            }
        }

        private List<String> nextBatch(int size) {
            List<String> batch = new ArrayList<>(size);
            while (batch.size() < size && !queue.isEmpty()) {
                batch.add(queue.poll());
            }
            return batch;
        }
    }
}
