package com.scaniq.collector.client;

import com.scaniq.collector.dto.FetchedPage;
import reactor.core.publisher.Mono;

/**
 * Fetches a page following redirects. Non-2xx responses are returned, not raised;
 * network failures surface as {@link com.scaniq.collector.exception.FetchException}.
 */
public interface PageFetcher {

    Mono<FetchedPage> fetch(String url);
}
