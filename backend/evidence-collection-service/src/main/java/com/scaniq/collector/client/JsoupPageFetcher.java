package com.scaniq.collector.client;

import com.scaniq.collector.dto.FetchedPage;
import com.scaniq.collector.exception.FetchException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Direct HTTP fetch using Jsoup
 */
@Component
@Slf4j
public class JsoupPageFetcher implements PageFetcher {

    @Value("${collector.http.user-agent:ScanIQ-EvidenceCollector/1.0}")
    private String userAgent;

    @Value("${collector.http.timeout.read:30000}")
    private int readTimeoutMs;

    @Value("${collector.http.max-body-size:2097152}")
    private int maxBodySize;

    @Override
    public Mono<FetchedPage> fetch(String url) {
        return Mono.fromCallable(() -> {
                    Connection.Response res = Jsoup.connect(url)
                            .userAgent(userAgent)
                            .timeout(readTimeoutMs)
                            .followRedirects(true)
                            .ignoreHttpErrors(true)
                            .ignoreContentType(true)
                            .maxBodySize(maxBodySize)
                            .execute();

                    return new FetchedPage(url, res.url().toString(), res.statusCode(), res.headers(), res.body());
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(page -> log.debug("Fetched {} -> {} ({})", url, page.finalUrl(), page.statusCode()))
                .onErrorMap(e -> !(e instanceof FetchException),
                        e -> new FetchException(url, "Fetch failed for " + url + ": " + e.getMessage(), e));
    }
}
