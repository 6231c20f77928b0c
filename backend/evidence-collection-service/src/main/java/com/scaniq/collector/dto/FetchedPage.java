package com.scaniq.collector.dto;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raw HTTP response of a page fetch. Header names are stored lower-cased.
 */
public record FetchedPage(
        String requestedUrl,
        String finalUrl,
        int statusCode,
        Map<String, String> headers,
        String body
) {
    public FetchedPage {
        headers = headers == null ? Map.of() : headers.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        e -> e.getKey().toLowerCase(Locale.ROOT),
                        Map.Entry::getValue,
                        (a, b) -> a));
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean hasHeader(String name) {
        return headers.containsKey(name.toLowerCase(Locale.ROOT));
    }
}
