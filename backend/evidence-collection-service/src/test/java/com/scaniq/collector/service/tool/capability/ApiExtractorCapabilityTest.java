package com.scaniq.collector.service.tool.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scaniq.collector.client.PageFetcher;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.FetchedPage;
import com.scaniq.collector.service.decision.PageCharacteristics;
import com.scaniq.collector.service.decision.PageContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApiExtractorCapabilityTest {

    private static final String URL = "https://acme.io/docs";

    @Mock
    private PageFetcher pageFetcher;

    @Test
    @DisplayName("extracts endpoints, doc formats, auth schemes and rate limits")
    void extractsApiSurface() {
        // given
        String html = "<html><body><div id=\"swagger-ui\"></div>"
                + "<a href=\"/api/v1/users\">Users</a> <a href=\"/api/v1/orders\">Orders</a>"
                + "<p>Authenticate with OAuth 2.0 or an API key.</p>"
                + "<p>Limits: 1000 requests per minute.</p></body></html>";
        when(pageFetcher.fetch(URL)).thenReturn(Mono.just(new FetchedPage(URL, URL, 200, Map.of(), html)));
        ApiExtractorCapability capability = new ApiExtractorCapability(pageFetcher, new ContentExtractors(new ObjectMapper()));

        // when / then
        StepVerifier.create(capability.execute(URL, PageContext.initial(URL)))
                .assertNext(output -> {
                    assertThat(output.evidence()).extracting(EvidenceItem::type).containsExactly(
                            "api-endpoints", "api-documentation", "api-auth", "api-rate-limit");
                    assertThat(output.evidence().get(0).value()).hasSize(2);
                    assertThat(output.evidence().get(2).value().toString()).contains("oauth2", "api-key");
                    assertThat(output.evidence().get(3).value().asText()).isEqualTo("1000 requests per minute");
                    assertThat(output.characteristics()).containsEntry(PageCharacteristics.HAS_API_REFERENCES, true);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("falls back to the rate limit header")
    void rateLimitHeader() {
        when(pageFetcher.fetch(URL)).thenReturn(Mono.just(new FetchedPage(URL, URL, 200,
                Map.of("X-RateLimit-Limit", "500"), "<p>Reference</p>")));
        ApiExtractorCapability capability = new ApiExtractorCapability(pageFetcher, new ContentExtractors(new ObjectMapper()));

        StepVerifier.create(capability.execute(URL, PageContext.initial(URL)))
                .assertNext(output -> assertThat(output.evidence()).singleElement()
                        .satisfies(item -> assertThat(item.value().asText()).isEqualTo("x-ratelimit-limit: 500")))
                .verifyComplete();
    }
}
