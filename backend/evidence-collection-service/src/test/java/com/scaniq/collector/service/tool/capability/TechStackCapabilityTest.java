package com.scaniq.collector.service.tool.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scaniq.collector.client.PageFetcher;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.dto.FetchedPage;
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
class TechStackCapabilityTest {

    private static final String URL = "https://acme.io/";

    @Mock
    private PageFetcher pageFetcher;

    @Test
    @DisplayName("reads technologies from content, headers and the generator tag")
    void detectsStack() {
        // given
        String html = "<html><head><meta name=\"generator\" content=\"WordPress 6.4\"></head>"
                + "<body>Built with React and PostgreSQL, deployed on AWS.</body></html>";
        when(pageFetcher.fetch(URL)).thenReturn(Mono.just(new FetchedPage(URL, URL, 200,
                Map.of("Server", "nginx", "CF-Ray", "8a1b", "X-Powered-By", "Express"), html)));
        TechStackCapability capability = new TechStackCapability(pageFetcher, new ContentExtractors(new ObjectMapper()));

        // when / then
        StepVerifier.create(capability.execute(URL, PageContext.initial(URL)))
                .assertNext(output -> {
                    assertThat(output.evidence()).extracting(EvidenceItem::type).containsExactlyInAnyOrder(
                            "frontend-framework", "database", "cloud-provider",
                            "web-server", "backend-language", "cdn", "cms");
                    assertThat(output.evidence())
                            .filteredOn(item -> item.type().equals("frontend-framework"))
                            .singleElement()
                            .satisfies(item -> assertThat(item.value().get(0).asText()).isEqualTo("react"));
                    assertThat(output.evidence())
                            .filteredOn(item -> item.type().equals("cms"))
                            .singleElement()
                            .satisfies(item -> assertThat(item.value().asText()).isEqualTo("WordPress 6.4"));
                })
                .verifyComplete();
    }
}
