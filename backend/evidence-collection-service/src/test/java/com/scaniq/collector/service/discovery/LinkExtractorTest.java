package com.scaniq.collector.service.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LinkExtractorTest {

    private final LinkExtractor extractor = new LinkExtractor();

    @Test
    @DisplayName("extracts and resolves same-domain links")
    void extractsLinks() {
        String html = """
                <a href="/about">About</a>
                <a href="team">Team</a>
                <a href="//acme.io/careers">Careers</a>
                <a href="https://blog.acme.io/post">Blog</a>
                <a href="https://other.com/x">Elsewhere</a>
                <a href="mailto:hi@acme.io">Mail</a>
                <a href="/pricing#plans">Plans</a>
                <img src="/logo.png">
                <div style="background: url('/hero')"></div>
                <p>Docs at https://acme.io/docs/start</p>
                """;

        Set<String> links = extractor.extract(html, "https://acme.io/company/", "acme.io");

        assertThat(links).containsExactlyInAnyOrder(
                "https://acme.io/about",
                "https://acme.io/company/team",
                "https://acme.io/careers",
                "https://blog.acme.io/post",
                "https://acme.io/hero",
                "https://acme.io/docs/start");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "https://acme.io/logo.png",
            "https://acme.io/whitepaper.pdf",
            "https://acme.io/assets/app.js",
            "https://acme.io/style.css",
            "https://acme.io/wp-content/uploads/a",
            "https://acme.io/fonts/inter.woff2",
            "ftp://acme.io/file",
            "https://acme.io.evil.com/",
            "https://acme.io/a#b"
    })
    @DisplayName("rejects assets, fragments and foreign hosts")
    void rejects(String url) {
        assertThat(extractor.isAcceptable(url, "acme.io")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"https://acme.io/", "http://www.acme.io/team", "https://docs.acme.io/v1.2/intro"})
    @DisplayName("accepts pages on the domain, www and subdomains")
    void accepts(String url) {
        assertThat(extractor.isAcceptable(url, "acme.io")).isTrue();
    }
}
