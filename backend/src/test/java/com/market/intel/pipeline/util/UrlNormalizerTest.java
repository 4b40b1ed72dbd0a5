package com.market.intel.pipeline.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @Test
    void normalizeLowercasesHostAndDropsDefaultPortFragmentAndTrailingSlash() {
        assertThat(UrlNormalizer.normalize("HTTPS://Example.COM:443/Services/#team"))
            .isEqualTo("https://example.com/Services");
        assertThat(UrlNormalizer.normalize("http://example.com:80/"))
            .isEqualTo("http://example.com/");
    }

    @Test
    void normalizeAddsSchemeToBareHosts() {
        assertThat(UrlNormalizer.normalize("acme.io/about")).isEqualTo("https://acme.io/about");
    }

    @Test
    void normalizeRejectsUrlsWithoutHost() {
        assertThat(UrlNormalizer.normalize("http://")).isNull();
        assertThat(UrlNormalizer.normalize("   ")).isNull();
    }

    @Test
    void domainKeyStripsWwwAndKeepsExplicitPort() {
        assertThat(UrlNormalizer.domainKey("https://www.Acme.io/contact")).isEqualTo("acme.io");
        assertThat(UrlNormalizer.domainKey("http://localhost:8081/page")).isEqualTo("localhost:8081");
        assertThat(UrlNormalizer.domainKey("https://acme.io:443")).isEqualTo("acme.io");
    }

    @Test
    void sameHostIgnoresWwwPrefix() {
        assertThat(UrlNormalizer.sameHost("https://www.acme.io/a", "https://acme.io/b")).isTrue();
        assertThat(UrlNormalizer.sameHost("https://acme.io", "https://other.io")).isFalse();
    }
}
