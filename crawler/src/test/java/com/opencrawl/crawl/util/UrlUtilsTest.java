package com.opencrawl.crawl.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    @Test
    void acceptsOnlyAbsoluteHttpUrls() {
        assertThat(UrlUtils.toHttpUri("https://example.com/a")).isNotNull();
        assertThat(UrlUtils.toHttpUri("/relative")).isNull();
        assertThat(UrlUtils.toHttpUri("ftp://example.com/")).isNull();
        assertThat(UrlUtils.toHttpUri("https:///no-host")).isNull();
        assertThat(UrlUtils.toHttpUri(null)).isNull();
    }

    @Test
    void appendsEncodedParamsBeforeFragment() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", "crawler tips");
        params.put("page", "2");

        assertThat(UrlUtils.appendQueryParams("https://example.com/search#top", params))
            .isEqualTo("https://example.com/search?q=crawler+tips&page=2#top");
        assertThat(UrlUtils.appendQueryParams("https://example.com/search?lang=en", Map.of("page", "3")))
            .isEqualTo("https://example.com/search?lang=en&page=3");
    }
}
