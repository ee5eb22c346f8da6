package com.apisite.checker.probe.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateUrlBuilderTest {

    @Test
    void buildsVariantsInPreferenceOrderEndingWithBaseUrl() {
        assertThat(CandidateUrlBuilder.candidates("https://example.com/api.php/provide/vod/"))
            .containsExactly(
                "https://example.com/api.php/provide/vod/?ac=detail&pg=1",
                "https://example.com/api.php/provide/vod/?ac=list&pg=1",
                "https://example.com/api.php/provide/vod/?limit=1",
                "https://example.com/api.php/provide/vod/"
            );
    }

    @Test
    void appendsToExistingQueryString() {
        assertThat(CandidateUrlBuilder.candidates("https://example.com/api?type=json"))
            .containsExactly(
                "https://example.com/api?type=json&ac=detail&pg=1",
                "https://example.com/api?type=json&ac=list&pg=1",
                "https://example.com/api?type=json&limit=1",
                "https://example.com/api?type=json"
            );
    }

    @Test
    void doesNotDoubleTrailingSeparator() {
        assertThat(CandidateUrlBuilder.appendQuery("https://example.com/api?", "limit=1"))
            .isEqualTo("https://example.com/api?limit=1");
        assertThat(CandidateUrlBuilder.appendQuery("https://example.com/api?a=1&", "limit=1"))
            .isEqualTo("https://example.com/api?a=1&limit=1");
    }

    @Test
    void trimsBaseUrl() {
        assertThat(CandidateUrlBuilder.candidates("  https://example.com/api  ")).last()
            .isEqualTo("https://example.com/api");
    }
}
