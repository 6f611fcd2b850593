package dev.jobtracker.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    @Test
    @DisplayName("Should accept only absolute http(s) URLs with a host")
    void shouldValidateAbsoluteHttpUrls() {
        assertThat(UrlUtils.isAbsoluteHttpUrl("https://acme.example/careers")).isTrue();
        assertThat(UrlUtils.isAbsoluteHttpUrl("HTTP://acme.example")).isTrue();
        assertThat(UrlUtils.isAbsoluteHttpUrl("/careers")).isFalse();
        assertThat(UrlUtils.isAbsoluteHttpUrl("ftp://acme.example/file")).isFalse();
        assertThat(UrlUtils.isAbsoluteHttpUrl("https:///nohost")).isFalse();
        assertThat(UrlUtils.isAbsoluteHttpUrl("not a url")).isFalse();
        assertThat(UrlUtils.isAbsoluteHttpUrl(null)).isFalse();
    }

    @Test
    @DisplayName("Should resolve relative links against the page URL")
    void shouldResolveRelativeLinks() {
        String base = "https://acme.example/careers/index.html";

        assertThat(UrlUtils.resolve(base, "/jobs/1")).isEqualTo("https://acme.example/jobs/1");
        assertThat(UrlUtils.resolve(base, "engineer")).isEqualTo("https://acme.example/careers/engineer");
        assertThat(UrlUtils.resolve(base, "https://other.example/x")).isEqualTo("https://other.example/x");
    }

    @Test
    @DisplayName("Should discard unusable links")
    void shouldDiscardUnusableLinks() {
        assertThat(UrlUtils.resolve("https://acme.example", "mailto:jobs@acme.example")).isNull();
        assertThat(UrlUtils.resolve("https://acme.example", "javascript:void(0)")).isNull();
        assertThat(UrlUtils.resolve("https://acme.example", "")).isNull();
        assertThat(UrlUtils.resolve(null, "/jobs/1")).isNull();
    }

    @Test
    @DisplayName("Should canonicalize URLs for comparison")
    void shouldCanonicalize() {
        assertThat(UrlUtils.canonicalForm("https://Acme.example/Jobs/1/#top")).isEqualTo("https://acme.example/jobs/1");
    }

    @Test
    @DisplayName("Should extract the host")
    void shouldExtractHost() {
        assertThat(UrlUtils.hostOf("https://careers.acme.example/jobs")).isEqualTo("careers.acme.example");
        assertThat(UrlUtils.hostOf("::bad")).isNull();
    }
}
