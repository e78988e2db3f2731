package com.webmonkey.core.util;

import com.webmonkey.core.model.CanonicalUrl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class UrlCanonicalizerTest {

    private static String c(String raw) {
        CanonicalUrl u = UrlCanonicalizer.canonicalize(raw);
        return u == null ? null : u.toString();
    }

    private static String c(String raw, String base) {
        CanonicalUrl u = UrlCanonicalizer.canonicalize(raw, base);
        return u == null ? null : u.toString();
    }

    @Test
    @DisplayName("scheme/host 소문자, 기본 포트 제거, fragment 제거, path/query 보존")
    void basicNormalization() {
        assertThat(c("HTTP://Example.COM:80/Docs/Page?Q=1#frag")).isEqualTo("http://example.com/Docs/Page?Q=1");
        assertThat(c("https://ex.com:443/a")).isEqualTo("https://ex.com/a");
        assertThat(c("https://ex.com:8443/a")).isEqualTo("https://ex.com:8443/a");
        assertThat(c("https://ex.com")).isEqualTo("https://ex.com/");
        assertThat(c("  https://ex.com/a b  ")).isEqualTo("https://ex.com/a%20b");
    }

    @Test
    void relativeReferences_resolveAgainstBase() {
        assertThat(c("../c?q=1", "https://ex.com/a/b/")).isEqualTo("https://ex.com/a/c?q=1");
        assertThat(c("/p", "http://a.com")).isEqualTo("http://a.com/p");
        assertThat(c("child", "https://ex.com/home/")).isEqualTo("https://ex.com/home/child");
        assertThat(c("?x=1", "https://ex.com/a/b")).isEqualTo("https://ex.com/a/b?x=1");
        assertThat(c("//cdn.ex.com/x.js", "https://ex.com/")).isEqualTo("https://cdn.ex.com/x.js");
    }

    @Test
    void relativeWithoutBase_isRejected() {
        assertThat(c("/only/path")).isNull();
        assertThat(c("page.html", "not a base")).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"javascript:void(0)", "JavaScript:alert(1)", "mailto:a@b.c", "tel:+821012345678",
            "data:text/plain,hi", "#top", "", "   ", "ftp://ex.com/file"})
    void nonCrawlableReferences_areRejected(String raw) {
        assertThat(c(raw, "https://ex.com/")).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"HTTP://Ex.com:80/A/b?x=Y#f", "https://ex.com", "https://ex.com/a%20b?q=a+b",
            "http://ex.com:8080/p/"})
    void canonicalize_isIdempotent(String raw) {
        String once = c(raw);
        assertThat(once).isNotNull();
        assertThat(c(once)).isEqualTo(once);
    }

    @Test
    void equalityIsByCanonicalString() {
        assertThat(UrlCanonicalizer.canonicalize("https://EX.com/a#x"))
                .isEqualTo(UrlCanonicalizer.canonicalize("https://ex.com:443/a"));
    }

    @Test
    void hostPolicies() {
        CanonicalUrl seed = UrlCanonicalizer.canonicalize("https://ex.com/");
        assertThat(UrlCanonicalizer.sameHost(seed, UrlCanonicalizer.canonicalize("https://EX.com/z"))).isTrue();
        assertThat(UrlCanonicalizer.sameHost(seed, UrlCanonicalizer.canonicalize("https://blog.ex.com/"))).isFalse();

        assertThat(UrlCanonicalizer.isSubdomainOf("blog.ex.com", "ex.com")).isTrue();
        assertThat(UrlCanonicalizer.isSubdomainOf("ex.com", "ex.com")).isFalse();
        assertThat(UrlCanonicalizer.isSubdomainOf("badex.com", "ex.com")).isFalse();
    }
}
