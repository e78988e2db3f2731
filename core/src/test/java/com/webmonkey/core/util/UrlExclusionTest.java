package com.webmonkey.core.util;

import com.webmonkey.core.model.CanonicalUrl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("UrlExclusion (prefix, glob, regex) on canonical URLs")
class UrlExclusionTest {

    private static CanonicalUrl url(String pathAndQuery) {
        // 항상 정규화된 전체 URL 로 검사한다
        String p = pathAndQuery.startsWith("/") ? pathAndQuery : "/" + pathAndQuery;
        return UrlCanonicalizer.canonicalize("https://ex.com" + p);
    }

    @Nested
    @DisplayName("PREFIX rules")
    class PrefixRules {
        @Test
        @DisplayName("'/admin': /admin, /admin/panel, /administrator excluded")
        void prefix_admin() {
            var rules = List.of("/admin");
            assertTrue(UrlExclusion.isExcluded(url("/admin"), rules));
            assertTrue(UrlExclusion.isExcluded(url("/admin/panel"), rules));
            assertTrue(UrlExclusion.isExcluded(url("/administrator"), rules));
            assertFalse(UrlExclusion.isExcluded(url("/docs/admin"), rules));
        }

        @Test
        @DisplayName("'/static/': /static/a.css excluded ; /statics/a.css kept")
        void prefix_staticSlash() {
            var rules = List.of("/static/");
            assertTrue(UrlExclusion.isExcluded(url("/static/a.css"), rules));
            assertFalse(UrlExclusion.isExcluded(url("/statics/a.css"), rules));
        }

        @Test
        @DisplayName("absolute prefix matches the whole canonical URL")
        void prefix_absolute() {
            var rules = List.of("https://ex.com/private");
            assertTrue(UrlExclusion.isExcluded(url("/private/x"), rules));
            assertFalse(UrlExclusion.isExcluded(url("/public/private"), rules));
        }
    }

    @Nested
    @DisplayName("GLOB rules ('*' within a segment, '**' across segments)")
    class GlobRules {
        @Test
        void glob_logoutAnywhere() {
            var rules = List.of("*/logout*");
            assertTrue(UrlExclusion.isExcluded(url("/logout"), rules));
            assertTrue(UrlExclusion.isExcluded(url("/account/logout?next=/"), rules));
            assertFalse(UrlExclusion.isExcluded(url("/login"), rules));
        }

        @Test
        void glob_singleStar_staysInSegment() {
            var rules = List.of("ex.com/admin/*.html");
            assertTrue(UrlExclusion.isExcluded(url("/admin/index.html"), rules));
            assertFalse(UrlExclusion.isExcluded(url("/admin/deep/index.html"), rules));
        }

        @Test
        void glob_doubleStar_crossesSegments() {
            var rules = List.of("**/private/**");
            assertTrue(UrlExclusion.isExcluded(url("/a/b/private/c/d"), rules));
            assertFalse(UrlExclusion.isExcluded(url("/a/b/public/c"), rules));
        }
    }

    @Nested
    @DisplayName("REGEX rules ('re:' prefix, case-insensitive)")
    class RegexRules {
        @Test
        void regex_pdfSuffix() {
            var rules = List.of("re:\\.pdf$");
            assertTrue(UrlExclusion.isExcluded(url("/files/Report.PDF"), rules));
            assertFalse(UrlExclusion.isExcluded(url("/files/report.pdf.html"), rules));
        }

        @Test
        void regex_tokenQuery() {
            var rules = List.of("re:[?&]token=");
            assertTrue(UrlExclusion.isExcluded(url("/x?a=1&token=abc"), rules));
            assertFalse(UrlExclusion.isExcluded(url("/x?a=1"), rules));
        }
    }

    @Test
    void emptyOrBlankRules_excludeNothing() {
        assertFalse(UrlExclusion.isExcluded(url("/a"), List.of()));
        assertFalse(UrlExclusion.isExcluded(url("/a"), List.of("", "  ")));
        assertFalse(UrlExclusion.isExcluded(null, List.of("/a")));
    }
}
