package com.webmonkey.core.model;

import com.webmonkey.core.api.CrawlValidationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlConfigTest {

    private static String fieldOf(Runnable r) {
        try {
            r.run();
        } catch (CrawlValidationException e) {
            return e.getField();
        }
        throw new AssertionError("expected CrawlValidationException");
    }

    @Test
    void defaultsAreValid() {
        CrawlConfig cfg = CrawlConfig.defaults().setTarget("https://example.com");
        cfg.validate();

        assertThat(cfg.getMaxDepth()).isEqualTo(2);
        assertThat(cfg.isSameDomainOnly()).isTrue();
        assertThat(cfg.isFollowSubdomains()).isFalse();
        assertThat(cfg.getMaxPages()).isZero();
        assertThat(cfg.getMinInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(cfg.getConcurrency()).isEqualTo(1);
        assertThat(cfg.getOutputFormats()).containsExactly(OutputFormat.MARKDOWN);
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("out"));
        assertThat(cfg.getLinksFormat()).isEqualTo(CrawlConfig.LinksFormat.TXT);
        assertThat(cfg.browser().isHeadless()).isTrue();
    }

    @Test
    void validateRejectsBadSeed() {
        assertThat(fieldOf(() -> CrawlConfig.defaults().validate())).isEqualTo("target");
        assertThat(fieldOf(() -> CrawlConfig.defaults().setTarget("ftp://ex.com/").validate())).isEqualTo("target");
        assertThat(fieldOf(() -> CrawlConfig.defaults().setTarget("/relative").validate())).isEqualTo("target");
        assertThat(fieldOf(() -> CrawlConfig.defaults().setTarget("http://bad host/").validate())).isEqualTo("target");
    }

    @Test
    void validateRejectsBadScopeAndScheduling() {
        assertThat(fieldOf(() -> base().setMaxDepth(-1).validate())).isEqualTo("maxDepth");
        assertThat(fieldOf(() -> base().setMaxPages(-3).validate())).isEqualTo("maxPages");
        assertThat(fieldOf(() -> base().setConcurrency(0).validate())).isEqualTo("concurrency");
        assertThat(fieldOf(() -> base().setIncludePattern("[").validate())).isEqualTo("includePattern");
        assertThat(fieldOf(() -> base().setRateLimitSeconds(-1))).isEqualTo("rateLimit");
        assertThat(fieldOf(() -> base().setOutputFormatNames(List.of("markdown", "pdf")))).isEqualTo("outputFormats");
    }

    @Test
    void rateLimitSeconds_acceptsFractions() {
        CrawlConfig cfg = base().setRateLimitSeconds(0.5);
        assertThat(cfg.getMinInterval()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void outputFormatNames_areCaseInsensitive_andDeduplicated() {
        CrawlConfig cfg = base().setOutputFormatNames(List.of("Markdown", "rawhtml", "markdown", "screenshot@fullPage"));
        assertThat(cfg.getOutputFormats())
                .containsExactly(OutputFormat.MARKDOWN, OutputFormat.RAW_HTML, OutputFormat.SCREENSHOT_FULL_PAGE);
        assertThat(OutputFormat.SCREENSHOT_FULL_PAGE.resultKey()).isEqualTo("screenshot");
    }

    @Test
    void bothScreenshotModes_areRejected() {
        CrawlConfig cfg = base().setOutputFormatNames(List.of("markdown", "screenshot", "screenshot@fullPage"));
        assertThat(fieldOf(cfg::validate)).isEqualTo("outputFormats");

        base().setOutputFormatNames(List.of("screenshot")).validate();
        base().setOutputFormatNames(List.of("screenshot@fullPage")).validate();
    }

    @Test
    void blankIncludePattern_meansNoFilter() {
        assertThat(base().setIncludePattern("  ").getIncludePattern()).isNull();
    }

    private static CrawlConfig base() {
        return CrawlConfig.defaults().setTarget("https://example.com/");
    }
}
