package com.webmonkey.core.util;

import com.webmonkey.core.api.CrawlValidationException;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.OutputFormat;
import com.webmonkey.core.model.ScrapeAction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void load_fullFile() throws IOException {
        CrawlConfig cfg;
        try (InputStream in = getClass().getResourceAsStream("/crawl-test.yml")) {
            assertThat(in).isNotNull();
            cfg = YamlConfigLoader.load(in);
        }

        assertThat(cfg.getTarget()).isEqualTo("https://docs.example.com/start");
        assertThat(cfg.isFollowSubdomains()).isTrue();
        assertThat(cfg.getMinInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(cfg.getConcurrency()).isEqualTo(3);
        assertThat(cfg.getMaxDepth()).isEqualTo(4);
        assertThat(cfg.getMaxPages()).isEqualTo(50);
        assertThat(cfg.getIncludePattern()).isEqualTo("/start|/guide/");
        assertThat(cfg.getExcludePaths()).containsExactly("/guide/archive/", "re:\\.pdf$");
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("build/crawl-out"));
        assertThat(cfg.getOutputFormats()).containsExactly(
                OutputFormat.MARKDOWN, OutputFormat.JSON, OutputFormat.LINKS, OutputFormat.SCREENSHOT_FULL_PAGE);
        assertThat(cfg.getLinksFormat()).isEqualTo(CrawlConfig.LinksFormat.JSON);
        assertThat(cfg.isIncludeAssets()).isTrue();
        assertThat(cfg.getSettleDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(cfg.browser().isHeadless()).isFalse();
        assertThat(cfg.browser().getTimeoutMs()).isEqualTo(15_000);
        assertThat(cfg.browser().getViewportWidth()).isEqualTo(1280);

        List<ScrapeAction> actions = cfg.getActionsPerUrl().get("https://docs.example.com/start#top");
        assertThat(actions).extracting(ScrapeAction::getType).containsExactly(
                ScrapeAction.Type.WRITE, ScrapeAction.Type.PRESS, ScrapeAction.Type.WAIT, ScrapeAction.Type.CLICK);
        assertThat(actions.get(0).getText()).isEqualTo("install");
        assertThat(actions.get(1).getKey()).isEqualTo("ENTER");
        assertThat(actions.get(2).getMilliseconds()).isEqualTo(1500);
        assertThat(actions.get(3).getSelector()).isEqualTo("button.more");
    }

    @Test
    void emptyDocument_keepsDefaults_butLoadRequiresTarget() {
        CrawlConfig cfg = YamlConfigLoader.read(yaml(""));
        assertThat(cfg.getMaxDepth()).isEqualTo(2);
        assertThat(cfg.getOutputFormats()).containsExactly(OutputFormat.MARKDOWN);

        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("scope:\n  maxDepth: 1\n")))
                .isInstanceOf(CrawlValidationException.class)
                .hasMessageContaining("target");
    }

    @Test
    void commaSeparatedFormats_andUnknownFormatIsRejected() {
        CrawlConfig cfg = YamlConfigLoader.load(yaml(
                "target: https://ex.com/\noutput:\n  formats: \"markdown, rawHtml\"\n"));
        assertThat(cfg.getOutputFormats()).containsExactly(OutputFormat.MARKDOWN, OutputFormat.RAW_HTML);

        assertThatThrownBy(() -> YamlConfigLoader.load(yaml(
                "target: https://ex.com/\noutput:\n  formats: [markdown, pdf]\n")))
                .isInstanceOf(CrawlValidationException.class)
                .satisfies(e -> assertThat(((CrawlValidationException) e).getField()).isEqualTo("outputFormats"));
    }

    @Test
    void badValues_areValidationErrors() {
        assertThatThrownBy(() -> YamlConfigLoader.read(yaml("scope:\n  maxDepth: deep\n")))
                .isInstanceOf(CrawlValidationException.class);
        assertThatThrownBy(() -> YamlConfigLoader.read(yaml("output:\n  linksFormat: xml\n")))
                .isInstanceOf(CrawlValidationException.class);
        assertThatThrownBy(() -> YamlConfigLoader.read(yaml(
                "actions:\n  \"https://ex.com/\":\n    - { type: hover, selector: a }\n")))
                .isInstanceOf(CrawlValidationException.class)
                .hasMessageContaining("hover");
    }

    @Test
    void missingFile_isIOException(@TempDir Path tmp) {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void readFromPath(@TempDir Path tmp) throws IOException {
        Path f = tmp.resolve("crawl.yml");
        Files.writeString(f, "target: https://ex.com/\nrateLimitSeconds: 0\n");
        CrawlConfig cfg = YamlConfigLoader.load(f);
        assertThat(cfg.getMinInterval()).isEqualTo(Duration.ZERO);
    }
}
