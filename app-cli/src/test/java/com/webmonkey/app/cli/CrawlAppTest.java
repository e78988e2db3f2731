package com.webmonkey.app.cli;

import com.webmonkey.core.api.CrawlValidationException;
import com.webmonkey.core.driver.BrowserDriver;
import com.webmonkey.core.driver.DriverException;
import com.webmonkey.core.driver.DriverFactory;
import com.webmonkey.core.driver.ElementHandle;
import com.webmonkey.core.driver.ElementNotFoundException;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.OutputFormat;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlAppTest {

    @TempDir
    Path tmp;

    private static CrawlConfig parse(String... args) throws Exception {
        CommandLine cmd = new DefaultParser().parse(CrawlApp.options(), args);
        return CrawlApp.toConfig(cmd);
    }

    @Test
    void toConfig_optionsOverrideDefaults() throws Exception {
        CrawlConfig cfg = parse("-u", "https://ex.com/", "-d", "3", "-p", "20", "-r", "0.5", "-n", "2",
                "-f", "markdown, links", "-o", tmp.toString(), "-i", "/docs/",
                "-x", "/private/**", "-x", "re:\\.pdf$", "--links-format", "json",
                "--subdomains", "--headed");

        assertThat(cfg.getTarget()).isEqualTo("https://ex.com/");
        assertThat(cfg.getMaxDepth()).isEqualTo(3);
        assertThat(cfg.getMaxPages()).isEqualTo(20);
        assertThat(cfg.getMinInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(cfg.getConcurrency()).isEqualTo(2);
        assertThat(cfg.getOutputFormats()).containsExactly(OutputFormat.MARKDOWN, OutputFormat.LINKS);
        assertThat(cfg.getOutputDir()).isEqualTo(tmp);
        assertThat(cfg.getIncludePattern()).isEqualTo("/docs/");
        assertThat(cfg.getExcludePaths()).containsExactly("/private/**", "re:\\.pdf$");
        assertThat(cfg.getLinksFormat()).isEqualTo(CrawlConfig.LinksFormat.JSON);
        assertThat(cfg.isSameDomainOnly()).isTrue();
        assertThat(cfg.isFollowSubdomains()).isTrue();
        assertThat(cfg.browser().isHeadless()).isFalse();
    }

    @Test
    void toConfig_positionalSeed() throws Exception {
        CrawlConfig cfg = parse("https://ex.com/start", "--all-domains");
        assertThat(cfg.getTarget()).isEqualTo("https://ex.com/start");
        assertThat(cfg.isSameDomainOnly()).isFalse();
    }

    @Test
    void toConfig_yamlWithoutTarget_takesSeedFromCommandLine() throws Exception {
        Path yml = tmp.resolve("site.yml");
        Files.writeString(yml, String.join("\n",
                "scope:",
                "  maxDepth: 5",
                "output:",
                "  formats: [json]",
                ""));

        CrawlConfig cfg = parse("-c", yml.toString(), "-u", "https://ex.com/");

        assertThat(cfg.getTarget()).isEqualTo("https://ex.com/");
        assertThat(cfg.getMaxDepth()).isEqualTo(5);
        assertThat(cfg.getOutputFormats()).containsExactly(OutputFormat.JSON);
    }

    @Test
    void toConfig_badLinksFormat_isValidationError() {
        assertThatThrownBy(() -> parse("-u", "https://ex.com/", "--links-format", "xml"))
                .isInstanceOf(CrawlValidationException.class)
                .hasMessageContaining("xml");
    }

    @Test
    void run_exitCodes() {
        assertThat(CrawlApp.run(new String[]{"-h"}, null)).isEqualTo(CrawlApp.EXIT_OK);
        assertThat(CrawlApp.run(new String[]{"--bogus"}, null)).isEqualTo(CrawlApp.EXIT_USAGE);
        assertThat(CrawlApp.run(new String[]{"-u", "https://ex.com/", "-d", "abc"}, null))
                .isEqualTo(CrawlApp.EXIT_USAGE);
        assertThat(CrawlApp.run(new String[]{"-u", "ftp://ex.com/"}, null)).isEqualTo(CrawlApp.EXIT_INVALID);
        assertThat(CrawlApp.run(new String[]{"-u", "https://ex.com/", "-f", "pdf"}, null))
                .isEqualTo(CrawlApp.EXIT_INVALID);
        assertThat(CrawlApp.run(new String[]{"-u", "https://ex.com/", "-f", "screenshot,screenshot@fullPage"}, null))
                .isEqualTo(CrawlApp.EXIT_INVALID);
        assertThat(CrawlApp.run(new String[]{"-c", tmp.resolve("missing.yml").toString()}, null))
                .isEqualTo(CrawlApp.EXIT_USAGE);
    }

    @Test
    void run_crawlsAndWritesFiles() throws Exception {
        Map<String, String> site = Map.of(
                "https://ex.com/", "<html><head><title>Home</title></head><body>"
                        + "<h1>Home</h1><p>Welcome home</p><a href=\"/about\">About</a></body></html>",
                "https://ex.com/about", "<html><body><h1>About</h1><p>About us</p></body></html>");

        int code = CrawlApp.run(new String[]{
                "-u", "https://ex.com/", "-r", "0", "-d", "1", "-o", tmp.toString(), "-f", "markdown,links"},
                new MapSite(site));

        assertThat(code).isEqualTo(CrawlApp.EXIT_OK);
        Path host = tmp.resolve("ex.com");
        assertThat(Files.readString(host.resolve("markdown/index.md"))).contains("# **Home**");
        assertThat(Files.readString(host.resolve("markdown/about.md"))).contains("# **About**");
        assertThat(Files.readString(host.resolve("links/index.txt"))).isEqualTo("https://ex.com/about");
        try (Stream<Path> files = Files.list(host)) {
            List<String> names = files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
            assertThat(names).anyMatch(n -> n.startsWith("crawl-") && n.endsWith(".json"));
        }
    }

    /** 고정 HTML 맵을 돌려주는 최소 드라이버 */
    private static final class MapSite implements DriverFactory {
        private final Map<String, String> pages;

        MapSite(Map<String, String> pages) { this.pages = pages; }

        @Override public BrowserDriver open() {
            return new BrowserDriver() {
                private String current;

                @Override public void navigate(String url) {
                    if (!pages.containsKey(url)) throw new DriverException("net::ERR_NAME_NOT_RESOLVED at " + url);
                    current = url;
                }
                @Override public String currentUrl() { return current; }
                @Override public String pageSource() { return current == null ? "" : pages.get(current); }
                @Override public Object executeScript(String js) { return null; }
                @Override public void scrollTo(int y) { }
                @Override public byte[] captureViewport() { return new byte[0]; }
                @Override public ElementHandle findElement(String cssSelector) {
                    throw new ElementNotFoundException(cssSelector);
                }
                @Override public void pressKey(String key) { }
                @Override public void close() { }
            };
        }
    }
}
