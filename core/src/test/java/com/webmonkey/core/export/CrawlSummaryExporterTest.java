package com.webmonkey.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.webmonkey.core.model.CanonicalUrl;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.CrawlResult;
import com.webmonkey.core.model.PageResult;
import com.webmonkey.core.util.Jsons;
import com.webmonkey.core.util.UrlCanonicalizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlSummaryExporterTest {

    @TempDir
    Path dir;

    @Test
    void export_writesMetaStatsAndPages() throws Exception {
        CanonicalUrl seed = UrlCanonicalizer.canonicalize("https://ex.com/");
        CanonicalUrl bad = UrlCanonicalizer.canonicalize("https://ex.com/broken");

        CrawlResult result = new CrawlResult(seed);
        result.put(seed, PageResult.builder(seed.toString(), 0)
                .format("markdown", "# **Home**\n")
                .note("page height changed during capture: 100 -> 120 (image kept at 100)")
                .build());
        result.put(bad, PageResult.failed(bad.toString(), 1, "net::ERR_CONNECTION_REFUSED"));
        result.getStats().pageVisited(40);
        result.getStats().pageFailed();
        result.getStats().linksOffered(3, 1);

        CrawlConfig cfg = CrawlConfig.defaults()
                .setTarget(seed.toString())
                .setMaxDepth(1)
                .setMinInterval(Duration.ofMillis(250));

        Path out = new CrawlSummaryExporter().export(dir, cfg, result, Instant.parse("2024-05-06T07:08:09Z"));

        assertThat(out).startsWith(dir.resolve("ex.com"));
        assertThat(Files.exists(out)).isTrue();

        JsonNode root = Jsons.mapper().readTree(out.toFile());
        assertThat(root.get("meta").get("seed").asText()).isEqualTo("https://ex.com/");
        assertThat(root.get("meta").get("maxDepth").asInt()).isEqualTo(1);
        assertThat(root.get("meta").get("rateLimitMs").asLong()).isEqualTo(250);
        assertThat(root.get("meta").get("formats").get(0).asText()).isEqualTo("markdown");
        assertThat(root.get("meta").get("startedAt").asText()).isEqualTo("2024-05-06T07:08:09Z");

        assertThat(root.get("stats").get("pagesVisited").asLong()).isEqualTo(1);
        assertThat(root.get("stats").get("pagesFailed").asLong()).isEqualTo(1);
        assertThat(root.get("stats").get("linksAdmitted").asLong()).isEqualTo(1);

        JsonNode pages = root.get("pages");
        assertThat(pages.size()).isEqualTo(2);
        JsonNode home = pages.get(0).get("url").asText().equals("https://ex.com/") ? pages.get(0) : pages.get(1);
        JsonNode broken = home == pages.get(0) ? pages.get(1) : pages.get(0);

        assertThat(home.get("formats").get(0).asText()).isEqualTo("markdown");
        assertThat(home.has("error")).isFalse();
        assertThat(home.get("notes").get(0).asText()).contains("100 -> 120");
        assertThat(broken.get("error").asText()).contains("ERR_CONNECTION_REFUSED");
        assertThat(broken.get("depth").asInt()).isEqualTo(1);
    }
}
