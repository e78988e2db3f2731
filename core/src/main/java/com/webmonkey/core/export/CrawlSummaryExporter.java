package com.webmonkey.core.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webmonkey.core.model.CanonicalUrl;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.CrawlResult;
import com.webmonkey.core.model.CrawlStats;
import com.webmonkey.core.model.OutputFormat;
import com.webmonkey.core.model.PageResult;
import com.webmonkey.core.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 크롤 요약 JSON: meta(시드/범위/시각) + stats + pages(url, depth, error, 형식 목록, notes).
 * 형식 본문은 넣지 않는다 (FileOutputSink 가 따로 저장).
 */
public class CrawlSummaryExporter {

    private final ObjectMapper om = Jsons.mapper();

    public Path export(Path baseDir, CrawlConfig cfg, CrawlResult result, Instant startedAt) throws IOException {
        Path out = OutputNaming.summaryPath(baseDir, result.getSeed(), startedAt);
        Files.createDirectories(out.getParent());
        om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), summary(cfg, result, startedAt));
        return out;
    }

    Map<String, Object> summary(CrawlConfig cfg, CrawlResult result, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("seed", result.getSeed().toString());
        meta.put("startedAt", startedAt);
        meta.put("finishedAt", Instant.now());
        meta.put("maxDepth", cfg.getMaxDepth());
        meta.put("sameDomainOnly", cfg.isSameDomainOnly());
        meta.put("followSubdomains", cfg.isFollowSubdomains());
        meta.put("maxPages", cfg.getMaxPages());
        meta.put("rateLimitMs", cfg.getMinInterval().toMillis());
        meta.put("concurrency", cfg.getConcurrency());
        meta.put("formats", OutputFormat.wireNames(cfg.getOutputFormats()));

        CrawlStats.Snapshot s = result.getStats().snapshot();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("pagesVisited", s.pagesVisited);
        stats.put("pagesFailed", s.pagesFailed);
        stats.put("linksOffered", s.linksOffered);
        stats.put("linksAdmitted", s.linksAdmitted);
        stats.put("maxObservedConcurrency", s.maxObservedConcurrency);
        stats.put("avgPageMs", s.avgPageMs);

        List<Map<String, Object>> pages = new ArrayList<>();
        for (Map.Entry<CanonicalUrl, PageResult> e : result.asMap().entrySet()) {
            PageResult p = e.getValue();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("url", e.getKey().toString());
            row.put("depth", p.getDepth());
            row.put("timestamp", p.getTimestamp());
            if (p.isError()) row.put("error", p.getError());
            row.put("formats", new ArrayList<>(p.getFormats().keySet()));
            if (!p.getActions().isEmpty()) row.put("actions", p.getActions());
            if (!p.getNotes().isEmpty()) row.put("notes", p.getNotes());
            pages.add(row);
        }

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("meta", meta);
        root.put("stats", stats);
        root.put("pages", pages);
        return root;
    }
}
