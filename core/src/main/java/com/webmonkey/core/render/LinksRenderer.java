package com.webmonkey.core.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.util.Jsons;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/** 링크 목록 저장 형식: txt(한 줄에 하나) 또는 json({"links": [...]}) */
public final class LinksRenderer {

    public String render(List<String> links, CrawlConfig.LinksFormat format) {
        List<String> ls = links == null ? List.of() : links;
        if (format == CrawlConfig.LinksFormat.JSON) {
            try {
                return Jsons.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(Map.of("links", ls));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("links serialization failed", e);
            }
        }
        return String.join("\n", ls);
    }

    public String extension(CrawlConfig.LinksFormat format) {
        return format == CrawlConfig.LinksFormat.JSON ? ".json" : ".txt";
    }
}
