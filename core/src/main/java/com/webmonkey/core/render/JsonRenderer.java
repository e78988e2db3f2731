package com.webmonkey.core.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webmonkey.core.api.IDocumentRenderer;
import com.webmonkey.core.model.PageDocument;
import com.webmonkey.core.util.Jsons;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** 문서 모델 → 들여쓰기된 JSON (Jackson) */
public final class JsonRenderer implements IDocumentRenderer {

    private final ObjectMapper om;

    public JsonRenderer() {
        this(Jsons.mapper());
    }

    public JsonRenderer(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public String render(PageDocument doc) {
        return write(doc);
    }

    /** 저장용 요약 JSON: markdown + metadata + scrape_id */
    public String structured(PageDocument doc, String markdown) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("markdown", markdown == null ? "" : markdown);
        m.put("metadata", doc.getMetadata());
        m.put("scrape_id", doc.getScrapeId().toString());
        return write(m);
    }

    private String write(Object value) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("JSON serialization failed", e);
        }
    }
}
