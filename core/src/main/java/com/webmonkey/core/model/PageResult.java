package com.webmonkey.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * URL 하나의 처리 결과: 형식별 렌더 값, 또는 오류 메시지.
 * 오류가 있어도 크롤은 계속된다.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"url", "depth", "timestamp", "error", "formats", "actions", "notes"})
public final class PageResult {
    private final String url;
    private final int depth;
    private final Instant timestamp;
    private final Map<String, Object> formats;
    private final List<ActionReport> actions;
    private final List<String> notes;
    private final String error;

    private PageResult(Builder b) {
        this.url = b.url;
        this.depth = b.depth;
        this.timestamp = b.timestamp == null ? Instant.now() : b.timestamp;
        this.formats = Collections.unmodifiableMap(new LinkedHashMap<>(b.formats));
        this.actions = List.copyOf(b.actions);
        this.notes = List.copyOf(b.notes);
        this.error = b.error;
    }

    /** 실패 결과: {error: message} */
    public static PageResult failed(String url, int depth, String message) {
        return builder(url, depth).error(message == null ? "unknown error" : message).build();
    }

    @JsonProperty("url")       public String getUrl() { return url; }
    @JsonProperty("depth")     public int getDepth() { return depth; }
    @JsonProperty("timestamp") public Instant getTimestamp() { return timestamp; }
    @JsonProperty("formats")   public Map<String, Object> getFormats() { return formats; }
    @JsonProperty("actions")   public List<ActionReport> getActions() { return actions; }
    @JsonProperty("notes")     public List<String> getNotes() { return notes; }
    @JsonProperty("error")     public String getError() { return error; }

    @JsonIgnore public boolean isError() { return error != null; }

    public Object format(String key) { return formats.get(key); }

    public static Builder builder(String url, int depth) { return new Builder(url, depth); }

    public static final class Builder {
        private final String url;
        private final int depth;
        private Instant timestamp;
        private final Map<String, Object> formats = new LinkedHashMap<>();
        private final List<ActionReport> actions = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();
        private String error;

        private Builder(String url, int depth) {
            this.url = url;
            this.depth = depth;
        }

        public Builder timestamp(Instant v) { this.timestamp = v; return this; }
        public Builder format(String key, Object value) { formats.put(key, value); return this; }
        public Builder actions(List<ActionReport> v) { if (v != null) actions.addAll(v); return this; }
        public Builder note(String v) { if (v != null) notes.add(v); return this; }
        public Builder error(String v) { this.error = v; return this; }

        public PageResult build() { return new PageResult(this); }
    }
}
