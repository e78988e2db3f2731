package com.webmonkey.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/** 섹션 바로 아래 블록 하나. 더 이상 중첩하지 않는다. */
@JsonPropertyOrder({"headline", "description", "links", "content"})
public class Subsection {
    private final String headline;
    private final String description;
    private final String content;
    private final List<LinkRef> links;

    protected Subsection(String headline, String description, String content, List<LinkRef> links) {
        this.headline = nz(headline);
        this.description = nz(description);
        this.content = nz(content);
        this.links = (links == null ? List.of() : List.copyOf(links));
    }

    @JsonProperty("headline")    public String getHeadline() { return headline; }
    @JsonProperty("description") public String getDescription() { return description; }
    @JsonProperty("content")     public String getContent() { return content; }
    @JsonProperty("links")       public List<LinkRef> getLinks() { return links; }

    /** 모든 필드가 비었으면 true → 추출 단계에서 버린다 */
    @JsonIgnore
    public boolean isEmpty() {
        return headline.isEmpty() && description.isEmpty() && content.isEmpty() && links.isEmpty();
    }

    static String nz(String s) { return s == null ? "" : s; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String headline = "";
        private String description = "";
        private String content = "";
        private final List<LinkRef> links = new ArrayList<>();

        public Builder headline(String v) { this.headline = v; return this; }
        public Builder description(String v) { this.description = v; return this; }
        public Builder content(String v) { this.content = v; return this; }
        public Builder link(LinkRef l) { if (l != null) links.add(l); return this; }
        public Builder links(List<LinkRef> ls) { if (ls != null) ls.forEach(this::link); return this; }

        public Subsection build() { return new Subsection(headline, description, content, links); }
    }
}
