package com.webmonkey.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/** 블록 컨테이너(section/div/article) 하나에서 뽑은 구조. */
@JsonPropertyOrder({"headline", "description", "links", "content", "subsections"})
public final class Section extends Subsection {
    private final List<Subsection> subsections;

    private Section(Builder b) {
        super(b.headline, b.description, b.content, b.links);
        this.subsections = List.copyOf(b.subsections);
    }

    @JsonProperty("subsections") public List<Subsection> getSubsections() { return subsections; }

    @JsonIgnore
    @Override public boolean isEmpty() {
        return super.isEmpty() && subsections.isEmpty();
    }

    public static Builder sectionBuilder() { return new Builder(); }

    public static final class Builder {
        private String headline = "";
        private String description = "";
        private String content = "";
        private final List<LinkRef> links = new ArrayList<>();
        private final List<Subsection> subsections = new ArrayList<>();

        public Builder headline(String v) { this.headline = nz(v); return this; }
        public Builder description(String v) { this.description = nz(v); return this; }
        public Builder content(String v) { this.content = nz(v); return this; }
        public Builder link(LinkRef l) { if (l != null) links.add(l); return this; }
        public Builder links(List<LinkRef> ls) { if (ls != null) ls.forEach(this::link); return this; }
        public Builder subsection(Subsection s) { if (s != null && !s.isEmpty()) subsections.add(s); return this; }

        public Section build() { return new Section(this); }
    }
}
