package com.webmonkey.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 페이지 한 번 방문에서 추출한 문서 모델. 출력 형식과 무관하며 생성 후 불변.
 */
@JsonPropertyOrder({"title", "metadata", "sections", "reviews", "structured_data",
        "scrape_id", "source_url", "status_code"})
public final class PageDocument {
    private final String title;
    private final Metadata metadata;
    private final List<Section> sections;
    private final List<Review> reviews;
    private final List<Object> structuredData;
    private final UUID scrapeId;
    private final String sourceUrl;
    private final int statusCode;

    private PageDocument(Builder b) {
        this.title = b.title == null ? "" : b.title;
        this.metadata = b.metadata == null ? Metadata.empty() : b.metadata;
        this.sections = List.copyOf(b.sections);
        this.reviews = List.copyOf(b.reviews);
        this.structuredData = List.copyOf(b.structuredData);
        this.scrapeId = b.scrapeId == null ? UUID.randomUUID() : b.scrapeId;
        this.sourceUrl = b.sourceUrl == null ? "" : b.sourceUrl;
        this.statusCode = b.statusCode;
    }

    @JsonProperty("title")           public String getTitle() { return title; }
    @JsonProperty("metadata")        public Metadata getMetadata() { return metadata; }
    @JsonProperty("sections")        public List<Section> getSections() { return sections; }
    @JsonProperty("reviews")         public List<Review> getReviews() { return reviews; }
    @JsonProperty("structured_data") public List<Object> getStructuredData() { return structuredData; }
    @JsonProperty("scrape_id")       public UUID getScrapeId() { return scrapeId; }
    @JsonProperty("source_url")      public String getSourceUrl() { return sourceUrl; }
    @JsonProperty("status_code")     public int getStatusCode() { return statusCode; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String title;
        private Metadata metadata;
        private final List<Section> sections = new ArrayList<>();
        private final List<Review> reviews = new ArrayList<>();
        private final List<Object> structuredData = new ArrayList<>();
        private UUID scrapeId;
        private String sourceUrl;
        private int statusCode = PageSnapshot.DEFAULT_STATUS;

        public Builder title(String v) { this.title = v; return this; }
        public Builder metadata(Metadata v) { this.metadata = v; return this; }
        public Builder section(Section s) { if (s != null && !s.isEmpty()) sections.add(s); return this; }
        public Builder review(Review r) { if (r != null && !r.isEmpty()) reviews.add(r); return this; }
        public Builder structuredData(Object o) { if (o != null) structuredData.add(o); return this; }
        public Builder scrapeId(UUID v) { this.scrapeId = v; return this; }
        public Builder sourceUrl(String v) { this.sourceUrl = v; return this; }
        public Builder statusCode(int v) { this.statusCode = v; return this; }

        public PageDocument build() { return new PageDocument(this); }
    }
}
