package com.webmonkey.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** 리뷰/추천/댓글 블록 하나 */
@JsonPropertyOrder({"author", "date", "text", "platform", "rating", "read_more", "verified"})
public final class Review {
    /** 더 나은 신호가 없을 때 쓰는 플랫폼 기본값 */
    public static final String DEFAULT_PLATFORM = "Amazon";

    private final String author;
    private final String date;
    private final String text;
    private final String platform;
    private final String rating;
    private final boolean verified;
    private final boolean readMore;

    private Review(Builder b) {
        this.author = b.author;
        this.date = b.date;
        this.text = b.text;
        this.platform = b.platform;
        this.rating = b.rating;
        this.verified = b.verified;
        this.readMore = b.readMore;
    }

    @JsonProperty("author")    public String getAuthor() { return author; }
    @JsonProperty("date")      public String getDate() { return date; }
    @JsonProperty("text")      public String getText() { return text; }
    @JsonProperty("platform")  public String getPlatform() { return platform; }
    @JsonProperty("rating")    public String getRating() { return rating; }
    @JsonProperty("verified")  public boolean isVerified() { return verified; }
    @JsonProperty("read_more") public boolean isReadMore() { return readMore; }

    /** 추출된 신호가 하나도 없으면 true. 기본값으로 채운 platform 은 신호로 치지 않는다. */
    @JsonIgnore
    public boolean isEmpty() {
        return author.isEmpty() && date.isEmpty() && text.isEmpty()
                && rating.isEmpty() && !verified && !readMore;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String author = "";
        private String date = "";
        private String text = "";
        private String platform = DEFAULT_PLATFORM;
        private String rating = "";
        private boolean verified;
        private boolean readMore;

        public Builder author(String v) { this.author = Subsection.nz(v); return this; }
        public Builder date(String v) { this.date = Subsection.nz(v); return this; }
        public Builder text(String v) { this.text = Subsection.nz(v); return this; }
        public Builder platform(String v) { this.platform = Subsection.nz(v); return this; }
        public Builder rating(String v) { this.rating = Subsection.nz(v); return this; }
        public Builder verified(boolean v) { this.verified = v; return this; }
        public Builder readMore(boolean v) { this.readMore = v; return this; }

        public Review build() { return new Review(this); }
    }
}
