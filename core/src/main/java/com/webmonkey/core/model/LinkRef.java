package com.webmonkey.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** 앵커 하나: 표시 텍스트 + (절대화된) URL */
public final class LinkRef {
    private final String text;
    private final String url;

    public LinkRef(String text, String url) {
        this.text = (text == null ? "" : text);
        this.url = (url == null ? "" : url);
    }

    @JsonProperty("text") public String getText() { return text; }
    @JsonProperty("url")  public String getUrl() { return url; }

    /** http(s) 절대 URL 여부 */
    @JsonIgnore
    public boolean isAbsolute() {
        return url.startsWith("http://") || url.startsWith("https://");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinkRef)) return false;
        LinkRef l = (LinkRef) o;
        return text.equals(l.text) && url.equals(l.url);
    }

    @Override public int hashCode() { return Objects.hash(text, url); }

    @Override public String toString() { return "[" + text + "](" + url + ")"; }
}
