package com.webmonkey.core.model;

import java.util.Objects;

/**
 * 방문 시점의 DOM 스냅샷(외부 입력).
 * statusCode 는 드라이버가 모르면 200 으로 둔다.
 */
public final class PageSnapshot {
    public static final int DEFAULT_STATUS = 200;

    private final String html;
    private final String url;
    private final int statusCode;

    public PageSnapshot(String html, String url) {
        this(html, url, DEFAULT_STATUS);
    }

    public PageSnapshot(String html, String url, int statusCode) {
        this.html = (html == null ? "" : html);
        this.url = Objects.requireNonNull(url, "url");
        this.statusCode = statusCode;
    }

    public String getHtml() { return html; }
    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
}
