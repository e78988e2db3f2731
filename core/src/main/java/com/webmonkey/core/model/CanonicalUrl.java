package com.webmonkey.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 정규화된 URL (dedup/equality 키).
 * - scheme/host 소문자, 기본 포트 제거, fragment 없음
 * - path/query 는 원문 그대로 (대소문자 보존)
 * 동일성은 {@link #toString()} 바이트 비교로 정의된다.
 */
public final class CanonicalUrl implements Comparable<CanonicalUrl> {
    private final String scheme;
    private final String host;
    private final int port;        // -1 = 기본 포트
    private final String path;     // raw, 최소 "/"
    private final String query;    // raw, null 허용
    private final String canonical;

    public CanonicalUrl(String scheme, String host, int port, String path, String query) {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.path = (path == null || path.isEmpty()) ? "/" : path;
        this.query = query;

        StringBuilder sb = new StringBuilder(64);
        sb.append(scheme).append("://").append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(this.path);
        if (query != null) sb.append('?').append(query);
        this.canonical = sb.toString();
    }

    public String getScheme() { return scheme; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getPath() { return path; }
    public String getQuery() { return query; }

    public URI toUri() { return URI.create(canonical); }

    @Override public String toString() { return canonical; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalUrl)) return false;
        return canonical.equals(((CanonicalUrl) o).canonical);
    }

    @Override public int hashCode() { return canonical.hashCode(); }

    @Override public int compareTo(CanonicalUrl o) { return canonical.compareTo(o.canonical); }
}
