package com.webmonkey.core.model;

import java.util.Objects;

/** 프런티어 큐 항목: (정규화 URL, 깊이). 생성 후 불변. */
public final class FrontierEntry {
    private final CanonicalUrl url;
    private final int depth;

    public FrontierEntry(CanonicalUrl url, int depth) {
        this.url = Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        this.depth = depth;
    }

    public CanonicalUrl getUrl() { return url; }
    public int getDepth() { return depth; }

    @Override public String toString() { return url + "@" + depth; }
}
