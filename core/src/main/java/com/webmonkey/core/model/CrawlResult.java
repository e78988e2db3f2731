package com.webmonkey.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 크롤 전체 결과: 정규화 URL → PageResult (방문 순서 유지).
 * 워커 여러 개가 동시에 기록할 수 있으므로 쓰기는 동기화한다.
 */
public final class CrawlResult {
    private final CanonicalUrl seed;
    private final Map<CanonicalUrl, PageResult> pages = new LinkedHashMap<>();
    private final CrawlStats stats = new CrawlStats();

    public CrawlResult(CanonicalUrl seed) {
        this.seed = seed;
    }

    public CanonicalUrl getSeed() { return seed; }
    public CrawlStats getStats() { return stats; }

    public synchronized void put(CanonicalUrl url, PageResult result) {
        pages.put(url, result);
    }

    public synchronized PageResult get(CanonicalUrl url) { return pages.get(url); }

    public synchronized PageResult get(String canonicalUrl) {
        for (Map.Entry<CanonicalUrl, PageResult> e : pages.entrySet()) {
            if (e.getKey().toString().equals(canonicalUrl)) return e.getValue();
        }
        return null;
    }

    public synchronized int size() { return pages.size(); }

    public synchronized Set<CanonicalUrl> urls() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(pages.keySet()));
    }

    /** 복사본 (방문 순서) */
    public synchronized Map<CanonicalUrl, PageResult> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(pages));
    }

    public synchronized long errorCount() {
        return pages.values().stream().filter(PageResult::isError).count();
    }
}
