package com.webmonkey.core.crawler;

import com.webmonkey.core.api.CrawlValidationException;
import com.webmonkey.core.model.CanonicalUrl;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.FrontierEntry;
import com.webmonkey.core.util.RateLimiter;
import com.webmonkey.core.util.UrlCanonicalizer;
import com.webmonkey.core.util.UrlExclusion;
import com.webmonkey.core.util.UrlPatternFilter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * BFS 프런티어 (크롤 하나 전용).
 * - FIFO 큐 + 방문 집합. 방문 집합은 단조 증가하며 다른 크롤과 공유하지 않는다.
 * - offer() 는 정규화 → 방문/깊이/도메인/패턴/제외/maxPages 검사 → 등록+방문표시 를 원자적으로 수행.
 * - dequeue() 는 RateLimiter 로 최소 간격을 보장한다.
 */
public final class Frontier {

    private final int maxDepth;
    private final boolean sameDomainOnly;
    private final boolean followSubdomains;
    private final int maxPages;
    private final UrlPatternFilter include;
    private final List<String> excludes;
    private final RateLimiter limiter;

    private final Deque<FrontierEntry> queue = new ArrayDeque<>();
    private final Set<CanonicalUrl> visited = new HashSet<>();
    private CanonicalUrl seed;

    public Frontier(CrawlConfig cfg, RateLimiter limiter) {
        this(cfg.getMaxDepth(), cfg.isSameDomainOnly(), cfg.isFollowSubdomains(), cfg.getMaxPages(),
                UrlPatternFilter.of(cfg.getIncludePattern()), cfg.getExcludePaths(), limiter);
    }

    public Frontier(int maxDepth, boolean sameDomainOnly, boolean followSubdomains, int maxPages,
                    UrlPatternFilter include, List<String> excludes, RateLimiter limiter) {
        if (maxDepth < 0) throw new CrawlValidationException("maxDepth", "must be >= 0");
        this.maxDepth = maxDepth;
        this.sameDomainOnly = sameDomainOnly;
        this.followSubdomains = followSubdomains;
        this.maxPages = Math.max(0, maxPages);
        this.include = include == null ? UrlPatternFilter.acceptAll() : include;
        this.excludes = excludes == null ? List.of() : List.copyOf(excludes);
        this.limiter = Objects.requireNonNull(limiter, "limiter");
    }

    /** depth 0 으로 무조건 등록 (필터 미적용). 정규화 불가면 검증 오류 */
    public synchronized FrontierEntry enqueueSeed(String rawSeed) {
        CanonicalUrl c = UrlCanonicalizer.canonicalize(rawSeed);
        if (c == null) throw new CrawlValidationException("target", "seed is not a crawlable http(s) URL: " + rawSeed);
        if (seed != null) throw new IllegalStateException("seed already enqueued: " + seed);
        seed = c;
        visited.add(c);
        FrontierEntry e = new FrontierEntry(c, 0);
        queue.addLast(e);
        return e;
    }

    /**
     * 다음 항목. 비어 있으면 즉시 null, 아니면 직전 dequeue 로부터 최소 간격을 기다린 뒤 반환.
     * 여러 워커가 동시에 부르면 대기 후 큐가 비어 null 이 될 수 있다.
     */
    public FrontierEntry dequeue() throws InterruptedException {
        synchronized (this) {
            if (queue.isEmpty()) return null;
        }
        limiter.acquire();
        synchronized (this) {
            return queue.pollFirst();
        }
    }

    /** 선두 항목의 깊이 (비었으면 -1) */
    public synchronized int peekDepth() {
        FrontierEntry e = queue.peekFirst();
        return e == null ? -1 : e.getDepth();
    }

    /**
     * 발견한 링크 등록 시도.
     * @param rawUrl    href 원문 (상대경로 가능)
     * @param base      해석 기준 URL (보통 스냅샷 URL)
     * @param fromDepth 링크를 발견한 페이지의 깊이
     * @return 새로 등록됐으면 true
     */
    public synchronized boolean offer(String rawUrl, String base, int fromDepth) {
        if (seed == null) throw new IllegalStateException("enqueueSeed() must be called first");
        CanonicalUrl c = UrlCanonicalizer.canonicalize(rawUrl, base);
        if (c == null) return false;
        if (visited.contains(c)) return false;
        int depth = fromDepth + 1;
        if (depth > maxDepth) return false;
        if (!inScope(c)) return false;
        if (!include.accepts(c)) return false;
        if (!excludes.isEmpty() && UrlExclusion.isExcluded(c, excludes)) return false;
        if (maxPages > 0 && visited.size() >= maxPages) return false;

        visited.add(c);
        queue.addLast(new FrontierEntry(c, depth));
        return true;
    }

    public boolean offer(CanonicalUrl url, int fromDepth) {
        return offer(url == null ? null : url.toString(), null, fromDepth);
    }

    private boolean inScope(CanonicalUrl c) {
        if (!sameDomainOnly) return true;
        if (UrlCanonicalizer.sameHost(seed, c)) return true;
        return followSubdomains && UrlCanonicalizer.isSubdomainOf(c.getHost(), seed.getHost());
    }

    public synchronized int pending() { return queue.size(); }

    public synchronized int visitedCount() { return visited.size(); }

    public synchronized boolean isVisited(CanonicalUrl url) { return visited.contains(url); }

    public synchronized CanonicalUrl getSeed() { return seed; }

    public int getMaxDepth() { return maxDepth; }
}
