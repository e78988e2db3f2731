package com.webmonkey.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 런타임 통계 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong pagesVisited = new AtomicLong(0);
    private final AtomicLong pagesFailed  = new AtomicLong(0);
    private final AtomicLong linksOffered = new AtomicLong(0);
    private final AtomicLong linksAdmitted = new AtomicLong(0);
    private final AtomicLong sumWallMs = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void pageVisited(long wallMs) {
        pagesVisited.incrementAndGet();
        sumWallMs.addAndGet(Math.max(0, wallMs));
    }
    public void pageFailed() { pagesFailed.incrementAndGet(); }
    public void linksOffered(long offered, long admitted) {
        linksOffered.addAndGet(offered);
        linksAdmitted.addAndGet(admitted);
    }
    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long visited = pagesVisited.get();
        long avg = sumWallMs.get() / Math.max(1, visited);
        return new Snapshot(visited, pagesFailed.get(), linksOffered.get(), linksAdmitted.get(),
                maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long pagesVisited;
        public final long pagesFailed;
        public final long linksOffered;
        public final long linksAdmitted;
        public final int  maxObservedConcurrency;
        public final long avgPageMs;
        public Snapshot(long v, long f, long o, long a, int c, long avg) {
            this.pagesVisited = v;
            this.pagesFailed = f;
            this.linksOffered = o;
            this.linksAdmitted = a;
            this.maxObservedConcurrency = c;
            this.avgPageMs = avg;
        }
    }
}
