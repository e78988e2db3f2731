package com.webmonkey.core.crawler;

import com.webmonkey.core.api.CrawlValidationException;
import com.webmonkey.core.api.IContentExtractor;
import com.webmonkey.core.api.ICrawler;
import com.webmonkey.core.driver.BrowserDriver;
import com.webmonkey.core.driver.BrowserSession;
import com.webmonkey.core.driver.DriverException;
import com.webmonkey.core.driver.DriverFactory;
import com.webmonkey.core.extract.JsoupContentExtractor;
import com.webmonkey.core.model.CanonicalUrl;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.CrawlResult;
import com.webmonkey.core.model.FrontierEntry;
import com.webmonkey.core.model.OutputFormat;
import com.webmonkey.core.model.PageResult;
import com.webmonkey.core.model.ScrapeAction;
import com.webmonkey.core.util.ProgressListener;
import com.webmonkey.core.util.RateLimiter;
import com.webmonkey.core.util.Sleeper;
import com.webmonkey.core.util.StructuredLog;
import com.webmonkey.core.util.UrlCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * BFS 크롤 오케스트레이터.
 * - 시드 → dequeue(레이트 리밋) → 탐색/액션/스냅샷/렌더 → 결과 기록 → 링크 offer → 반복
 * - URL 단위 실패는 {error} 로 기록하고 계속, 탐색 전 검증 오류만 던진다
 * - concurrency=1 은 호출 스레드에서 순차 실행, 그 이상은 워커마다 자기 세션을 갖는 고정 풀
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final DriverFactory drivers;
    private final IContentExtractor extractor;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;
    private ProgressListener listener = ProgressListener.NONE;

    public Crawler(DriverFactory drivers) {
        this(drivers, new JsoupContentExtractor(), Sleeper.SYSTEM, System::nanoTime);
    }

    public Crawler(DriverFactory drivers, IContentExtractor extractor, Sleeper sleeper, LongSupplier nanoClock) {
        this.drivers = Objects.requireNonNull(drivers, "drivers");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /** 페이지마다 호출할 콜백 (저장/진행률 표시용) */
    public Crawler onPage(ProgressListener l) {
        this.listener = (l == null ? ProgressListener.NONE : l);
        return this;
    }

    @Override
    public CrawlResult crawl(CrawlConfig cfg) throws InterruptedException {
        Objects.requireNonNull(cfg, "config");
        cfg.validate();

        RateLimiter limiter = new RateLimiter(cfg.getMinInterval(), sleeper, nanoClock);
        Frontier frontier = new Frontier(cfg, limiter);
        FrontierEntry seed = frontier.enqueueSeed(cfg.getTarget());
        Run run = new Run(cfg, frontier, new CrawlResult(seed.getUrl()),
                new ScrapeService(cfg, extractor, sleeper), canonicalActions(cfg));

        int cc = cfg.getConcurrency();
        LOG.info("Crawl start: seed={}, maxDepth={}, sameDomainOnly={}, interval={}ms, cc={}, formats={}",
                seed.getUrl(), cfg.getMaxDepth(), cfg.isSameDomainOnly(),
                cfg.getMinInterval().toMillis(), cc, OutputFormat.wireNames(cfg.getOutputFormats()));
        SLOG.info("crawl-start",
                "seed", seed.getUrl().toString(),
                "maxDepth", cfg.getMaxDepth(),
                "sameDomainOnly", cfg.isSameDomainOnly(),
                "intervalMs", cfg.getMinInterval().toMillis(),
                "cc", cc);

        if (cc == 1) {
            runSequential(run);
        } else {
            runParallel(run, cc);
        }

        CrawlResult result = run.result;
        LOG.info("Crawl done. pages={}, errors={}, pending={}",
                result.size(), result.errorCount(), frontier.pending());
        SLOG.info("crawl-done",
                "pages", result.size(),
                "errors", result.errorCount(),
                "maxObservedCC", result.getStats().snapshot().maxObservedConcurrency);
        return result;
    }

    // ---------------- 실행 모드 ----------------

    private void runSequential(Run run) throws InterruptedException {
        try (BrowserSession session = new BrowserSession(drivers, "crawl")) {
            FrontierEntry e;
            while ((e = run.frontier.dequeue()) != null) {
                run.result.getStats().observeConcurrency(1);
                visit(run, e, session);
            }
        }
    }

    /**
     * 조정 스레드(호출자)가 dequeue + 레이트 리밋을 전담하고 워커 풀에 넘긴다.
     * 깊이 d 작업이 남아 있는 동안 d+1 항목은 꺼내지 않는다 (BFS 순서 유지).
     */
    private void runParallel(Run run, int cc) throws InterruptedException {
        BlockingQueue<BrowserSession> sessions = new ArrayBlockingQueue<>(cc);
        List<BrowserSession> all = new ArrayList<>(cc);
        for (int i = 0; i < cc; i++) {
            BrowserSession s = new BrowserSession(drivers, "crawl-worker-" + (i + 1));
            sessions.add(s);
            all.add(s);
        }

        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("crawl-worker"));
        CompletionService<Void> done = new ExecutorCompletionService<>(exec);
        int inFlight = 0;
        int level = 0;

        try {
            while (true) {
                int next = run.frontier.peekDepth();
                boolean mustWait = next < 0 || inFlight >= cc || (inFlight > 0 && next > level);
                if (mustWait) {
                    if (inFlight == 0) break;
                    awaitOne(done);
                    inFlight--;
                    continue;
                }

                FrontierEntry e = run.frontier.dequeue();
                if (e == null) continue;
                level = e.getDepth();

                BrowserSession s = sessions.take();
                done.submit(() -> {
                    try {
                        visit(run, e, s);
                    } finally {
                        sessions.add(s);
                    }
                    return null;
                });
                inFlight++;
                run.result.getStats().observeConcurrency(inFlight);
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            all.forEach(BrowserSession::close);
        }
    }

    private static void awaitOne(CompletionService<Void> done) throws InterruptedException {
        Future<Void> f = done.take();
        try {
            f.get();
        } catch (ExecutionException ex) {
            Throwable cause = (ex.getCause() != null ? ex.getCause() : ex);
            LOG.warn("Crawl task failed: {}", cause.toString());
            SLOG.error("task-failed", cause, "cause", cause.toString());
        }
    }

    // ---------------- 페이지 하나 ----------------

    private void visit(Run run, FrontierEntry entry, BrowserSession session) throws InterruptedException {
        CanonicalUrl url = entry.getUrl();
        int depth = entry.getDepth();
        long t0 = System.nanoTime();

        PageResult page;
        ScrapeService.Outcome out = null;
        try {
            BrowserDriver driver = session.ensureOpen();
            out = run.scraper.scrape(driver, url.toString(), depth,
                    run.cfg.getOutputFormats(), run.actions.get(url));
            page = out.getResult();
        } catch (DriverException e) {
            page = PageResult.failed(url.toString(), depth, e.getMessage());
            session.reset();
        }
        long wallMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        if (page.isError()) {
            if (out != null && out.getFailure() instanceof DriverException
                    && ((DriverException) out.getFailure()).isFatal()) {
                session.reset();
            }
            run.result.getStats().pageFailed();
            LOG.warn("Failed {} (depth {}): {}", url, depth, page.getError());
            SLOG.warn("page-failed", "url", url.toString(), "depth", depth, "error", page.getError());
        } else {
            int offered = 0, admitted = 0;
            if (depth < run.frontier.getMaxDepth()) {
                String base = out.getSnapshot().getUrl();
                for (String link : out.getDiscoveredLinks()) {
                    offered++;
                    if (run.frontier.offer(link, base, depth)) admitted++;
                }
            }
            run.result.getStats().linksOffered(offered, admitted);
            run.result.getStats().pageVisited(wallMs);
            LOG.info("Crawled {} (depth {}) -> links={}, new={}, {}ms", url, depth, offered, admitted, wallMs);
            SLOG.info("page-done",
                    "url", url.toString(),
                    "depth", depth,
                    "links", offered,
                    "admitted", admitted,
                    "ms", wallMs);
        }

        run.result.put(url, page);
        long n = run.pagesDone.incrementAndGet();
        try {
            listener.onPage(n, run.frontier.pending(), page);
        } catch (RuntimeException e) {
            LOG.warn("Page listener failed for {}: {}", url, e.toString());
        }
    }

    /** 액션 맵 키(원문 URL)를 정규화 키로 */
    private static Map<CanonicalUrl, List<ScrapeAction>> canonicalActions(CrawlConfig cfg) {
        Map<CanonicalUrl, List<ScrapeAction>> out = new HashMap<>();
        for (Map.Entry<String, List<ScrapeAction>> e : cfg.getActionsPerUrl().entrySet()) {
            CanonicalUrl c = UrlCanonicalizer.canonicalize(e.getKey());
            if (c == null) {
                throw new CrawlValidationException("actions", "action key is not an absolute http(s) URL: " + e.getKey());
            }
            out.put(c, List.copyOf(e.getValue()));
        }
        return out;
    }

    /** 크롤 한 번의 상태 묶음 */
    private static final class Run {
        final CrawlConfig cfg;
        final Frontier frontier;
        final CrawlResult result;
        final ScrapeService scraper;
        final Map<CanonicalUrl, List<ScrapeAction>> actions;
        final AtomicLong pagesDone = new AtomicLong();

        Run(CrawlConfig cfg, Frontier frontier, CrawlResult result, ScrapeService scraper,
            Map<CanonicalUrl, List<ScrapeAction>> actions) {
            this.cfg = cfg;
            this.frontier = frontier;
            this.result = result;
            this.scraper = scraper;
            this.actions = actions;
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
