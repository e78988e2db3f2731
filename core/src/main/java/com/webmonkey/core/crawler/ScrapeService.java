package com.webmonkey.core.crawler;

import com.webmonkey.core.api.IContentExtractor;
import com.webmonkey.core.driver.BrowserDriver;
import com.webmonkey.core.extract.JsoupContentExtractor;
import com.webmonkey.core.extract.LinkMapper;
import com.webmonkey.core.model.ActionReport;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.OutputFormat;
import com.webmonkey.core.model.PageDocument;
import com.webmonkey.core.model.PageResult;
import com.webmonkey.core.model.PageSnapshot;
import com.webmonkey.core.model.ScrapeAction;
import com.webmonkey.core.render.HtmlRenderer;
import com.webmonkey.core.render.MarkdownRenderer;
import com.webmonkey.core.screenshot.ScreenshotCompositor;
import com.webmonkey.core.screenshot.ScreenshotService;
import com.webmonkey.core.util.Sleeper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * URL 하나 스크랩: 탐색 → 액션 → 스냅샷 → 요청된 형식별 렌더.
 * 실패는 URL 단위 결과(error)로 바꿔 돌려준다.
 */
public final class ScrapeService {

    /** 스크랩 결과 + 프런티어에 넘길 발견 링크 */
    public static final class Outcome {
        private final PageResult result;
        private final PageSnapshot snapshot;
        private final List<String> discoveredLinks;
        private final Exception failure;

        Outcome(PageResult result, PageSnapshot snapshot, List<String> discoveredLinks, Exception failure) {
            this.result = result;
            this.snapshot = snapshot;
            this.discoveredLinks = List.copyOf(discoveredLinks);
            this.failure = failure;
        }

        public PageResult getResult() { return result; }
        public PageSnapshot getSnapshot() { return snapshot; }
        public List<String> getDiscoveredLinks() { return discoveredLinks; }
        /** 실패 원인 (성공이면 null) */
        public Exception getFailure() { return failure; }
        public boolean isFailed() { return failure != null; }
    }

    private final IContentExtractor extractor;
    private final MarkdownRenderer markdown = new MarkdownRenderer();
    private final HtmlRenderer html = new HtmlRenderer();
    private final LinkMapper linkMapper = new LinkMapper();
    private final ActionRunner actions;
    private final ScreenshotService screenshots;
    private final boolean includeAssets;

    public ScrapeService(CrawlConfig cfg) {
        this(cfg, new JsoupContentExtractor(), Sleeper.SYSTEM);
    }

    public ScrapeService(CrawlConfig cfg, IContentExtractor extractor, Sleeper sleeper) {
        this(extractor, new ActionRunner(sleeper),
                new ScreenshotService(new ScreenshotCompositor(sleeper, cfg.getSettleDelay())),
                cfg.isIncludeAssets());
    }

    public ScrapeService(IContentExtractor extractor, ActionRunner actions,
                         ScreenshotService screenshots, boolean includeAssets) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.actions = Objects.requireNonNull(actions, "actions");
        this.screenshots = Objects.requireNonNull(screenshots, "screenshots");
        this.includeAssets = includeAssets;
    }

    /**
     * 실패해도 던지지 않고 {@code error} 가 채워진 결과를 돌려준다 (형식 값은 비움, 액션 기록은 유지).
     * 인터럽트만 전파한다.
     */
    public Outcome scrape(BrowserDriver driver, String url, int depth,
                          Collection<OutputFormat> formats, List<ScrapeAction> scripted) throws InterruptedException {
        List<ActionReport> reports = new ArrayList<>();
        try {
            return doScrape(driver, url, depth, formats, scripted, reports);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            PageResult failed = PageResult.builder(url, depth).actions(reports).error(msg).build();
            return new Outcome(failed, null, List.of(), e);
        }
    }

    private Outcome doScrape(BrowserDriver driver, String url, int depth, Collection<OutputFormat> formats,
                             List<ScrapeAction> scripted, List<ActionReport> reports) throws Exception {
        driver.navigate(url);
        actions.run(driver, scripted, reports);

        PageResult.Builder rb = PageResult.builder(url, depth).actions(reports);
        String current = driver.currentUrl();
        int status = driver.lastStatus() > 0 ? driver.lastStatus() : PageSnapshot.DEFAULT_STATUS;
        PageSnapshot snap = new PageSnapshot(driver.pageSource(), current == null ? url : current, status);

        PageDocument doc = null;
        for (OutputFormat f : formats) {
            switch (f) {
                case MARKDOWN:
                    if (doc == null) doc = extractor.extract(snap);
                    rb.format(f.resultKey(), markdown.render(doc));
                    break;
                case JSON:
                    if (doc == null) doc = extractor.extract(snap);
                    rb.format(f.resultKey(), doc);
                    break;
                case HTML:
                    rb.format(f.resultKey(), html.cleaned(snap.getHtml(), snap.getUrl()));
                    break;
                case RAW_HTML:
                    rb.format(f.resultKey(), html.raw(snap.getHtml()));
                    break;
                case LINKS:
                    rb.format(f.resultKey(), linkMapper.map(snap,
                            LinkMapper.Options.defaults().includeAssets(includeAssets)));
                    break;
                case SCREENSHOT:
                    rb.format(f.resultKey(), screenshots.viewport(driver));
                    break;
                case SCREENSHOT_FULL_PAGE:
                    rb.format(f.resultKey(), screenshots.fullPage(driver, rb::note));
                    break;
                default:
                    throw new IllegalStateException("unhandled format: " + f);
            }
        }

        List<String> discovered = linkMapper.map(snap, LinkMapper.Options.defaults());
        return new Outcome(rb.build(), snap, discovered, null);
    }
}
