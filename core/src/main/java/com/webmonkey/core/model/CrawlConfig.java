package com.webmonkey.core.model;

import com.webmonkey.core.api.CrawlValidationException;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 크롤 설정 (crawl.yml 매핑 대상).
 * 값 검증은 {@link #validate()} 에서 탐색 시작 전에 한 번만 한다.
 */
public final class CrawlConfig {

    /** links 형식 저장 방식 */
    public enum LinksFormat { TXT, JSON }

    /** 브라우저 관련 하위 설정: YAML의 `browser:` 섹션과 매핑 */
    public static final class BrowserCfg {
        private boolean headless = true;
        private int timeoutMs = 30_000;
        private int viewportWidth = 1920;
        private int viewportHeight = 1080;

        public boolean isHeadless() { return headless; }
        public BrowserCfg setHeadless(boolean v) { this.headless = v; return this; }

        public int getTimeoutMs() { return timeoutMs; }
        public BrowserCfg setTimeoutMs(int v) { this.timeoutMs = v; return this; }

        public int getViewportWidth() { return viewportWidth; }
        public BrowserCfg setViewportWidth(int v) { this.viewportWidth = v; return this; }

        public int getViewportHeight() { return viewportHeight; }
        public BrowserCfg setViewportHeight(int v) { this.viewportHeight = v; return this; }
    }

    // ---------- 범위 ----------
    private String target;                  // 시작 URL (필수)
    private int maxDepth = 2;
    private boolean sameDomainOnly = true;
    private boolean followSubdomains = false;
    private int maxPages = 0;               // 0 = 무제한
    private String includePattern;          // 정규식, find 의미
    private List<String> excludePaths = List.of();

    // ---------- 스케줄링 ----------
    private Duration minInterval = Duration.ofSeconds(1);
    private int concurrency = 1;

    // ---------- 출력 ----------
    private List<OutputFormat> outputFormats = List.of(OutputFormat.MARKDOWN);
    private Path outputDir = Path.of("out");
    private LinksFormat linksFormat = LinksFormat.TXT;
    private boolean includeAssets = false;

    // ---------- 스크린샷 ----------
    private Duration settleDelay = Duration.ofMillis(500);

    private final BrowserCfg browser = new BrowserCfg();

    /** URL(원문 또는 정규화) → 추출 전에 실행할 액션 */
    private Map<String, List<ScrapeAction>> actionsPerUrl = new LinkedHashMap<>();

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public boolean isSameDomainOnly() { return sameDomainOnly; }
    public boolean isFollowSubdomains() { return followSubdomains; }
    public int getMaxPages() { return maxPages; }
    public String getIncludePattern() { return includePattern; }
    public List<String> getExcludePaths() { return excludePaths; }
    public Duration getMinInterval() { return minInterval; }
    public int getConcurrency() { return concurrency; }
    public List<OutputFormat> getOutputFormats() { return outputFormats; }
    public Path getOutputDir() { return outputDir; }
    public LinksFormat getLinksFormat() { return linksFormat; }
    public boolean isIncludeAssets() { return includeAssets; }
    public Duration getSettleDelay() { return settleDelay; }
    public BrowserCfg browser() { return browser; }
    public Map<String, List<ScrapeAction>> getActionsPerUrl() { return actionsPerUrl; }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setSameDomainOnly(boolean v) { this.sameDomainOnly = v; return this; }
    public CrawlConfig setFollowSubdomains(boolean v) { this.followSubdomains = v; return this; }
    public CrawlConfig setMaxPages(int v) { this.maxPages = v; return this; }
    public CrawlConfig setIncludePattern(String v) { this.includePattern = (v == null || v.isBlank()) ? null : v; return this; }
    public CrawlConfig setExcludePaths(List<String> v) { this.excludePaths = (v == null ? List.of() : List.copyOf(v)); return this; }
    public CrawlConfig setMinInterval(Duration v) { this.minInterval = v; return this; }
    public CrawlConfig setConcurrency(int v) { this.concurrency = v; return this; }
    public CrawlConfig setOutputDir(Path v) { this.outputDir = v; return this; }
    public CrawlConfig setLinksFormat(LinksFormat v) { this.linksFormat = (v == null ? LinksFormat.TXT : v); return this; }
    public CrawlConfig setIncludeAssets(boolean v) { this.includeAssets = v; return this; }
    public CrawlConfig setSettleDelay(Duration v) { this.settleDelay = v; return this; }

    /** 초 단위(소수 허용) 최소 간격 */
    public CrawlConfig setRateLimitSeconds(double seconds) {
        if (Double.isNaN(seconds) || seconds < 0) {
            throw new CrawlValidationException("rateLimit", "must be >= 0 seconds");
        }
        this.minInterval = Duration.ofNanos((long) (seconds * 1_000_000_000L));
        return this;
    }

    public CrawlConfig setOutputFormats(List<OutputFormat> v) {
        this.outputFormats = (v == null ? List.of() : List.copyOf(v));
        return this;
    }

    /** wire 이름 목록으로 지정 (알 수 없는 이름은 즉시 검증 오류) */
    public CrawlConfig setOutputFormatNames(List<String> names) {
        Set<OutputFormat> parsed = OutputFormat.parseAll(names);
        this.outputFormats = List.copyOf(parsed);
        return this;
    }

    public CrawlConfig setActionsPerUrl(Map<String, List<ScrapeAction>> v) {
        this.actionsPerUrl = new LinkedHashMap<>();
        if (v != null) v.forEach(this::putActions);
        return this;
    }

    public CrawlConfig putActions(String url, List<ScrapeAction> actions) {
        if (url != null && actions != null) actionsPerUrl.put(url, new ArrayList<>(actions));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (target == null || target.isBlank()) {
            throw new CrawlValidationException("target", "seed URL is required");
        }
        try {
            URI u = URI.create(target.trim());
            String s = u.getScheme();
            if (s == null || !(s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https")) || u.getHost() == null) {
                throw new CrawlValidationException("target", "seed must be an absolute http(s) URL: " + target);
            }
        } catch (IllegalArgumentException e) {
            if (e instanceof CrawlValidationException) throw e;
            throw new CrawlValidationException("target", "malformed seed URL: " + target, e);
        }
        if (maxDepth < 0) throw new CrawlValidationException("maxDepth", "must be >= 0");
        if (maxPages < 0) throw new CrawlValidationException("maxPages", "must be >= 0");
        if (concurrency < 1) throw new CrawlValidationException("concurrency", "must be >= 1");
        if (minInterval == null || minInterval.isNegative()) {
            throw new CrawlValidationException("rateLimit", "must be >= 0");
        }
        if (settleDelay == null || settleDelay.isNegative()) {
            throw new CrawlValidationException("settleDelay", "must be >= 0");
        }
        if (includePattern != null) {
            try {
                Pattern.compile(includePattern);
            } catch (PatternSyntaxException e) {
                throw new CrawlValidationException("includePattern", "invalid filter pattern: " + e.getDescription(), e);
            }
        }
        if (outputFormats == null) throw new CrawlValidationException("outputFormats", "must not be null");
        if (outputFormats.contains(OutputFormat.SCREENSHOT) && outputFormats.contains(OutputFormat.SCREENSHOT_FULL_PAGE)) {
            // 둘 다 결과 키 "screenshot" 을 쓴다
            throw new CrawlValidationException("outputFormats", "screenshot and screenshot@fullPage are mutually exclusive");
        }
        if (outputDir == null) throw new CrawlValidationException("outputDir", "must not be null");
        if (browser.getTimeoutMs() <= 0) throw new CrawlValidationException("browser.timeoutMs", "must be > 0");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }
}
