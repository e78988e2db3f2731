package com.webmonkey.core.driver;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitUntilState;
import com.webmonkey.core.model.CrawlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Playwright(Chromium) 기반 {@link BrowserDriver}.
 * 인스턴스마다 Playwright/Browser/Page 를 하나씩 소유하며 close() 에서 모두 정리한다.
 */
public final class PlaywrightBrowserDriver implements BrowserDriver {

    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightBrowserDriver.class);

    // 대문자 키 이름 → Playwright 키 이름
    private static final Map<String, String> KEYS = Map.ofEntries(
            Map.entry("ENTER", "Enter"),
            Map.entry("RETURN", "Enter"),
            Map.entry("TAB", "Tab"),
            Map.entry("ESCAPE", "Escape"),
            Map.entry("ESC", "Escape"),
            Map.entry("SPACE", " "),
            Map.entry("BACKSPACE", "Backspace"),
            Map.entry("DELETE", "Delete"),
            Map.entry("ARROW_UP", "ArrowUp"),
            Map.entry("ARROW_DOWN", "ArrowDown"),
            Map.entry("ARROW_LEFT", "ArrowLeft"),
            Map.entry("ARROW_RIGHT", "ArrowRight"),
            Map.entry("UP", "ArrowUp"),
            Map.entry("DOWN", "ArrowDown"),
            Map.entry("LEFT", "ArrowLeft"),
            Map.entry("RIGHT", "ArrowRight"),
            Map.entry("PAGE_UP", "PageUp"),
            Map.entry("PAGE_DOWN", "PageDown"),
            Map.entry("HOME", "Home"),
            Map.entry("END", "End")
    );

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private int lastStatus = -1;

    public PlaywrightBrowserDriver(CrawlConfig.BrowserCfg cfg) {
        Objects.requireNonNull(cfg, "cfg");
        Playwright pw = null;
        try {
            pw = Playwright.create();
            this.browser = pw.chromium().launch(new BrowserType.LaunchOptions().setHeadless(cfg.isHeadless()));
            this.context = browser.newContext(new Browser.NewContextOptions()
                    .setViewportSize(cfg.getViewportWidth(), cfg.getViewportHeight()));
            this.page = context.newPage();
            page.setDefaultTimeout(cfg.getTimeoutMs());
            page.setDefaultNavigationTimeout(cfg.getTimeoutMs());
            this.playwright = pw;
        } catch (PlaywrightException e) {
            if (pw != null) pw.close();
            throw DriverException.fatal("failed to launch browser: " + e.getMessage(), e);
        }
        LOG.debug("Playwright browser launched (headless={}, viewport={}x{})",
                cfg.isHeadless(), cfg.getViewportWidth(), cfg.getViewportHeight());
    }

    /** 설정 기반 팩토리 */
    public static DriverFactory factory(CrawlConfig.BrowserCfg cfg) {
        return () -> new PlaywrightBrowserDriver(cfg);
    }

    @Override
    public void navigate(String url) {
        try {
            Response r = page.navigate(url, new Page.NavigateOptions().setWaitUntil(WaitUntilState.LOAD));
            lastStatus = r == null ? -1 : r.status();
        } catch (PlaywrightException e) {
            throw wrap("navigate " + url, e);
        }
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public String pageSource() {
        try {
            return page.content();
        } catch (PlaywrightException e) {
            throw wrap("content", e);
        }
    }

    @Override
    public int lastStatus() {
        return lastStatus;
    }

    @Override
    public Object executeScript(String js) {
        try {
            return page.evaluate(js);
        } catch (PlaywrightException e) {
            throw wrap("evaluate", e);
        }
    }

    @Override
    public void scrollTo(int y) {
        try {
            page.evaluate("y => window.scrollTo(0, y)", y);
        } catch (PlaywrightException e) {
            throw wrap("scroll", e);
        }
    }

    @Override
    public byte[] captureViewport() {
        try {
            return page.screenshot(new Page.ScreenshotOptions().setFullPage(false));
        } catch (PlaywrightException e) {
            throw wrap("screenshot", e);
        }
    }

    @Override
    public ElementHandle findElement(String cssSelector) {
        Locator loc;
        try {
            loc = page.locator(cssSelector).first();
            if (loc.count() == 0) throw new ElementNotFoundException(cssSelector);
        } catch (PlaywrightException e) {
            throw wrap("locate " + cssSelector, e);
        }
        return new LocatorHandle(loc);
    }

    @Override
    public void pressKey(String key) {
        String k = KEYS.getOrDefault(key.toUpperCase(Locale.ROOT), key);
        try {
            page.keyboard().press(k);
        } catch (PlaywrightException e) {
            throw wrap("press " + key, e);
        }
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException e) {
            LOG.debug("browser close failed: {}", e.toString());
        } finally {
            playwright.close();
        }
    }

    /** 페이지/브라우저가 죽었으면 fatal 로 올린다 */
    private DriverException wrap(String op, PlaywrightException e) {
        boolean dead = page.isClosed() || !browser.isConnected();
        return new DriverException(op + " failed: " + e.getMessage(), e, dead);
    }

    private final class LocatorHandle implements ElementHandle {
        private final Locator loc;

        LocatorHandle(Locator loc) { this.loc = loc; }

        @Override public void click() {
            try { loc.click(); } catch (PlaywrightException e) { throw wrap("click", e); }
        }

        @Override public void clear() {
            try { loc.clear(); } catch (PlaywrightException e) { throw wrap("clear", e); }
        }

        @Override public void sendKeys(String text) {
            try { loc.pressSequentially(text); } catch (PlaywrightException e) { throw wrap("type", e); }
        }
    }
}
