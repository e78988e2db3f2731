package com.webmonkey.core.driver;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 가짜 웹사이트: URL → HTML, 리다이렉트, 실패 URL, 존재하는 선택자.
 * {@link #factory()} 가 만드는 드라이버들이 이 상태를 공유한다 (워커 여러 개 테스트용).
 */
public final class FakeSite {
    final Map<String, String> pages = new ConcurrentHashMap<>();
    final Map<String, String> redirects = new ConcurrentHashMap<>();
    final Map<String, Integer> statuses = new ConcurrentHashMap<>();
    final Set<String> failing = ConcurrentHashMap.newKeySet();
    final Set<String> fatal = ConcurrentHashMap.newKeySet();
    final Set<String> elements = ConcurrentHashMap.newKeySet();
    final Set<String> fatalElements = ConcurrentHashMap.newKeySet();
    final List<String> navigations = new CopyOnWriteArrayList<>();
    final AtomicInteger opened = new AtomicInteger();
    final AtomicInteger openNow = new AtomicInteger();
    volatile long navigateDelayMs;

    public FakeSite page(String url, String html) { pages.put(url, html); return this; }

    /** 제목 + 문단 + 링크만 있는 단순 페이지 */
    public FakeSite linkPage(String url, String title, String... hrefs) {
        return page(url, html(title, hrefs));
    }

    public FakeSite redirect(String from, String to) { redirects.put(from, to); return this; }
    public FakeSite status(String url, int code) { statuses.put(url, code); return this; }
    public FakeSite fail(String url) { failing.add(url); return this; }
    public FakeSite failFatal(String url) { fatal.add(url); return this; }
    public FakeSite element(String selector) { elements.add(selector); return this; }
    public FakeSite fatalElement(String selector) { fatalElements.add(selector); return this; }
    public FakeSite navigateDelay(long ms) { this.navigateDelayMs = ms; return this; }

    public DriverFactory factory() { return () -> new FakeBrowserDriver(this); }

    /** 모든 드라이버의 navigate 호출 순서 */
    public List<String> navigations() { return List.copyOf(navigations); }
    /** 지금까지 연 드라이버 수 */
    public int opened() { return opened.get(); }
    /** 아직 닫히지 않은 드라이버 수 */
    public int openNow() { return openNow.get(); }

    public static String html(String title, String... hrefs) {
        StringBuilder sb = new StringBuilder();
        sb.append("<html><head><title>").append(title).append("</title></head><body><div class=\"content\">")
          .append("<h1>").append(title).append("</h1>")
          .append("<p>Body of ").append(title).append("</p>");
        for (String h : hrefs) {
            sb.append("<a href=\"").append(h).append("\">").append(h).append("</a>");
        }
        sb.append("</div></body></html>");
        return sb.toString();
    }
}
