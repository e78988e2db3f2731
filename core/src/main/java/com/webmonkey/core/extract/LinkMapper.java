package com.webmonkey.core.extract;

import com.webmonkey.core.api.CrawlValidationException;
import com.webmonkey.core.model.CanonicalUrl;
import com.webmonkey.core.model.PageSnapshot;
import com.webmonkey.core.util.UrlCanonicalizer;
import com.webmonkey.core.util.UrlPatternFilter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * 페이지의 링크 지도: a[href] (+ 선택적으로 img/stylesheet/script 자산) 를 정규화해
 * 중복 제거 후 사전순으로 돌려준다.
 */
public class LinkMapper {

    /** 매핑 옵션. 잘못된 base/패턴은 생성 시점에 검증 오류. */
    public static final class Options {
        private String baseOverride;
        private boolean includeAssets;
        private UrlPatternFilter filter = UrlPatternFilter.acceptAll();

        public static Options defaults() { return new Options(); }

        public Options baseOverride(String base) {
            if (base != null && !base.isBlank()) {
                URI u;
                try {
                    u = URI.create(base.trim());
                } catch (IllegalArgumentException e) {
                    throw new CrawlValidationException("baseUrl", "error parsing base URL: " + e.getMessage(), e);
                }
                if (u.getScheme() == null || u.getRawAuthority() == null) {
                    throw new CrawlValidationException("baseUrl", "invalid base URL: " + base);
                }
                this.baseOverride = base.trim();
            } else {
                this.baseOverride = null;
            }
            return this;
        }

        public Options includeAssets(boolean v) { this.includeAssets = v; return this; }

        public Options filter(String regex) { this.filter = UrlPatternFilter.of(regex); return this; }

        public String getBaseOverride() { return baseOverride; }
        public boolean isIncludeAssets() { return includeAssets; }
    }

    public List<String> map(PageSnapshot snapshot, Options opts) {
        Document doc = Jsoup.parse(snapshot.getHtml(), snapshot.getUrl());
        return map(doc, snapshot.getUrl(), opts == null ? Options.defaults() : opts);
    }

    List<String> map(Document doc, String pageUrl, Options opts) {
        String base = opts.baseOverride != null ? opts.baseOverride : pageUrl;
        TreeSet<String> links = new TreeSet<>();

        for (Element a : doc.select("a[href]")) add(links, a.attr("href"), base, opts);
        if (opts.includeAssets) {
            for (Element img : doc.select("img[src]")) add(links, img.attr("src"), base, opts);
            for (Element css : doc.select("link[rel=stylesheet][href]")) add(links, css.attr("href"), base, opts);
            for (Element js : doc.select("script[src]")) add(links, js.attr("src"), base, opts);
        }
        return new ArrayList<>(links);
    }

    private static void add(TreeSet<String> out, String raw, String base, Options opts) {
        CanonicalUrl c = UrlCanonicalizer.canonicalize(raw, base);
        if (c == null) return;
        if (!opts.filter.accepts(c)) return;
        out.add(c.toString());
    }
}
