package com.webmonkey.core.util;

import com.webmonkey.core.api.CrawlValidationException;
import com.webmonkey.core.model.CanonicalUrl;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 호출자가 준 정규식으로 정규화 URL 을 거른다 (find 의미, 대소문자 구분).
 * 패턴이 없으면 모두 통과.
 */
public final class UrlPatternFilter {
    private static final UrlPatternFilter ACCEPT_ALL = new UrlPatternFilter(null);

    private final Pattern pattern;

    private UrlPatternFilter(Pattern pattern) {
        this.pattern = pattern;
    }

    /** 잘못된 패턴은 탐색 전에 검증 오류로 거부한다 */
    public static UrlPatternFilter of(String regex) {
        if (regex == null || regex.isBlank()) return ACCEPT_ALL;
        try {
            return new UrlPatternFilter(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new CrawlValidationException("includePattern", "invalid filter pattern: " + e.getDescription(), e);
        }
    }

    public static UrlPatternFilter acceptAll() { return ACCEPT_ALL; }

    public boolean accepts(CanonicalUrl url) {
        if (url == null) return false;
        return pattern == null || pattern.matcher(url.toString()).find();
    }

    public boolean accepts(String url) {
        if (url == null) return false;
        return pattern == null || pattern.matcher(url).find();
    }

    @Override public String toString() { return pattern == null ? "*" : pattern.pattern(); }
}
