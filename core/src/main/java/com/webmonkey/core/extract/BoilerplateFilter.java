package com.webmonkey.core.extract;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;

/**
 * 내비게이션/푸터/헤더/메뉴 판정.
 * class 또는 id 에 패턴이 부분 문자열로(대소문자 무시) 들어 있으면 boilerplate.
 */
public class BoilerplateFilter {

    public static final List<String> DEFAULT_PATTERNS = List.of("nav", "footer", "header", "menu");

    private final List<String> patterns;

    public BoilerplateFilter() {
        this(DEFAULT_PATTERNS);
    }

    public BoilerplateFilter(List<String> patterns) {
        this.patterns = patterns.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
    }

    public boolean isBoilerplate(Element e) {
        if (e == null) return false;
        return matches(e.attr("class")) || matches(e.id());
    }

    private boolean matches(String attr) {
        if (attr == null || attr.isEmpty()) return false;
        String lower = attr.toLowerCase(Locale.ROOT);
        for (String p : patterns) {
            if (lower.contains(p)) return true;
        }
        return false;
    }
}
