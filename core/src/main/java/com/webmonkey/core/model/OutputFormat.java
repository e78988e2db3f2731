package com.webmonkey.core.model;

import com.webmonkey.core.api.CrawlValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** 페이지별로 요청할 수 있는 출력 형식. wire 이름은 설정/결과 키에 그대로 쓴다. */
public enum OutputFormat {
    MARKDOWN("markdown", "markdown", ".md"),
    JSON("json", "json", ".json"),
    HTML("html", "html", ".html"),
    RAW_HTML("rawHtml", "rawHtml", ".html"),
    LINKS("links", "links", ".txt"),
    SCREENSHOT("screenshot", "screenshot", ".png"),
    SCREENSHOT_FULL_PAGE("screenshot@fullPage", "screenshot", ".png");

    private final String wireName;
    private final String resultKey;
    private final String extension;

    OutputFormat(String wireName, String resultKey, String extension) {
        this.wireName = wireName;
        this.resultKey = resultKey;
        this.extension = extension;
    }

    public String wireName() { return wireName; }

    /** PageResult.formats 에 들어가는 키 (두 스크린샷 모드는 같은 키를 쓴다) */
    public String resultKey() { return resultKey; }

    /** 기본 파일 확장자 (links 는 .txt, JSON 저장 시 .json) */
    public String extension() { return extension; }

    public boolean isScreenshot() { return this == SCREENSHOT || this == SCREENSHOT_FULL_PAGE; }

    /** wire 이름(대소문자 무시) 또는 enum 이름으로 찾는다. 없으면 검증 오류. */
    public static OutputFormat fromWireName(String name) {
        if (name != null) {
            String s = name.trim();
            for (OutputFormat f : values()) {
                if (f.wireName.equalsIgnoreCase(s) || f.name().equalsIgnoreCase(s)) return f;
            }
        }
        throw new CrawlValidationException("outputFormats", "unsupported output format '" + name + "'");
    }

    public static Set<OutputFormat> parseAll(Collection<String> names) {
        Set<OutputFormat> out = new LinkedHashSet<>();
        if (names == null) return out;
        for (String n : names) out.add(fromWireName(n));
        return out;
    }

    public static List<String> wireNames(Collection<OutputFormat> formats) {
        List<String> out = new ArrayList<>();
        for (OutputFormat f : formats) out.add(f.wireName);
        return out;
    }
}
