package com.webmonkey.core.model;

import com.webmonkey.core.api.CrawlValidationException;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 추출 전에 드라이버에 순서대로 실행하는 스크립트 액션.
 * <ul>
 *   <li>wait: milliseconds (기본 1000)</li>
 *   <li>click: selector</li>
 *   <li>write: selector, text</li>
 *   <li>press: key (기본 ENTER)</li>
 * </ul>
 */
public final class ScrapeAction {

    public enum Type { WAIT, CLICK, WRITE, PRESS }

    public static final long DEFAULT_WAIT_MS = 1000;
    public static final String DEFAULT_KEY = "ENTER";

    private final Type type;
    private final long milliseconds;
    private final String selector;
    private final String text;
    private final String key;

    private ScrapeAction(Type type, long milliseconds, String selector, String text, String key) {
        this.type = Objects.requireNonNull(type, "type");
        this.milliseconds = milliseconds;
        this.selector = selector;
        this.text = text;
        this.key = key;
    }

    public static ScrapeAction waitFor(long ms) { return new ScrapeAction(Type.WAIT, Math.max(0, ms), null, null, null); }
    public static ScrapeAction click(String selector) { return new ScrapeAction(Type.CLICK, 0, selector, null, null); }
    public static ScrapeAction write(String selector, String text) {
        return new ScrapeAction(Type.WRITE, 0, selector, text == null ? "" : text, null);
    }
    public static ScrapeAction press(String key) {
        String k = (key == null || key.isBlank()) ? DEFAULT_KEY : key.trim().toUpperCase(Locale.ROOT);
        return new ScrapeAction(Type.PRESS, 0, null, null, k);
    }

    /** YAML/JSON 맵 형태 {type: ..., ...} 에서 생성 */
    public static ScrapeAction fromMap(Map<?, ?> m) {
        Object t = m.get("type");
        if (t == null) throw new CrawlValidationException("actions", "action without type: " + m);
        String type = String.valueOf(t).trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "wait": {
                Object ms = m.get("milliseconds");
                long v = (ms instanceof Number n) ? n.longValue()
                        : (ms == null ? DEFAULT_WAIT_MS : Long.parseLong(String.valueOf(ms).trim()));
                return waitFor(v);
            }
            case "click":
                return click(str(m.get("selector")));
            case "write":
                return write(str(m.get("selector")), str(m.get("text")));
            case "press":
                return press(str(m.get("key")));
            default:
                throw new CrawlValidationException("actions", "unknown action type '" + t + "'");
        }
    }

    private static String str(Object o) { return o == null ? null : String.valueOf(o); }

    public Type getType() { return type; }
    public long getMilliseconds() { return milliseconds; }
    public String getSelector() { return selector; }
    public String getText() { return text; }
    public String getKey() { return key; }

    @Override public String toString() {
        switch (type) {
            case WAIT:  return "wait(" + milliseconds + "ms)";
            case CLICK: return "click(" + selector + ")";
            case WRITE: return "write(" + selector + ")";
            default:    return "press(" + key + ")";
        }
    }
}
