package com.webmonkey.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거.
 * 핸들러 세팅(앱 LogSetup 등) 후 호출하면 한 줄 JSON 으로 찍힌다.
 * 사용: {@code SLOG.info("page-done", "url", u, "depth", 1)}
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,   event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,   event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING,event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = format(comp, lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /** 테스트/재사용을 위해 분리한 포맷터 */
    static String format(String comp, Level lvl, String event, Throwable t, Object... kvs) {
        ObjectMapper om = Jsons.mapper();
        ObjectNode n = om.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);

        // kvs: "key", value, ...
        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                n.set(String.valueOf(kvs[i]), toNode(om, kvs[i + 1]));
            }
            if (kvs.length % 2 == 1) { // 홀수 방지용
                n.put("_kv_mismatch", true);
            }
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", String.valueOf(t.getMessage()));
        }
        try {
            return om.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Jackson 이 직렬화하지 못하는 값은 toString 으로 남긴다. */
    private static JsonNode toNode(ObjectMapper om, Object v) {
        if (v == null) return NullNode.getInstance();
        try {
            return om.valueToTree(v);
        } catch (IllegalArgumentException e) {
            return TextNode.valueOf(String.valueOf(v));
        }
    }
}
