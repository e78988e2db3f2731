package com.webmonkey.core.util;

import com.webmonkey.core.api.CrawlValidationException;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.CrawlConfig.LinksFormat;
import com.webmonkey.core.model.ScrapeAction;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml 을 읽어 CrawlConfig 로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * sameDomainOnly: true
 * followSubdomains: false
 * rateLimitSeconds: 1.0
 * concurrency: 1
 * scope:
 *   maxDepth: 2
 *   maxPages: 0
 *   includePattern: "/docs/"
 *   excludePaths: ["/logout", "re:\\.pdf$"]
 * output:
 *   dir: "out"
 *   formats: [markdown, json, links]
 *   linksFormat: txt | json
 *   includeAssets: false
 * screenshot:
 *   settleMs: 500
 * browser:
 *   headless: true
 *   timeoutMs: 30000
 *   viewportWidth: 1920
 *   viewportHeight: 1080
 * actions:
 *   "https://example.com/login":
 *     - { type: write, selector: "#q", text: "hello" }
 *     - { type: press, key: ENTER }
 *     - { type: wait, milliseconds: 1500 }
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    /** 읽고 검증까지 */
    public static CrawlConfig load(Path yamlPath) throws IOException {
        CrawlConfig cfg = read(yamlPath);
        cfg.validate();
        return cfg;
    }

    public static CrawlConfig load(InputStream in) {
        CrawlConfig cfg = read(in);
        cfg.validate();
        return cfg;
    }

    /** 검증 없이 읽기만 한다 (명령행 덮어쓰기 전 단계) */
    public static CrawlConfig read(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return read(in);
        }
    }

    public static CrawlConfig read(InputStream in) {
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setBoolean(map, "sameDomainOnly", cfg::setSameDomainOnly);
        setBoolean(map, "followSubdomains", cfg::setFollowSubdomains);
        setDouble(map, "rateLimitSeconds", cfg::setRateLimitSeconds);
        setInt(map, "concurrency", cfg::setConcurrency);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", cfg::setMaxDepth);
            setInt(scope, "maxPages", cfg::setMaxPages);
            setString(scope, "includePattern", cfg::setIncludePattern);
            setStringList(scope, "excludePaths", cfg::setExcludePaths);
        }

        // 3) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
            setStringList(output, "formats", cfg::setOutputFormatNames);
            setEnum(output, "linksFormat", LinksFormat.class, cfg::setLinksFormat);
            setBoolean(output, "includeAssets", cfg::setIncludeAssets);
        }

        // 4) screenshot.*
        Map<String, Object> shot = getMap(map, "screenshot");
        if (shot != null) {
            setInt(shot, "settleMs", ms -> cfg.setSettleDelay(Duration.ofMillis(ms)));
        }

        // 5) browser.*
        Map<String, Object> browser = getMap(map, "browser");
        if (browser != null) {
            var b = cfg.browser();
            setBoolean(browser, "headless", b::setHeadless);
            setInt(browser, "timeoutMs", b::setTimeoutMs);
            setInt(browser, "viewportWidth", b::setViewportWidth);
            setInt(browser, "viewportHeight", b::setViewportHeight);
        }

        // 6) actions: url → [action...]
        Map<String, Object> actions = getMap(map, "actions");
        if (actions != null) {
            for (Map.Entry<String, Object> e : actions.entrySet()) {
                cfg.putActions(String.valueOf(e.getKey()), parseActions(e.getValue()));
            }
        }

        return cfg;
    }

    // ------------ helpers ------------
    private static List<ScrapeAction> parseActions(Object v) {
        if (!(v instanceof List<?> list)) {
            throw new CrawlValidationException("actions", "expected a list of actions, got: " + v);
        }
        List<ScrapeAction> out = new ArrayList<>();
        for (Object o : list) {
            if (!(o instanceof Map<?, ?> m)) {
                throw new CrawlValidationException("actions", "expected an action map, got: " + o);
            }
            out.add(ScrapeAction.fromMap(m));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        if (!s.isEmpty()) {
            List<String> out = new ArrayList<>();
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
            setter.accept(List.copyOf(out));
        }
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) {
            try {
                setter.accept(Integer.parseInt(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new CrawlValidationException(key, "not an integer: " + v, e);
            }
        }
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) {
            try {
                setter.accept(Double.parseDouble(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new CrawlValidationException(key, "not a number: " + v, e);
            }
        }
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new CrawlValidationException(key, "unknown value '" + s + "', expected one of "
                + Arrays.toString(type.getEnumConstants()));
    }
}
