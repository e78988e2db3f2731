package com.webmonkey.core.export;

import com.webmonkey.core.model.CanonicalUrl;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 출력 파일 경로 규칙.
 * {baseDir}/{host}/{format}/{slug}{ext}, 요약은 {baseDir}/{host}/crawl-{timestamp}.json
 */
public final class OutputNaming {
    private OutputNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    private static final int MAX_SLUG = 80;

    public static Path hostDir(Path baseDir, CanonicalUrl url) {
        return base(baseDir).resolve(safeHost(url));
    }

    public static Path pagePath(Path baseDir, CanonicalUrl url, String formatDir, String extension) {
        return hostDir(baseDir, url).resolve(formatDir).resolve(slug(url) + extension);
    }

    public static Path summaryPath(Path baseDir, CanonicalUrl seed, Instant startedAt) {
        return hostDir(baseDir, seed).resolve("crawl-" + TS_FMT.format(startedAt) + ".json");
    }

    /**
     * 경로+쿼리 기반 파일명. 루트는 "index".
     * 소문자화/치환/잘라내기로 원래 경로와 달라지면 URL 해시를 붙여 서로 다른 URL 이 같은 파일을 덮어쓰지 않게 한다.
     */
    public static String slug(CanonicalUrl url) {
        String path = url.getPath() == null ? "" : url.getPath();
        String s = path;
        if (url.getQuery() != null) s += "-" + url.getQuery();
        s = s.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9._-]", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^[-.]+|-+$", "");
        if (s.isEmpty() && url.getQuery() == null) return "index";

        boolean lossless = url.getQuery() == null
                && s.equals(path.startsWith("/") ? path.substring(1) : path)
                && !s.equals("index")
                && s.length() <= MAX_SLUG;
        if (lossless) return s;

        String h = Integer.toHexString(url.toString().hashCode());
        int room = MAX_SLUG - h.length() - 1;
        if (s.length() > room) s = s.substring(0, room).replaceAll("-+$", "");
        return s.isEmpty() ? h : s + "-" + h;
    }

    private static String safeHost(CanonicalUrl url) {
        String h = url.getHost().replaceAll("[^a-z0-9._-]", "-");
        return url.getPort() > 0 ? h + "_" + url.getPort() : h;
    }

    private static Path base(Path baseDir) {
        return baseDir == null ? Path.of("out") : baseDir;
    }
}
