package com.webmonkey.core.util;

import com.webmonkey.core.model.CanonicalUrl;

import java.net.URI;
import java.util.Locale;

/** URL 정규화 + 도메인 판정 유틸 */
public final class UrlCanonicalizer {
    private UrlCanonicalizer(){}

    private static final String[] PSEUDO_SCHEMES = {"javascript:", "mailto:", "tel:", "data:"};

    /** 절대 URL 만 받는 단축형 */
    public static CanonicalUrl canonicalize(String raw) {
        return canonicalize(raw, null);
    }

    /**
     * 정규화 규칙:
     * - javascript:/mailto:/tel:/data:, 단독 fragment(#...), http(s) 이외 → null
     * - 상대 참조는 base 기준으로 절대화
     * - fragment 제거, query 원문 유지
     * - scheme/host 만 소문자 (path/query 대소문자 보존)
     * - 기본 포트 제거(http:80, https:443), 빈 경로 → "/"
     * 정규화 결과에 다시 적용해도 같은 값이 나온다.
     */
    public static CanonicalUrl canonicalize(String raw, String base) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty() || s.startsWith("#")) return null;
        String lower = s.toLowerCase(Locale.ROOT);
        for (String p : PSEUDO_SCHEMES) {
            if (lower.startsWith(p)) return null;
        }

        URI u = parse(s);
        if (u == null) return null;

        if (!u.isAbsolute()) {
            URI b = (base == null ? null : parse(base.trim()));
            if (b == null || !b.isAbsolute()) return null;
            u = resolve(b, u, s);
            if (u == null) return null;
        }
        return fromAbsolute(u);
    }

    /** 이미 정규화된 값이 seed 와 같은 host 인지 */
    public static boolean sameHost(CanonicalUrl a, CanonicalUrl b) {
        if (a == null || b == null) return false;
        return a.getHost().equals(b.getHost());
    }

    /** candidate 가 root host 의 하위 도메인인지 (자기 자신 제외) */
    public static boolean isSubdomainOf(String candidateHost, String rootHost) {
        if (candidateHost == null || rootHost == null || rootHost.isEmpty()) return false;
        return candidateHost.endsWith("." + rootHost);
    }

    // ------------ helpers ------------

    private static CanonicalUrl fromAbsolute(URI u) {
        String scheme = u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;

        String host = u.getHost();
        if (host == null || host.isEmpty()) return null;
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = u.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        return new CanonicalUrl(scheme, host, port, path, u.getRawQuery());
    }

    private static URI resolve(URI base, URI ref, String rawRef) {
        // java.net.URI 는 경로 없는 base("http://a.com") 에 상대경로를 붙이면 "/" 를 빠뜨린다
        URI b = base;
        if (b.getRawPath() == null || b.getRawPath().isEmpty()) {
            b = parse(base.getScheme() + "://" + base.getRawAuthority() + "/"
                    + (base.getRawQuery() == null ? "" : "?" + base.getRawQuery()));
            if (b == null) return null;
        }
        // query 만 있는 참조("?x=1")는 base 경로를 그대로 유지 (RFC 3986)
        if (rawRef.startsWith("?")) {
            return parse(b.getScheme() + "://" + b.getRawAuthority() + b.getRawPath() + rawRef);
        }
        try {
            return b.resolve(ref);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** 공백 등 흔한 비표준 문자를 인코딩해서 파싱, 실패 시 null */
    private static URI parse(String s) {
        try {
            return new URI(s.replace(" ", "%20").replace("|", "%7C"));
        } catch (Exception e) {
            return null;
        }
    }
}
