package com.webmonkey.core.util;

import com.webmonkey.core.model.CanonicalUrl;

import java.util.List;
import java.util.regex.Pattern;

/** excludePaths 규칙 매칭 (정규화 URL 문자열 전체 대상) */
public final class UrlExclusion {
    private UrlExclusion(){}

    /**
     * patterns 지원:
     * <ul>
     *   <li>접두(prefix): {@code "/oauth2"} 또는 {@code "https://host/path"}</li>
     *   <li>glob: {@code '*'}, {@code '?'} 포함
     *       (예: {@code "*&#47;logout*"}, {@code "/admin/*"})
     *   </li>
     *   <li>정규식: {@code "re:"} 접두 (예: {@code re:\?.*token=.*})</li>
     * </ul>
     */
    public static boolean isExcluded(CanonicalUrl url, List<String> patterns){
        if (url == null || patterns == null || patterns.isEmpty()) return false;
        final String s = url.toString();
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;

            if (p.startsWith("re:")) {
                if (Pattern.compile(p.substring(3), Pattern.CASE_INSENSITIVE).matcher(s).find()) return true;

            } else if (p.indexOf('*') >= 0 || p.indexOf('?') >= 0) {
                if (Pattern.compile(globToRegex(p), Pattern.CASE_INSENSITIVE).matcher(s).find()) return true;

            } else {
                if (s.startsWith(p)) return true;

                // 호스트 상대 prefix: "/oauth2" 같은 경우
                if (p.startsWith("/")) {
                    String pathAndMore = url.getPath() + (url.getQuery() == null ? "" : "?" + url.getQuery());
                    if (pathAndMore.startsWith(p)) return true;
                }
            }
        }
        return false;
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append("[^/]*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        // "**" 는 경로 구분자까지 포함
        return r.toString().replace("[^/]*[^/]*", ".*");
    }
}
