package com.webmonkey.core.extract;

import com.webmonkey.core.model.Metadata;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Arrays;

/**
 * meta 태그 + 파생 필드.
 * - name(없으면 property) → content, 빈 값은 건너뜀
 * - og:title/og:url/og:description/og:image 는 목록으로 누적, 나머지는 마지막 값
 * - title, favicon, og:site_name/og:type/viewport 기본값, language(html lang, 기본 en-US)
 * - url (스크랩 id, 원본 URL, 상태 코드는 PageDocument 필드로만 둔다)
 */
public class MetadataExtractor {

    public static final String DEFAULT_LANGUAGE = "en-US";
    public static final String DEFAULT_OG_TYPE = "website";
    public static final String DEFAULT_VIEWPORT = "width=device-width, initial-scale=1";

    public Metadata extract(Document doc, String url) {
        Metadata.Builder m = Metadata.builder();
        m.set("url", url);

        Element html = doc.selectFirst("html");
        m.set("language", html != null && html.hasAttr("lang") ? html.attr("lang") : DEFAULT_LANGUAGE);

        for (Element meta : doc.select("meta")) {
            String name = meta.hasAttr("name") ? meta.attr("name") : meta.attr("property");
            String content = meta.attr("content");
            if (name.isEmpty() || content.isEmpty()) continue;
            m.put(name, content);
        }

        String favicon = favicon(doc);
        if (favicon != null) m.set("favicon", favicon);

        Element titleEl = doc.selectFirst("title");
        String title = titleEl == null ? null : TextUtil.strippedText(titleEl);
        if (title != null) m.set("title", title);

        if (!m.contains("og:site_name") && title != null) {
            m.set("og:site_name", title);
        }
        m.putIfAbsent("og:type", DEFAULT_OG_TYPE);
        m.putIfAbsent("viewport", DEFAULT_VIEWPORT);
        return m.build();
    }

    /** rel 에 icon 토큰이 있는 첫 link, 없으면 "shortcut icon" */
    private static String favicon(Document doc) {
        for (Element link : doc.select("link[rel]")) {
            String rel = link.attr("rel");
            boolean icon = rel.equals("shortcut icon")
                    || Arrays.asList(rel.trim().split("\\s+")).contains("icon");
            if (icon && !link.attr("href").isEmpty()) return link.attr("href");
        }
        return null;
    }
}
