package com.webmonkey.core.render;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/** html(정리본) / rawHtml(원문) 출력 */
public final class HtmlRenderer {

    /** jsoup 으로 다시 직렬화한 들여쓰기 HTML */
    public String cleaned(String html, String baseUrl) {
        Document doc = Jsoup.parse(html == null ? "" : html, baseUrl == null ? "" : baseUrl);
        doc.outputSettings().prettyPrint(true).indentAmount(1);
        return doc.outerHtml();
    }

    /** 드라이버가 준 원문 그대로 */
    public String raw(String html) {
        return html == null ? "" : html;
    }
}
