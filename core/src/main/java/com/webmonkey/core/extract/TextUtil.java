package com.webmonkey.core.extract;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/** 추출기 공용 DOM/텍스트 헬퍼 */
final class TextUtil {
    private TextUtil() {}

    /**
     * 하위 텍스트 노드를 각각 양끝 공백 제거 후 구분자 없이 이어붙인다.
     * ("<p>Hello <b>World</b></p>" → "HelloWorld") 기존 출력물과 같은 결과를 내기 위한 규칙.
     */
    static String strippedText(Element el) {
        if (el == null) return "";
        StringBuilder sb = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    String t = strip(((TextNode) node).getWholeText());
                    if (!t.isEmpty()) sb.append(t);
                }
            }
            @Override public void tail(Node node, int depth) {}
        }, el);
        return sb.toString();
    }

    /** 유니코드 공백(nbsp 포함) 양끝 제거 */
    static String strip(String s) {
        if (s == null) return "";
        int b = 0, e = s.length();
        while (b < e && isWs(s.charAt(b))) b++;
        while (e > b && isWs(s.charAt(e - 1))) e--;
        return s.substring(b, e);
    }

    private static boolean isWs(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /** 자기 자신을 제외한 하위 요소 중 문서 순서상 첫 번째 일치 */
    static Element firstDescendant(Element root, Predicate<Element> p) {
        List<Element> all = root.getAllElements();
        for (int i = 1; i < all.size(); i++) {
            Element e = all.get(i);
            if (p.test(e)) return e;
        }
        return null;
    }

    /** class 속성 원문(소문자)에 토큰 중 하나라도 포함되는지 */
    static boolean classContainsAny(Element e, String... needles) {
        String cls = e.attr("class");
        if (cls.isEmpty()) return false;
        String lower = cls.toLowerCase(Locale.ROOT);
        for (String n : needles) {
            if (lower.contains(n)) return true;
        }
        return false;
    }
}
