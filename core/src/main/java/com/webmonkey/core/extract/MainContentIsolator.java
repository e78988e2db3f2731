package com.webmonkey.core.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * readability 방식 본문 분리.
 * 1) 비콘텐츠 태그 제거, boilerplate(class/id) 요소 제거
 * 2) 문단 점수를 부모/조부모에 누적해 최고 점수 컨테이너 선택
 * 3) 충분히 점수가 높은 형제까지 묶어 div 하나로 감싼다
 * 원본 Document 는 건드리지 않는다 (복제본에서 작업).
 */
public class MainContentIsolator {

    static final String WRAPPER_ID = "main-content";

    private static final String NON_CONTENT =
            "script, style, noscript, template, iframe, svg, canvas, object, embed, link, meta";

    private static final Pattern POSITIVE = Pattern.compile(
            "article|body|content|entry|hentry|main|page|post|text|blog|story|review|testimonial");
    private static final Pattern NEGATIVE = Pattern.compile(
            "combx|contact|foot|masthead|media|outbrain|promo|related|scroll|shoutbox|sidebar|sponsor|shopping|tags|tool|widget");

    private static final int MIN_PARAGRAPH_LEN = 25;

    private final BoilerplateFilter boilerplate;

    public MainContentIsolator() {
        this(new BoilerplateFilter());
    }

    public MainContentIsolator(BoilerplateFilter boilerplate) {
        this.boilerplate = Objects.requireNonNull(boilerplate, "boilerplate");
    }

    /** 본문 루트 요소. 항상 id="main-content" 인 div 를 돌려준다 (body 안에 붙어 있어 baseUri 가 유지됨). */
    public Element isolate(Document source) {
        Document doc = source.clone();
        Element body = doc.body();
        body.select(NON_CONTENT).remove();
        for (Element e : body.select("*")) {
            if (e != body && boilerplate.isBoilerplate(e)) e.remove();
        }

        Map<Element, Double> scores = score(body);
        Element top = null;
        double best = 0;
        for (Map.Entry<Element, Double> en : scores.entrySet()) {
            double s = en.getValue() * (1 - linkDensity(en.getKey()));
            en.setValue(s);
            if (top == null || s > best) {
                top = en.getKey();
                best = s;
            }
        }

        List<Element> picked = new ArrayList<>();
        if (top == null || top == body) {
            picked.addAll(body.children());
        } else {
            Element parent = top.parent();
            double threshold = Math.max(10, best * 0.2);
            for (Element sib : parent == null ? List.of(top) : parent.children()) {
                if (sib == top) {
                    picked.add(sib);
                } else if (scores.getOrDefault(sib, 0.0) >= threshold) {
                    picked.add(sib);
                } else if (sib.normalName().equals("p")) {
                    String t = sib.text();
                    double ld = linkDensity(sib);
                    if ((t.length() > 80 && ld < 0.25) || (t.length() > 0 && ld == 0 && t.contains(". "))) {
                        picked.add(sib);
                    }
                }
            }
        }

        Element wrapper = new Element("div").attr("id", WRAPPER_ID);
        for (Element e : picked) wrapper.appendChild(e);   // appendChild 는 원래 부모에서 떼어낸다
        body.empty();
        body.appendChild(wrapper);
        return wrapper;
    }

    private Map<Element, Double> score(Element body) {
        Map<Element, Double> scores = new IdentityHashMap<>();
        for (Element p : body.select("p, pre, td")) {
            String text = p.text();
            if (text.length() < MIN_PARAGRAPH_LEN) continue;
            Element parent = p.parent();
            if (parent == null) continue;
            Element grand = parent.parent();

            double s = 1 + commas(text) + Math.min(text.length() / 100, 3);
            scores.merge(parent, initial(parent) + s, (a, b) -> a + s);
            if (grand != null) scores.merge(grand, initial(grand) + s / 2, (a, b) -> a + s / 2);
        }
        return scores;
    }

    private static double initial(Element e) {
        double s;
        switch (e.normalName()) {
            case "div": case "article": case "section": case "main": s = 5; break;
            case "pre": case "td": case "blockquote": s = 3; break;
            case "address": case "ol": case "ul": case "dl": case "dd": case "dt": case "li": case "form": s = -3; break;
            case "h1": case "h2": case "h3": case "h4": case "h5": case "h6": case "th": s = -5; break;
            default: s = 0;
        }
        return s + classWeight(e);
    }

    private static double classWeight(Element e) {
        double w = 0;
        String cls = e.attr("class").toLowerCase(Locale.ROOT);
        String id = e.id().toLowerCase(Locale.ROOT);
        if (!cls.isEmpty()) {
            if (NEGATIVE.matcher(cls).find()) w -= 25;
            if (POSITIVE.matcher(cls).find()) w += 25;
        }
        if (!id.isEmpty()) {
            if (NEGATIVE.matcher(id).find()) w -= 25;
            if (POSITIVE.matcher(id).find()) w += 25;
        }
        return w;
    }

    private static int commas(String text) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) if (text.charAt(i) == ',') n++;
        return n;
    }

    private static double linkDensity(Element e) {
        int total = e.text().length();
        if (total == 0) return 0;
        int linked = 0;
        for (Element a : e.select("a")) linked += a.text().length();
        return Math.min(1.0, (double) linked / total);
    }
}
