package com.webmonkey.core.extract;

import com.webmonkey.core.model.LinkRef;
import com.webmonkey.core.model.Section;
import com.webmonkey.core.model.Subsection;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * section/div/article 블록마다 섹션 하나 (문서 순서, 루트 포함, 중첩 블록도 각각).
 * - headline: 첫 h1..h6
 * - description: 첫 p|span
 * - content: 전체 텍스트 (description 과 같으면 비움)
 * - links: 텍스트가 있는 a[href], 상대경로는 문서 base 기준 절대화
 * - subsections: 직계 자식 div|section (같은 규칙, 중첩 없음)
 */
public class BlockSectionHeuristic implements SectionHeuristic {

    private static final String BLOCKS = "section, div, article";
    private static final String HEADINGS = "h1, h2, h3, h4, h5, h6";

    private final BoilerplateFilter boilerplate;

    public BlockSectionHeuristic() {
        this(new BoilerplateFilter());
    }

    public BlockSectionHeuristic(BoilerplateFilter boilerplate) {
        this.boilerplate = Objects.requireNonNull(boilerplate, "boilerplate");
    }

    @Override
    public List<Section> sections(Element mainRoot) {
        List<Section> out = new ArrayList<>();
        if (mainRoot == null) return out;
        for (Element block : mainRoot.select(BLOCKS)) {
            if (boilerplate.isBoilerplate(block)) continue;

            Section.Builder b = Section.sectionBuilder();
            Fields f = fields(block);
            b.headline(f.headline).description(f.description).content(f.content).links(f.links);

            for (Element child : block.children()) {
                String tag = child.normalName();
                if (!tag.equals("div") && !tag.equals("section")) continue;
                Fields sf = fields(child);
                b.subsection(Subsection.builder()
                        .headline(sf.headline)
                        .description(sf.description)
                        .content(sf.content)
                        .links(sf.links)
                        .build());
            }

            Section s = b.build();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    private static Fields fields(Element el) {
        Fields f = new Fields();
        Element h = el.selectFirst(HEADINGS);
        if (h != null && h != el) f.headline = TextUtil.strippedText(h);

        Element d = TextUtil.firstDescendant(el, e -> e.normalName().equals("p") || e.normalName().equals("span"));
        if (d != null) f.description = TextUtil.strippedText(d);

        String all = TextUtil.strippedText(el);
        if (!all.isEmpty() && !all.equals(f.description)) f.content = all;

        f.links = links(el);
        return f;
    }

    static List<LinkRef> links(Element el) {
        List<LinkRef> out = new ArrayList<>();
        for (Element a : el.select("a[href]")) {
            String href = a.attr("href");
            String text = TextUtil.strippedText(a);
            if (href.isEmpty() || text.isEmpty()) continue;
            String url = href;
            if (!href.startsWith("http://") && !href.startsWith("https://")) {
                String abs = a.absUrl("href");
                if (!abs.isEmpty()) url = abs;
            }
            out.add(new LinkRef(text, url));
        }
        return out;
    }

    private static final class Fields {
        String headline = "";
        String description = "";
        String content = "";
        List<LinkRef> links = List.of();
    }
}
