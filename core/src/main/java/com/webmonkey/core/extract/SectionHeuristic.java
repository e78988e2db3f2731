package com.webmonkey.core.extract;

import com.webmonkey.core.model.Section;
import org.jsoup.nodes.Element;

import java.util.List;

/** 본문 루트에서 섹션 목록을 뽑는 전략. 빈 섹션은 돌려주지 않는다. */
public interface SectionHeuristic {
    List<Section> sections(Element mainRoot);
}
