package com.webmonkey.core.render;

import com.webmonkey.core.api.IDocumentRenderer;
import com.webmonkey.core.model.LinkRef;
import com.webmonkey.core.model.Metadata;
import com.webmonkey.core.model.PageDocument;
import com.webmonkey.core.model.Review;
import com.webmonkey.core.model.Section;
import com.webmonkey.core.model.Subsection;

import java.util.ArrayList;
import java.util.List;

/**
 * 문서 모델 → 마크다운. 순수 함수이며 같은 입력이면 바이트 단위로 같은 출력.
 *
 * <p>순서: 제목 → 섹션(헤드라인/설명/본문/링크/하위섹션) → 리뷰 → 메타데이터.
 * 각 블록 뒤에는 빈 줄 하나. 결과는 앞뒤 공백을 잘라낸 뒤 개행 하나로 끝난다
 * (내용이 없으면 빈 문자열).
 */
public final class MarkdownRenderer implements IDocumentRenderer {

    public static final String REVIEWS_HEADING = "# **Why We're #1 on Amazon**";

    /** 마크다운 끝에 붙일 메타데이터 필드 (이 순서대로) */
    public static final List<String> METADATA_FIELDS = List.of(
            "title", "description", "og:title", "og:description",
            "og:image", "twitter:image", "language", "viewport");

    @Override
    public String render(PageDocument doc) {
        List<String> md = new ArrayList<>();

        if (notEmpty(doc.getTitle())) {
            block(md, doc.getTitle());
        }

        for (Section s : doc.getSections()) {
            if (notEmpty(s.getHeadline())) {
                block(md, s.getHeadline().startsWith("#") ? s.getHeadline() : "# **" + s.getHeadline() + "**");
            }
            body(md, s);
            for (Subsection sub : s.getSubsections()) {
                if (notEmpty(sub.getHeadline())) block(md, "## " + sub.getHeadline());
                body(md, sub);
            }
        }

        if (!doc.getReviews().isEmpty()) {
            block(md, REVIEWS_HEADING);
            for (Review r : doc.getReviews()) {
                List<String> parts = new ArrayList<>();
                if (notEmpty(r.getAuthor())) parts.add(r.getAuthor());
                if (notEmpty(r.getDate())) parts.add(r.getDate());
                if (notEmpty(r.getPlatform())) parts.add("on " + r.getPlatform());
                if (notEmpty(r.getRating())) parts.add(r.getRating());
                if (notEmpty(r.getText())) {
                    parts.add(r.getText());
                    if (r.isReadMore()) parts.add("Read more");
                }
                if (!parts.isEmpty()) {
                    md.addAll(parts);
                    md.add("");
                }
            }
        }

        Metadata meta = doc.getMetadata();
        if (meta != null && !meta.isEmpty()) {
            block(md, "---");
            for (String field : METADATA_FIELDS) {
                List<String> values = meta.getAll(field);
                List<String> present = new ArrayList<>();
                for (String v : values) if (notEmpty(v)) present.add(v);
                if (present.isEmpty()) continue;
                for (String v : present) md.add(field + ": " + v);
                md.add("");
            }
        }

        String out = String.join("\n", md).strip();
        return out.isEmpty() ? "" : out + "\n";
    }

    /** 설명/본문/링크 (섹션과 하위섹션 공통) */
    private static void body(List<String> md, Subsection s) {
        if (notEmpty(s.getDescription())) block(md, s.getDescription());
        if (notEmpty(s.getContent()) && !s.getContent().equals(s.getDescription())) block(md, s.getContent());
        for (LinkRef l : s.getLinks()) {
            block(md, l.isAbsolute()
                    ? "[Redirect to " + l.getUrl() + "](" + l.getUrl() + ")"
                    : "[" + l.getText() + "](" + l.getUrl() + ")");
        }
    }

    private static void block(List<String> md, String line) {
        md.add(line);
        md.add("");
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }
}
