package com.webmonkey.core.extract;

import com.webmonkey.core.api.IContentExtractor;
import com.webmonkey.core.model.Metadata;
import com.webmonkey.core.model.PageDocument;
import com.webmonkey.core.model.PageSnapshot;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

/**
 * 기본 jsoup 기반 추출기.
 * 메타데이터 → 본문 분리 → 섹션 → 리뷰 → JSON-LD 순으로 진행하고,
 * 단계별 실패는 해당 필드를 비운 채 계속한다.
 */
public class JsoupContentExtractor implements IContentExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupContentExtractor.class);

    private final MetadataExtractor metadata;
    private final MainContentIsolator isolator;
    private final SectionHeuristic sections;
    private final ReviewHeuristic reviews;
    private final StructuredDataExtractor structured;

    public JsoupContentExtractor() {
        this(new BoilerplateFilter());
    }

    public JsoupContentExtractor(BoilerplateFilter boilerplate) {
        this(new MetadataExtractor(), new MainContentIsolator(boilerplate),
                new BlockSectionHeuristic(boilerplate), new ClassSubstringReviewHeuristic(),
                new StructuredDataExtractor());
    }

    public JsoupContentExtractor(MetadataExtractor metadata, MainContentIsolator isolator,
                                 SectionHeuristic sections, ReviewHeuristic reviews,
                                 StructuredDataExtractor structured) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.isolator = Objects.requireNonNull(isolator, "isolator");
        this.sections = Objects.requireNonNull(sections, "sections");
        this.reviews = Objects.requireNonNull(reviews, "reviews");
        this.structured = Objects.requireNonNull(structured, "structured");
    }

    @Override
    public PageDocument extract(PageSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        String url = snapshot.getUrl();
        Document doc = Jsoup.parse(snapshot.getHtml(), url);
        UUID scrapeId = UUID.randomUUID();

        Metadata meta;
        try {
            meta = metadata.extract(doc, url);
        } catch (RuntimeException e) {
            LOG.warn("Metadata extraction failed for {}: {}", url, e.toString());
            meta = Metadata.empty();
        }

        PageDocument.Builder b = PageDocument.builder()
                .title(meta.getString("title"))
                .metadata(meta)
                .scrapeId(scrapeId)
                .sourceUrl(url)
                .statusCode(snapshot.getStatusCode());

        try {
            Element main = isolator.isolate(doc);
            sections.sections(main).forEach(b::section);
            reviews.reviews(main).forEach(b::review);
        } catch (RuntimeException e) {
            LOG.warn("Content extraction failed for {}: {}", url, e.toString());
        }

        try {
            structured.extract(doc).forEach(b::structuredData);
        } catch (RuntimeException e) {
            LOG.warn("JSON-LD extraction failed for {}: {}", url, e.toString());
        }
        return b.build();
    }
}
