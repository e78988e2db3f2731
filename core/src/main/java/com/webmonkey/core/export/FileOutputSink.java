package com.webmonkey.core.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webmonkey.core.model.CanonicalUrl;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.OutputFormat;
import com.webmonkey.core.model.PageDocument;
import com.webmonkey.core.model.PageResult;
import com.webmonkey.core.render.JsonRenderer;
import com.webmonkey.core.render.LinksRenderer;
import com.webmonkey.core.screenshot.Screenshot;
import com.webmonkey.core.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 형식별 파일 저장: {out}/{host}/{format}/{slug}{ext}.
 * markdown 과 json 이 함께 있으면 json 폴더에 {markdown, metadata, scrape_id} 요약본도 남긴다.
 * 오류 결과는 아무것도 쓰지 않는다.
 */
public class FileOutputSink implements OutputSink {

    private static final Logger LOG = LoggerFactory.getLogger(FileOutputSink.class);

    private final Path baseDir;
    private final CrawlConfig.LinksFormat linksFormat;
    private final LinksRenderer links = new LinksRenderer();
    private final JsonRenderer json = new JsonRenderer();
    private final ObjectMapper om = Jsons.mapper();

    public FileOutputSink(Path baseDir, CrawlConfig.LinksFormat linksFormat) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.linksFormat = linksFormat == null ? CrawlConfig.LinksFormat.TXT : linksFormat;
    }

    public FileOutputSink(CrawlConfig cfg) {
        this(cfg.getOutputDir(), cfg.getLinksFormat());
    }

    @Override
    public List<Path> write(CanonicalUrl url, PageResult result) throws IOException {
        List<Path> written = new ArrayList<>();
        if (result == null || result.isError()) return written;

        for (Map.Entry<String, Object> e : result.getFormats().entrySet()) {
            String key = e.getKey();
            Object v = e.getValue();
            if (v == null) continue;

            if (key.equals(OutputFormat.MARKDOWN.resultKey())) {
                written.add(text(url, key, OutputFormat.MARKDOWN.extension(), v.toString()));
            } else if (key.equals(OutputFormat.JSON.resultKey())) {
                written.add(text(url, key, OutputFormat.JSON.extension(),
                        om.writerWithDefaultPrettyPrinter().writeValueAsString(v)));
                Object md = result.format(OutputFormat.MARKDOWN.resultKey());
                if (v instanceof PageDocument && md != null) {
                    written.add(text(url, key, ".structured.json", json.structured((PageDocument) v, md.toString())));
                }
            } else if (key.equals(OutputFormat.HTML.resultKey())) {
                written.add(text(url, key, OutputFormat.HTML.extension(), v.toString()));
            } else if (key.equals(OutputFormat.RAW_HTML.resultKey())) {
                written.add(text(url, key, OutputFormat.RAW_HTML.extension(), v.toString()));
            } else if (key.equals(OutputFormat.LINKS.resultKey())) {
                written.add(text(url, key, links.extension(linksFormat), links.render(asStrings(v), linksFormat)));
            } else if (key.equals(OutputFormat.SCREENSHOT.resultKey()) && v instanceof Screenshot) {
                Path p = OutputNaming.pagePath(baseDir, url, key, OutputFormat.SCREENSHOT.extension());
                Files.createDirectories(p.getParent());
                Files.write(p, ((Screenshot) v).getPng());
                written.add(p);
            } else {
                LOG.debug("No file mapping for format '{}' ({})", key, url);
            }
        }
        return written;
    }

    private Path text(CanonicalUrl url, String formatDir, String ext, String content) throws IOException {
        Path p = OutputNaming.pagePath(baseDir, url, formatDir, ext);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return p;
    }

    private static List<String> asStrings(Object v) {
        List<String> out = new ArrayList<>();
        if (v instanceof List<?>) {
            for (Object o : (List<?>) v) out.add(String.valueOf(o));
        } else {
            out.add(v.toString());
        }
        return out;
    }
}
