package com.webmonkey.core.api;

import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.CrawlResult;
import com.webmonkey.core.model.OutputFormat;

import java.time.Duration;
import java.util.List;

/** 크롤러 최소 계약: 시드부터 BFS 로 돌며 URL별 결과를 모은다. */
public interface ICrawler extends AutoCloseable {

    /**
     * 설정 검증 후 크롤을 수행한다.
     * 검증 실패만 {@link CrawlValidationException} 으로 던지고, URL별 실패는 결과에 기록된다.
     */
    CrawlResult crawl(CrawlConfig config) throws InterruptedException;

    default CrawlResult crawl(String seed, List<OutputFormat> formats, int maxDepth,
                              boolean sameDomainOnly, Duration rateLimit) throws InterruptedException {
        CrawlConfig cfg = CrawlConfig.defaults()
                .setTarget(seed)
                .setOutputFormats(formats)
                .setMaxDepth(maxDepth)
                .setSameDomainOnly(sameDomainOnly)
                .setMinInterval(rateLimit);
        return crawl(cfg);
    }

    @Override default void close() throws Exception {}
}
