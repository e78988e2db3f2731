package com.webmonkey.core.crawler;

import com.webmonkey.core.api.CrawlValidationException;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.FrontierEntry;
import com.webmonkey.core.util.ManualClock;
import com.webmonkey.core.util.RateLimiter;
import com.webmonkey.core.util.RecordingSleeper;
import com.webmonkey.core.util.UrlCanonicalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Frontier: BFS queue, dedup, depth/domain/pattern/maxPages admission")
class FrontierTest {

    private static final String SEED = "https://ex.com/";

    private static Frontier frontier(CrawlConfig cfg) {
        Frontier f = new Frontier(cfg, RateLimiter.unlimited());
        f.enqueueSeed(cfg.getTarget());
        return f;
    }

    private static CrawlConfig cfg() {
        return CrawlConfig.defaults().setTarget(SEED).setMaxDepth(3);
    }

    private static List<String> drain(Frontier f) throws InterruptedException {
        List<String> out = new ArrayList<>();
        FrontierEntry e;
        while ((e = f.dequeue()) != null) out.add(e.getUrl() + "@" + e.getDepth());
        return out;
    }

    @Test
    void fifoOrder_withDepths() throws Exception {
        Frontier f = frontier(cfg());
        assertThat(f.offer("/a", SEED, 0)).isTrue();
        assertThat(f.offer("b", SEED, 0)).isTrue();
        assertThat(f.offer("/a/x", "https://ex.com/a", 1)).isTrue();

        assertThat(drain(f)).containsExactly(
                "https://ex.com/@0", "https://ex.com/a@1", "https://ex.com/b@1", "https://ex.com/a/x@2");
        assertThat(f.dequeue()).isNull();
    }

    @Test
    void duplicates_areRejected_afterCanonicalization() {
        Frontier f = frontier(cfg());
        assertThat(f.offer("https://ex.com/a", null, 0)).isTrue();
        assertThat(f.offer("HTTPS://EX.com:443/a#section", null, 0)).isFalse();
        assertThat(f.offer("/", SEED, 0)).isFalse();                      // seed 자신
        assertThat(f.visitedCount()).isEqualTo(2);
        assertThat(f.isVisited(UrlCanonicalizer.canonicalize("https://ex.com/a"))).isTrue();
    }

    @Test
    void depthLimit() {
        Frontier f = frontier(cfg().setMaxDepth(1));
        assertThat(f.offer("/one", SEED, 0)).isTrue();
        assertThat(f.offer("/two", "https://ex.com/one", 1)).isFalse();
        // 깊이 초과로 거절된 URL 은 방문 표시되지 않는다
        assertThat(f.isVisited(UrlCanonicalizer.canonicalize("https://ex.com/two"))).isFalse();
    }

    @Test
    void maxDepthZero_onlySeed() throws Exception {
        Frontier f = frontier(cfg().setMaxDepth(0));
        assertThat(f.offer("/a", SEED, 0)).isFalse();
        assertThat(drain(f)).containsExactly("https://ex.com/@0");
    }

    @Test
    void domainPolicy() {
        Frontier strict = frontier(cfg());
        assertThat(strict.offer("https://other.com/x", null, 0)).isFalse();
        assertThat(strict.offer("https://blog.ex.com/x", null, 0)).isFalse();

        Frontier subs = frontier(cfg().setFollowSubdomains(true));
        assertThat(subs.offer("https://blog.ex.com/x", null, 0)).isTrue();
        assertThat(subs.offer("https://notex.com/x", null, 0)).isFalse();

        Frontier open = frontier(cfg().setSameDomainOnly(false));
        assertThat(open.offer("https://other.com/x", null, 0)).isTrue();
    }

    @Test
    void nonCrawlableLinks_areIgnored() {
        Frontier f = frontier(cfg());
        assertThat(f.offer("mailto:me@ex.com", SEED, 0)).isFalse();
        assertThat(f.offer("javascript:void(0)", SEED, 0)).isFalse();
        assertThat(f.offer("#top", SEED, 0)).isFalse();
        assertThat(f.pending()).isEqualTo(1);
    }

    @Test
    void includeAndExcludePatterns() {
        Frontier f = frontier(cfg().setIncludePattern("/docs/").setExcludePaths(List.of("/docs/old/", "re:\\.pdf$")));
        assertThat(f.offer("/docs/intro", SEED, 0)).isTrue();
        assertThat(f.offer("/blog/post", SEED, 0)).isFalse();
        assertThat(f.offer("/docs/old/v1", SEED, 0)).isFalse();
        assertThat(f.offer("/docs/manual.pdf", SEED, 0)).isFalse();
    }

    @Test
    void maxPages_capsAdmissions_includingSeed() {
        Frontier f = frontier(cfg().setMaxPages(2));
        assertThat(f.offer("/a", SEED, 0)).isTrue();
        assertThat(f.offer("/b", SEED, 0)).isFalse();
        assertThat(f.visitedCount()).isEqualTo(2);
    }

    @Test
    void seedRules() {
        Frontier f = new Frontier(cfg(), RateLimiter.unlimited());
        assertThatThrownBy(() -> f.offer("/a", SEED, 0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> f.enqueueSeed("mailto:x@ex.com")).isInstanceOf(CrawlValidationException.class);

        f.enqueueSeed("https://EX.com");
        assertThat(f.getSeed().toString()).isEqualTo("https://ex.com/");
        assertThatThrownBy(() -> f.enqueueSeed("https://ex.com/other")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void dequeue_isRateLimited_butEmptyDequeueDoesNotWait() throws Exception {
        ManualClock clock = new ManualClock();
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        CrawlConfig c = cfg();
        Frontier f = new Frontier(c, new RateLimiter(Duration.ofMillis(500), sleeper, clock));
        f.enqueueSeed(SEED);
        f.offer("/a", SEED, 0);
        f.offer("/b", SEED, 0);

        assertThat(drain(f)).hasSize(3);
        assertThat(f.dequeue()).isNull();
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(500), Duration.ofMillis(500));
    }

    @Test
    void peekDepth() throws Exception {
        Frontier f = frontier(cfg());
        assertThat(f.peekDepth()).isZero();
        f.offer("/a", SEED, 0);
        f.dequeue();
        assertThat(f.peekDepth()).isEqualTo(1);
        f.dequeue();
        assertThat(f.peekDepth()).isEqualTo(-1);
    }
}
