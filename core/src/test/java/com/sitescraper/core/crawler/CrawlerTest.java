package com.sitescraper.core.crawler;

import com.sitescraper.core.api.IPageExtractor;
import com.sitescraper.core.api.IPolitenessGate;
import com.sitescraper.core.extract.JsoupPageExtractor;
import com.sitescraper.core.http.DefaultRetryPolicy;
import com.sitescraper.core.http.RetryingFetcher;
import com.sitescraper.core.model.CrawlStats;
import com.sitescraper.core.model.ExportBundle;
import com.sitescraper.core.model.FailureKind;
import com.sitescraper.core.model.PageOutcome;
import com.sitescraper.core.model.ScrapeConfig;
import com.sitescraper.core.util.ProgressListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Crawler: BFS, 실패 표식, 취소, 동시성 상한")
class CrawlerTest {

    private static final String ROOT = "https://ex.com/";

    private static Crawler crawler(FakeSite site, IPageExtractor extractor, int cc, CrawlStats stats) {
        RetryingFetcher rf = new RetryingFetcher(site, IPolitenessGate.OPEN,
                new DefaultRetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(5), 0.0),
                d -> { }, Duration.ofSeconds(1));
        return new Crawler(rf, extractor, cc, stats);
    }

    private static ExportBundle crawl(FakeSite site, int maxDepth, int maxPages, int cc) {
        ScrapeConfig cfg = ScrapeConfig.defaults();
        return crawler(site, new JsoupPageExtractor(), cc, new CrawlStats()).run(
                List.of(URI.create(ROOT)), new Frontier(maxDepth, maxPages), new LinkFilter("ex.com", cfg),
                "crawl", ProgressListener.NONE, new AtomicBoolean(false));
    }

    @Test
    @DisplayName("같은 도메인만, 깊이 한도까지, 정규화된 key 로 한 번씩")
    void bfsWithinDomainAndDepth() {
        FakeSite site = new FakeSite()
                .page(ROOT, "/a", "/b/", "https://other.org/x", "#top", "/a#frag")
                .page("https://ex.com/a", "/c", ROOT)
                .page("https://ex.com/b/", "/a")
                .page("https://ex.com/c");

        ExportBundle b = crawl(site, 1, 50, 2);

        assertThat(b.outcomes().keySet())
                .containsExactlyInAnyOrder("https://ex.com/", "https://ex.com/a", "https://ex.com/b");
        assertThat(b.get("https://ex.com/").depth()).isZero();
        assertThat(b.get("https://ex.com/a").depth()).isEqualTo(1);
        assertThat(b.get("https://ex.com/b").url()).isEqualTo(URI.create("https://ex.com/b/"));
        assertThat(b.get("https://ex.com/b").isSuccess()).isTrue();
        assertThat(b.isSealed()).isTrue();
        assertThat(b.isCancelled()).isFalse();
        assertThat(site.requested).doesNotContain(URI.create("https://other.org/x"), URI.create("https://ex.com/c"));
    }

    @Test
    @DisplayName("발견된 URL 그대로 요청: 디렉터리 seed 의 상대 링크는 그 디렉터리 기준")
    void fetchesDiscoveredUrlNotKey() {
        FakeSite site = new FakeSite()
                .raw("https://ex.com/docs/", "<html><body><a href=\"intro.html\">Intro</a>"
                        + "<a href=\"/docs\">Same dir, no slash</a></body></html>")
                .page("https://ex.com/docs/intro.html");

        ExportBundle b = crawler(site, new JsoupPageExtractor(), 1, new CrawlStats()).run(
                List.of(URI.create("https://ex.com/docs/")), new Frontier(1, 10),
                new LinkFilter("ex.com", ScrapeConfig.defaults()), "crawl", ProgressListener.NONE, null);

        assertThat(site.requested).containsExactly(
                URI.create("https://ex.com/docs/"), URI.create("https://ex.com/docs/intro.html"));
        assertThat(b.outcomes().keySet()).containsExactly("https://ex.com/docs", "https://ex.com/docs/intro.html");
        PageOutcome seed = b.get("https://ex.com/docs");
        assertThat(seed.url()).isEqualTo(URI.create("https://ex.com/docs/"));
        assertThat(seed.record().getLinks()).contains(URI.create("https://ex.com/docs/intro.html"));
        assertThat(b.get("https://ex.com/docs/intro.html").isSuccess()).isTrue();
    }

    @Test
    @DisplayName("fetcher 예외도 그 URL 의 실패 표식으로 남고 크롤은 계속")
    void fetcherExceptionBecomesMarker() {
        FakeSite site = new FakeSite()
                .page(ROOT, "/broken", "/ok")
                .throwing("https://ex.com/broken", new IllegalStateException("socket exploded"))
                .page("https://ex.com/ok");

        ExportBundle b = crawl(site, 1, 10, 2);

        assertThat(b.size()).isEqualTo(3);
        PageOutcome broken = b.get("https://ex.com/broken");
        assertThat(broken.isSuccess()).isFalse();
        assertThat(broken.error().kind()).isEqualTo(FailureKind.NETWORK_ERROR);
        assertThat(broken.error().message()).contains("IllegalStateException").contains("socket exploded");
        assertThat(broken.depth()).isEqualTo(1);
        assertThat(b.get("https://ex.com/ok").isSuccess()).isTrue();
    }

    @Test
    @DisplayName("워커 밖으로 Error 가 새어도 방문한 URL 은 실패로 기록")
    void workerErrorStillRecorded() {
        FakeSite site = new FakeSite().page(ROOT, "/a").page("https://ex.com/a");
        IPageExtractor fatal = (body, base) -> { throw new AssertionError("extractor bug"); };
        ExportBundle b = crawler(site, fatal, 1, new CrawlStats()).run(
                List.of(URI.create(ROOT)), new Frontier(1, 10), new LinkFilter("ex.com", ScrapeConfig.defaults()),
                "crawl", ProgressListener.NONE, null);

        assertThat(b.outcomes().keySet()).containsExactly(ROOT);
        PageOutcome o = b.get(ROOT);
        assertThat(o.isSuccess()).isFalse();
        assertThat(o.error().kind()).isEqualTo(FailureKind.NETWORK_ERROR);
        assertThat(o.error().message()).contains("AssertionError");
    }

    @Test
    @DisplayName("maxPages 가 방문 수 상한")
    void maxPagesCaps() {
        FakeSite site = new FakeSite().page(ROOT, "/1", "/2", "/3", "/4", "/5", "/6");
        ExportBundle b = crawl(site, 3, 4, 3);
        assertThat(b.size()).isEqualTo(4);
        assertThat(site.requested).hasSize(4);
    }

    @Test
    @DisplayName("404 는 한 번, 503 은 재시도 후 실패 표식으로 남고 크롤은 계속")
    void failuresBecomeMarkers() {
        FakeSite site = new FakeSite()
                .page(ROOT, "/missing", "/flaky", "/ok")
                .status("https://ex.com/flaky", 503)
                .page("https://ex.com/ok");

        ExportBundle b = crawl(site, 1, 10, 1);

        PageOutcome missing = b.get("https://ex.com/missing");
        assertThat(missing.isSuccess()).isFalse();
        assertThat(missing.error().kind()).isEqualTo(FailureKind.HTTP_STATUS);
        assertThat(missing.error().httpStatus()).isEqualTo(404);
        assertThat(missing.attempts()).isEqualTo(1);

        PageOutcome flaky = b.get("https://ex.com/flaky");
        assertThat(flaky.error().httpStatus()).isEqualTo(503);
        assertThat(flaky.attempts()).isEqualTo(3);

        assertThat(b.get("https://ex.com/ok").isSuccess()).isTrue();
        assertThat(b.successCount()).isEqualTo(2);
        assertThat(b.failureCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("추출기 예외는 빈 필드 레코드로 강등, fetch 메타는 채워짐")
    void extractorFailureDegrades() {
        FakeSite site = new FakeSite().page(ROOT, "/a");
        IPageExtractor boom = (body, base) -> { throw new IllegalStateException("boom"); };
        ExportBundle b = crawler(site, boom, 1, new CrawlStats()).run(
                List.of(URI.create(ROOT)), new Frontier(2, 10), new LinkFilter("ex.com", ScrapeConfig.defaults()),
                "crawl", null, null);

        assertThat(b.size()).isEqualTo(1);
        PageOutcome o = b.get(ROOT);
        assertThat(o.isSuccess()).isTrue();
        assertThat(o.record().getStatus()).isEqualTo(200);
        assertThat(o.record().getLinks()).isEmpty();
        assertThat(o.record().getContentLength()).isPositive();
        assertThat(o.record().getFetchedAt()).isNotNull();
    }

    @Test
    @DisplayName("링크 필터가 없으면(batch) 링크를 따라가지 않음")
    void batchDoesNotFollow() {
        FakeSite site = new FakeSite().page("https://ex.com/1", "/2").page("https://ex.com/2");
        ExportBundle b = crawler(site, new JsoupPageExtractor(), 2, new CrawlStats()).run(
                List.of(URI.create("https://ex.com/1")), new Frontier(0, 1), null,
                "batch", ProgressListener.NONE, null);

        assertThat(b.outcomes().keySet()).containsExactly("https://ex.com/1");
    }

    @Test
    @DisplayName("시작 전 취소 → 빈 번들, cancelled 표시")
    void cancelledUpFront() {
        FakeSite site = new FakeSite().page(ROOT);
        ExportBundle b = crawler(site, new JsoupPageExtractor(), 2, new CrawlStats()).run(
                List.of(URI.create(ROOT)), new Frontier(1, 10), new LinkFilter("ex.com", ScrapeConfig.defaults()),
                "crawl", ProgressListener.NONE, new AtomicBoolean(true));

        assertThat(b.isCancelled()).isTrue();
        assertThat(b.isEmpty()).isTrue();
        assertThat(site.requested).isEmpty();
    }

    @Test
    @DisplayName("진행 중 취소 → 이미 끝난 결과만 담긴 부분 번들")
    void cancelledMidway() {
        FakeSite site = new FakeSite().latency(20);
        String[] links = new String[30];
        for (int i = 0; i < links.length; i++) {
            links[i] = "/p" + i;
            site.page("https://ex.com/p" + i);
        }
        site.page(ROOT, links);

        AtomicBoolean cancel = new AtomicBoolean(false);
        List<PageOutcome> seen = new CopyOnWriteArrayList<>();
        ProgressListener stopAfterThree = new ProgressListener() {
            @Override public void onProgress(double p, String phase, long done, long total) { }
            @Override public void onOutcome(PageOutcome o) {
                seen.add(o);
                if (seen.size() >= 3) cancel.set(true);
            }
        };

        ExportBundle b = crawler(site, new JsoupPageExtractor(), 2, new CrawlStats()).run(
                List.of(URI.create(ROOT)), new Frontier(1, 100), new LinkFilter("ex.com", ScrapeConfig.defaults()),
                "crawl", stopAfterThree, cancel);

        assertThat(b.isCancelled()).isTrue();
        // 취소 직후 루프를 빠져나오므로 진행 중이던 작업 결과는 버려진다
        assertThat(b.size()).isEqualTo(3).isEqualTo(seen.size());
        assertThat(b.list()).noneMatch(o -> !o.isSuccess() && o.error().kind() == FailureKind.CANCELLED);
    }

    @Test
    @DisplayName("동시 fetch 는 maxConcurrentFetches 를 넘지 않음")
    void concurrencyCap() {
        FakeSite site = new FakeSite().latency(15);
        String[] links = new String[12];
        for (int i = 0; i < links.length; i++) {
            links[i] = "/p" + i;
            site.page("https://ex.com/p" + i);
        }
        site.page(ROOT, links);

        CrawlStats stats = new CrawlStats();
        ExportBundle b = crawler(site, new JsoupPageExtractor(), 3, stats).run(
                List.of(URI.create(ROOT)), new Frontier(1, 100), new LinkFilter("ex.com", ScrapeConfig.defaults()),
                "crawl", ProgressListener.NONE, null);

        assertThat(b.size()).isEqualTo(13);
        assertThat(site.maxInFlight.get()).isLessThanOrEqualTo(3);
        assertThat(stats.snapshot().maxObservedConcurrency()).isBetween(1, 3);
        assertThat(stats.snapshot().attemptsTotal()).isEqualTo(13);
    }
}
