package com.sitescraper.core.crawler;

import com.sitescraper.core.api.IPageExtractor;
import com.sitescraper.core.http.RetryingFetcher;
import com.sitescraper.core.model.CrawlStats;
import com.sitescraper.core.model.ErrorMarker;
import com.sitescraper.core.model.ExportBundle;
import com.sitescraper.core.model.FailureKind;
import com.sitescraper.core.model.FetchResult;
import com.sitescraper.core.model.PageOutcome;
import com.sitescraper.core.model.PageRecord;
import com.sitescraper.core.util.ProgressListener;
import com.sitescraper.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * BFS 크롤러: Fetch → Extract 를 최대 maxConcurrentFetches 개까지 동시에 돌린다.
 * Frontier 와 ExportBundle 은 제어 루프(run 을 호출한 스레드)만 변경하고,
 * 워커는 결과(Visit)만 돌려준다. 호스트 간격은 RetryingFetcher 안의 게이트가 지킨다.
 */
public final class Crawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    /** 취소 플래그를 확인하는 주기 */
    private static final long POLL_MS = 100;
    private static final long TERMINATION_WAIT_SEC = 30;

    private final RetryingFetcher fetcher;
    private final IPageExtractor extractor;
    private final int concurrency;
    private final CrawlStats stats;

    public Crawler(RetryingFetcher fetcher, IPageExtractor extractor, int concurrency, CrawlStats stats) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.concurrency = Math.max(1, concurrency);
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /**
     * @param seeds      depth 0 으로 시작할 URL 들 (중복 판정은 frontier 가 한다)
     * @param frontier   빈 frontier (한도 포함)
     * @param links      발견 링크 필터. null 이면 링크를 따라가지 않는다(batch)
     * @param phase      진행률 phase 이름
     */
    public ExportBundle run(List<URI> seeds, Frontier frontier, LinkFilter links,
                            String phase, ProgressListener listener, AtomicBoolean cancel) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final ExportBundle bundle = new ExportBundle(Instant.now());
        for (URI s : seeds) frontier.offer(s, 0);

        LOG.info("Crawl start: seeds={}, maxDepth={}, maxPages={}, cc={}",
                seeds.size(), frontier.maxDepth(), frontier.maxPages(), concurrency);
        SLOG.info("crawl-start", "seeds", seeds.size(), "maxDepth", frontier.maxDepth(),
                "maxPages", frontier.maxPages(), "cc", concurrency, "phase", phase);
        pl.onProgress(0.0, phase, 0, frontier.maxPages());

        ExecutorService exec = new ThreadPoolExecutor(
                concurrency, concurrency,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("crawl-worker"));
        CompletionService<Visit> done = new ExecutorCompletionService<>(exec);
        Map<Future<Visit>, Frontier.Node> pending = new HashMap<>();
        int inFlight = 0;

        try {
            while (true) {
                if (isCancelled(cancel)) {
                    bundle.markCancelled();
                    LOG.info("Crawl cancelled: visited={}, inFlight={}", frontier.visitedCount(), inFlight);
                    break;
                }
                while (inFlight < concurrency && frontier.hasNext()) {
                    Frontier.Node node = frontier.next();
                    pending.put(done.submit(() -> visit(node, cancel)), node);
                    inFlight++;
                }
                if (inFlight == 0) break;

                Future<Visit> f;
                try {
                    f = done.poll(POLL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    bundle.markCancelled();
                    break;
                }
                if (f == null) continue;
                inFlight--;
                Frontier.Node taskNode = pending.remove(f);

                Visit v;
                try {
                    v = f.get();
                } catch (ExecutionException e) {
                    // visit 밖으로 새어 나온 Error 등: 방문한 URL 은 실패로라도 남긴다
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.warn("Crawl task failed: {}", cause.toString());
                    SLOG.error("task-failed", cause, "cause", cause.toString());
                    if (taskNode == null) continue;
                    v = new Visit(taskNode, unexpected(taskNode, 0, cause));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    bundle.markCancelled();
                    break;
                }

                record(bundle, v.outcome(), pl);
                if (links != null && v.outcome().isSuccess()) {
                    enqueueLinks(frontier, links, v);
                }
                long n = bundle.size();
                pl.onProgress(Math.min(1.0, (double) n / frontier.maxPages()), phase, n, frontier.maxPages());
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(TERMINATION_WAIT_SEC, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        bundle.seal(Instant.now());
        CrawlStats.Snapshot s = stats.snapshot();
        LOG.info("Crawl done: pages={}, ok={}, failed={}, retries={}, maxObservedCC={}, cancelled={}",
                bundle.size(), bundle.successCount(), bundle.failureCount(),
                s.retriesTotal(), s.maxObservedConcurrency(), bundle.isCancelled());
        SLOG.info("crawl-done", "pages", bundle.size(), "ok", bundle.successCount(),
                "failed", bundle.failureCount(), "retries", s.retriesTotal(),
                "maxObservedCC", s.maxObservedConcurrency(), "cancelled", bundle.isCancelled());
        return bundle;
    }

    private void enqueueLinks(Frontier frontier, LinkFilter links, Visit v) {
        int nextDepth = v.node().depth() + 1;
        if (nextDepth > frontier.maxDepth()) return;
        int added = 0;
        for (URI link : v.outcome().record().getLinks()) {
            if (links.accept(link) && frontier.offer(link, nextDepth)) added++;
        }
        if (added > 0) LOG.debug("Enqueued {} links from {} (depth {})", added, v.node().url(), nextDepth);
    }

    private void record(ExportBundle bundle, PageOutcome o, ProgressListener pl) {
        bundle.add(o);
        stats.recordOutcome(o);
        if (o.isSuccess()) {
            LOG.info("Visited {} (depth {}) -> {} links, {} emails",
                    o.url(), o.depth(), o.record().getLinks().size(), o.record().getEmails().size());
            SLOG.info("page-visited", "url", o.url(), "depth", o.depth(), "status", o.record().getStatus(),
                    "attempts", o.attempts(), "links", o.record().getLinks().size());
        } else {
            LOG.warn("Failed {} (depth {}) -> {} {}", o.url(), o.depth(), o.error().label(), o.error().message());
            SLOG.warn("page-failed", "url", o.url(), "depth", o.depth(), "kind", o.error().kind(),
                    "status", o.error().httpStatus(), "attempts", o.attempts());
        }
        try {
            pl.onOutcome(o);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener threw: {}", e.toString());
        }
    }

    /** 워커: 공유 상태를 건드리지 않고 결과만 만든다 */
    private Visit visit(Frontier.Node node, AtomicBoolean cancel) {
        stats.enter();
        long t0 = System.nanoTime();
        int attempts = 0;
        try {
            RetryingFetcher.Result r = fetcher.fetch(node.url(), cancel);
            attempts = r.attempts();
            stats.addAttempts(attempts);

            if (r.last() instanceof FetchResult.Success s) {
                PageRecord rec = extractSafely(s, node.url());
                return new Visit(node, PageOutcome.success(node.key(), node.url(), node.depth(), attempts, rec));
            }
            FetchResult.Failure f = (FetchResult.Failure) r.last();
            return new Visit(node, PageOutcome.failure(node.key(), node.url(), node.depth(), attempts, ErrorMarker.of(f)));
        } catch (RuntimeException e) {
            LOG.warn("Visit of {} threw: {}", node.url(), e.toString());
            LOG.debug("Visit failure detail", e);
            return new Visit(node, unexpected(node, attempts, e));
        } finally {
            stats.addWallTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
            stats.exit();
        }
    }

    /** 예상 밖 예외로 끝난 방문: NETWORK_ERROR 로 기록 */
    private static PageOutcome unexpected(Frontier.Node node, int attempts, Throwable cause) {
        String msg = cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        return PageOutcome.failure(node.key(), node.url(), node.depth(), Math.max(1, attempts),
                new ErrorMarker(FailureKind.NETWORK_ERROR, 0, msg));
    }

    /** 추출 실패는 빈 필드로 강등 (절대 방문 실패로 만들지 않음) */
    private PageRecord extractSafely(FetchResult.Success s, URI requested) {
        PageRecord extracted;
        try {
            extracted = extractor.extract(s.body(), s.finalUrl());
        } catch (RuntimeException e) {
            LOG.debug("Extractor failed on {}: {}", s.finalUrl(), e.toString());
            extracted = PageRecord.builder().url(requested).build();
        }
        return extracted.toBuilder()
                .url(requested)
                .finalUrl(s.finalUrl())
                .status(s.status())
                .contentType(s.contentType())
                .contentLength(s.body().length)
                .fetchedAt(Instant.now())
                .build();
    }

    private static boolean isCancelled(AtomicBoolean flag) {
        return Thread.currentThread().isInterrupted() || (flag != null && flag.get());
    }

    /** 워커 결과: 어떤 노드였는지 + 결과 */
    private record Visit(Frontier.Node node, PageOutcome outcome) {}

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
