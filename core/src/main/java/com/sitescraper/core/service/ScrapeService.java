package com.sitescraper.core.service;

import com.sitescraper.core.api.IFetcher;
import com.sitescraper.core.api.IPageExtractor;
import com.sitescraper.core.api.IPolitenessGate;
import com.sitescraper.core.crawler.Crawler;
import com.sitescraper.core.crawler.Frontier;
import com.sitescraper.core.crawler.LinkFilter;
import com.sitescraper.core.crawler.PolitenessGate;
import com.sitescraper.core.extract.JsoupPageExtractor;
import com.sitescraper.core.http.DefaultRetryPolicy;
import com.sitescraper.core.http.HttpFetcher;
import com.sitescraper.core.http.RetryingFetcher;
import com.sitescraper.core.model.CrawlStats;
import com.sitescraper.core.model.ErrorMarker;
import com.sitescraper.core.model.ExportBundle;
import com.sitescraper.core.model.ExportFormat;
import com.sitescraper.core.model.ExportReport;
import com.sitescraper.core.model.FailureKind;
import com.sitescraper.core.model.PageOutcome;
import com.sitescraper.core.model.ScrapeConfig;
import com.sitescraper.core.model.ScrapeConfigException;
import com.sitescraper.core.service.export.ExportCoordinator;
import com.sitescraper.core.util.DefaultSleeper;
import com.sitescraper.core.util.ProgressListener;
import com.sitescraper.core.util.Sleeper;
import com.sitescraper.core.util.StructuredLog;
import com.sitescraper.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 엔진 진입점: 단일 페이지 / 사이트 크롤 / URL 목록 + 내보내기.
 * 설정은 호출마다 명시적으로 받고, 실행마다 fetcher·게이트(호스트 상태, robots 캐시)를 새로 만든다.
 * URL/설정 오류는 fetch 전에 {@link ScrapeConfigException} 으로 바로 던지고,
 * URL 단위 실패는 결과(PageOutcome/ExportBundle)에 값으로 남긴다.
 */
public final class ScrapeService {

    private static final Logger LOG = LoggerFactory.getLogger(ScrapeService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScrapeService.class);

    /** 실행 1회분 협력 객체 생성기. 테스트에서 가짜 fetcher/게이트를 주입한다 */
    public interface Components {
        IFetcher fetcher(ScrapeConfig cfg);
        IPageExtractor extractor(ScrapeConfig cfg);
        IPolitenessGate gate(ScrapeConfig cfg);
        Sleeper sleeper();

        Components DEFAULT = new Components() {
            @Override public IFetcher fetcher(ScrapeConfig cfg) { return new HttpFetcher(cfg); }
            @Override public IPageExtractor extractor(ScrapeConfig cfg) { return new JsoupPageExtractor(cfg.getTextMaxLength()); }
            @Override public IPolitenessGate gate(ScrapeConfig cfg) { return PolitenessGate.create(cfg); }
            @Override public Sleeper sleeper() { return DefaultSleeper.INSTANCE; }
        };
    }

    private final Components components;
    private final ExportCoordinator exporter;
    private volatile CrawlStats.Snapshot lastStats = new CrawlStats().snapshot();

    public ScrapeService() {
        this(Components.DEFAULT, new ExportCoordinator());
    }

    /** DI/테스트용 */
    public ScrapeService(Components components, ExportCoordinator exporter) {
        this.components = Objects.requireNonNull(components, "components");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
    }

    /* =========================
       단일 페이지
       ========================= */

    public PageOutcome scrapeSingle(String url, ScrapeConfig config) {
        return scrapeSingle(url, config, ProgressListener.NONE, null);
    }

    public PageOutcome scrapeSingle(String url, ScrapeConfig config, ProgressListener listener, AtomicBoolean cancel) {
        ScrapeConfig cfg = validated(config);
        URI seed = UrlUtils.parseSeed(url);
        ExportBundle bundle = run(List.of(seed), new Frontier(0, 1), null, "single", cfg, listener, cancel);
        PageOutcome o = bundle.get(UrlUtils.key(seed));
        if (o == null) {
            // 첫 fetch 전에 취소된 경우
            o = PageOutcome.failure(UrlUtils.key(seed), seed, 0, 0, cancelledMarker());
        }
        return o;
    }

    /* =========================
       사이트 크롤 (BFS, 도메인 스코프)
       ========================= */

    public ExportBundle crawlSite(String seedUrl, ScrapeConfig config) {
        return crawlSite(seedUrl, config, ProgressListener.NONE, null);
    }

    public ExportBundle crawlSite(String seedUrl, ScrapeConfig config, ProgressListener listener, AtomicBoolean cancel) {
        ScrapeConfig cfg = validated(config);
        URI seed = UrlUtils.parseSeed(seedUrl);
        LinkFilter filter = new LinkFilter(UrlUtils.host(seed), cfg);
        Frontier frontier = new Frontier(cfg.getMaxDepth(), cfg.getMaxPages());
        return run(List.of(seed), frontier, filter, "crawl", cfg, listener, cancel);
    }

    /* =========================
       URL 목록 (링크 추적 없음)
       ========================= */

    public ExportBundle scrapeBatch(List<String> urls, ScrapeConfig config) {
        return scrapeBatch(urls, config, ProgressListener.NONE, null);
    }

    /** 목록 중 하나라도 잘못된 URL 이면 아무것도 가져오지 않고 거부. 중복 URL 은 한 번만 */
    public ExportBundle scrapeBatch(List<String> urls, ScrapeConfig config, ProgressListener listener, AtomicBoolean cancel) {
        ScrapeConfig cfg = validated(config);
        if (urls == null || urls.isEmpty()) throw new ScrapeConfigException("urls must not be empty");
        Map<String, URI> seeds = new LinkedHashMap<>();
        for (String u : urls) {
            URI seed = UrlUtils.parseSeed(u);
            seeds.putIfAbsent(UrlUtils.key(seed), seed);
        }
        return run(new ArrayList<>(seeds.values()), new Frontier(0, seeds.size()), null, "batch", cfg, listener, cancel);
    }

    /* =========================
       내보내기
       ========================= */

    /** config.outputDir 아래 {@code <name>_<timestamp>.<ext>} */
    public ExportReport export(ExportBundle bundle, Set<ExportFormat> formats, String name, ScrapeConfig config) {
        return export(bundle, formats, name, validated(config).getOutputDir());
    }

    public ExportReport export(ExportBundle bundle, Set<ExportFormat> formats, String name, Path outputDir) {
        Objects.requireNonNull(bundle, "bundle");
        if (formats == null || formats.isEmpty()) throw new ScrapeConfigException("formats must not be empty");
        ExportReport report = exporter.export(bundle, formats, outputDir, name);
        report.getWritten().forEach((f, p) -> SLOG.info("export-written", "format", f, "path", p));
        report.getFailures().forEach((f, why) -> SLOG.warn("export-failed", "format", f, "reason", why));
        return report;
    }

    /** 마지막 실행의 텔레메트리 */
    public CrawlStats.Snapshot lastStats() {
        return lastStats;
    }

    // ---------- 내부 ----------

    private ExportBundle run(List<URI> seeds, Frontier frontier, LinkFilter filter, String phase,
                             ScrapeConfig cfg, ProgressListener listener, AtomicBoolean cancel) {
        CrawlStats stats = new CrawlStats();
        IFetcher fetcher = components.fetcher(cfg);
        try {
            RetryingFetcher retrying = new RetryingFetcher(
                    fetcher,
                    components.gate(cfg),
                    DefaultRetryPolicy.from(cfg),
                    components.sleeper(),
                    cfg.getPolitenessMaxWait());
            Crawler crawler = new Crawler(retrying, components.extractor(cfg), cfg.getMaxConcurrentFetches(), stats);
            return crawler.run(seeds, frontier, filter, phase, listener, cancel);
        } finally {
            lastStats = stats.snapshot();
            try {
                fetcher.close();
            } catch (Exception e) {
                LOG.debug("Fetcher close failed: {}", e.toString());
            }
        }
    }

    private static ScrapeConfig validated(ScrapeConfig config) {
        if (config == null) throw new ScrapeConfigException("config must not be null");
        return config.validate();
    }

    private static ErrorMarker cancelledMarker() {
        return new ErrorMarker(FailureKind.CANCELLED, 0, "cancelled before fetch");
    }
}
