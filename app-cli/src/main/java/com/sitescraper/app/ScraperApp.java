package com.sitescraper.app;

import com.sitescraper.app.logging.LogSetup;
import com.sitescraper.core.model.CrawlStats;
import com.sitescraper.core.model.ExportBundle;
import com.sitescraper.core.model.ExportReport;
import com.sitescraper.core.model.PageOutcome;
import com.sitescraper.core.model.PageRecord;
import com.sitescraper.core.model.ScrapeConfig;
import com.sitescraper.core.model.ScrapeConfigException;
import com.sitescraper.core.model.ScrapeMode;
import com.sitescraper.core.service.ScrapeService;
import com.sitescraper.core.util.ProgressListener;
import com.sitescraper.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 명령줄 진입점. 설정을 만들고 엔진을 호출한 뒤 URL 별 결과와 내보낸 파일을 출력한다.
 * 종료 코드: 0 정상, 1 내보내기 일부 실패, 2 설정/인자 오류.
 * Ctrl-C 는 취소 플래그를 세우고, 그때까지 모인 부분 결과를 내보낼 때까지(최대 SHUTDOWN_GRACE) 종료를 미룬다.
 */
public final class ScraperApp {

    private static final Logger LOG = LoggerFactory.getLogger(ScraperApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_EXPORT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(60);

    private final ScrapeService service;
    private final PrintStream out;
    private final PrintStream err;

    public ScraperApp(ScrapeService service, PrintStream out, PrintStream err) {
        this.service = Objects.requireNonNull(service, "service");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        ScraperApp app = new ScraperApp(new ScrapeService(), System.out, System.err);
        AtomicBoolean cancel = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(
                new Thread(() -> cancelAndAwait(cancel, finished, SHUTDOWN_GRACE), "cancel-hook"));
        int code;
        try {
            code = app.run(args, cancel);
        } finally {
            finished.countDown();
        }
        System.exit(code);
    }

    /**
     * 종료 훅 본체. 훅이 리턴하면 JVM 이 멈추므로 run 이 끝날 때까지 여기서 기다린다.
     * @return grace 안에 run 이 끝났으면 true
     */
    static boolean cancelAndAwait(AtomicBoolean cancel, CountDownLatch finished, Duration grace) {
        cancel.set(true);
        try {
            boolean done = finished.await(grace.toMillis(), TimeUnit.MILLISECONDS);
            if (!done) LOG.warn("Shutdown grace {}s elapsed before export finished", grace.toSeconds());
            return done;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int run(String[] args, AtomicBoolean cancel) {
        CliArgs cli;
        ScrapeConfig cfg;
        List<String> urls;
        try {
            cli = CliArgs.parse(args);
            cfg = cli.applyTo(loadConfig(cli.configFile()));
            urls = cli.resolveUrls();
        } catch (ScrapeConfigException | IOException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }

        LogSetup.configure(cfg.getOutputDir(), cli.logLevel());
        ProgressListener listener = new ProgressListener() {
            @Override public void onProgress(double progress, String phase, long done, long total) {
                LOG.debug("progress {} {}/{}", phase, done, total);
            }
            @Override public void onOutcome(PageOutcome o) {
                out.println(o.summary());
            }
        };

        ExportBundle bundle;
        try {
            bundle = execute(cli.mode(), urls, cfg, listener, cancel);
        } catch (ScrapeConfigException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }

        printSummary(bundle, service.lastStats());
        if (bundle.isEmpty()) {
            out.println("Nothing to export.");
            return EXIT_OK;
        }
        ExportReport report;
        try {
            report = service.export(bundle, cfg.getExportFormats(), cli.nameBase(), cfg);
        } catch (ScrapeConfigException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }
        report.getWritten().forEach((f, p) -> out.println("Exported " + f + ": " + p));
        report.getFailures().forEach((f, why) -> err.println("Export " + f + " failed: " + why));
        return report.hasFailures() ? EXIT_EXPORT_FAILED : EXIT_OK;
    }

    private ExportBundle execute(ScrapeMode mode, List<String> urls, ScrapeConfig cfg,
                                 ProgressListener listener, AtomicBoolean cancel) {
        switch (mode) {
            case SINGLE: {
                PageOutcome o = service.scrapeSingle(urls.get(0), cfg, listener, cancel);
                if (o.isSuccess()) printPage(o.record());
                ExportBundle b = new ExportBundle(Instant.now());
                b.add(o);
                return b.seal(Instant.now());
            }
            case CRAWL:
                return service.crawlSite(urls.get(0), cfg, listener, cancel);
            default:
                return service.scrapeBatch(urls, cfg, listener, cancel);
        }
    }

    /** --config 가 있으면 그 파일, 없으면 현재 디렉터리의 scrape.yml, 그것도 없으면 기본값 */
    static ScrapeConfig loadConfig(Path explicit) throws IOException {
        if (explicit != null) return YamlConfigLoader.load(explicit);
        Path local = Path.of(YamlConfigLoader.DEFAULT_FILE);
        return Files.exists(local) ? YamlConfigLoader.load(local) : ScrapeConfig.defaults();
    }

    private void printPage(PageRecord r) {
        out.println("Title: " + (r.getTitle() == null ? "(none)" : r.getTitle()));
        out.println("Status: " + r.getStatus());
        out.println("Words: " + r.getWordCount());
        out.println("Links: " + r.getLinks().size() + ", Images: " + r.getImages().size());
        out.println("Tables: " + r.getTables().size() + ", Forms: " + r.getForms().size()
                + ", JSON-LD: " + r.getStructuredData().size());
        if (!r.getEmails().isEmpty()) out.println("Emails: " + String.join(", ", r.getEmails()));
        if (!r.getPhones().isEmpty()) out.println("Phones: " + String.join(", ", r.getPhones()));
    }

    private void printSummary(ExportBundle b, CrawlStats.Snapshot s) {
        out.printf("Pages: %d (ok %d, failed %d)%s%n", b.size(), b.successCount(), b.failureCount(),
                b.isCancelled() ? " [cancelled]" : "");
        out.printf("Requests: %d (retries %d), max concurrency %d%n",
                s.attemptsTotal(), s.retriesTotal(), s.maxObservedConcurrency());
    }
}
