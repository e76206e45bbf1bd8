package com.sitescraper.app;

import com.sitescraper.core.model.ExportFormat;
import com.sitescraper.core.model.ScrapeConfig;
import com.sitescraper.core.model.ScrapeConfigException;
import com.sitescraper.core.model.ScrapeMode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 명령줄 인자.
 * <pre>
 * site-scraper &lt;single|crawl|batch&gt; URL... [options]
 *   --config FILE      scrape.yml 경로
 *   --urls-file FILE   batch: 한 줄에 URL 하나 (# 주석)
 *   --formats LIST     json,csv,excel
 *   --out DIR          출력 디렉터리
 *   --name BASE        파일명 접두
 *   --max-pages N / --max-depth N / --delay-ms N / --retries N / --concurrency N
 *   --no-robots / --cross-domain
 *   --log-level LEVEL  debug|info|warn|error (기본: -Dss.log.level, 없으면 info)
 * </pre>
 */
public final class CliArgs {

    public static final String USAGE =
            "usage: site-scraper <single|crawl|batch> URL... [--config FILE] [--urls-file FILE]\n"
          + "       [--formats json,csv,excel] [--out DIR] [--name BASE] [--max-pages N] [--max-depth N]\n"
          + "       [--delay-ms N] [--retries N] [--concurrency N] [--no-robots] [--cross-domain]\n"
          + "       [--log-level debug|info|warn|error]";

    private ScrapeMode mode;
    private final List<String> urls = new ArrayList<>();
    private Path configFile;
    private Path urlsFile;
    private Set<ExportFormat> formats;
    private Path outDir;
    private String name;
    private Integer maxPages;
    private Integer maxDepth;
    private Long delayMs;
    private Integer retries;
    private Integer concurrency;
    private boolean noRobots;
    private boolean crossDomain;
    private String logLevel;

    private CliArgs() {}

    public static CliArgs parse(String... args) {
        if (args == null || args.length == 0) throw new ScrapeConfigException("missing mode\n" + USAGE);
        CliArgs a = new CliArgs();
        a.mode = ScrapeMode.parse(args[0]);

        for (int i = 1; i < args.length; i++) {
            String s = args[i];
            switch (s) {
                case "--config" -> a.configFile = Path.of(value(args, ++i, s));
                case "--urls-file" -> a.urlsFile = Path.of(value(args, ++i, s));
                case "--formats" -> a.formats = ExportFormat.parseAll(Arrays.asList(value(args, ++i, s).split("\\s*,\\s*")));
                case "--out" -> a.outDir = Path.of(value(args, ++i, s));
                case "--name" -> a.name = value(args, ++i, s);
                case "--max-pages" -> a.maxPages = intValue(args, ++i, s);
                case "--max-depth" -> a.maxDepth = intValue(args, ++i, s);
                case "--delay-ms" -> a.delayMs = (long) intValue(args, ++i, s);
                case "--retries" -> a.retries = intValue(args, ++i, s);
                case "--concurrency" -> a.concurrency = intValue(args, ++i, s);
                case "--no-robots" -> a.noRobots = true;
                case "--cross-domain" -> a.crossDomain = true;
                case "--log-level" -> a.logLevel = value(args, ++i, s);
                default -> {
                    if (s.startsWith("--")) throw new ScrapeConfigException("unknown option: " + s + "\n" + USAGE);
                    a.urls.add(s);
                }
            }
        }
        return a;
    }

    /** --urls-file 내용까지 합친 URL 목록 */
    public List<String> resolveUrls() throws IOException {
        List<String> out = new ArrayList<>(urls);
        if (urlsFile != null) {
            for (String line : Files.readAllLines(urlsFile, StandardCharsets.UTF_8)) {
                String t = line.trim();
                if (!t.isEmpty() && !t.startsWith("#")) out.add(t);
            }
        }
        if (out.isEmpty()) throw new ScrapeConfigException("no url given\n" + USAGE);
        if (mode != ScrapeMode.BATCH && out.size() > 1) {
            throw new ScrapeConfigException(mode.name().toLowerCase(Locale.ROOT) + " mode takes exactly one url");
        }
        return out;
    }

    /** 명령줄 값으로 설정 덮어쓰기 (YAML 보다 우선) */
    public ScrapeConfig applyTo(ScrapeConfig cfg) {
        if (formats != null) cfg.setExportFormats(formats);
        if (outDir != null) cfg.setOutputDir(outDir);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (maxDepth != null) cfg.setMaxDepth(maxDepth);
        if (delayMs != null) cfg.setBaseDelay(Duration.ofMillis(delayMs));
        if (retries != null) cfg.setMaxRetries(retries);
        if (concurrency != null) cfg.setMaxConcurrentFetches(concurrency);
        if (noRobots) cfg.getRobots().setRespect(false);
        if (crossDomain) cfg.setSameDomainOnly(false);
        return cfg.validate();
    }

    private static String value(String[] args, int i, String opt) {
        if (i >= args.length) throw new ScrapeConfigException(opt + " requires a value");
        return args[i];
    }

    private static int intValue(String[] args, int i, String opt) {
        String v = value(args, i, opt);
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ScrapeConfigException(opt + " must be a number: " + v, e);
        }
    }

    public ScrapeMode mode() { return mode; }
    public List<String> urls() { return List.copyOf(urls); }
    public Path configFile() { return configFile; }
    public Path outDir() { return outDir; }
    public Set<ExportFormat> formats() { return formats; }
    public String logLevel() { return logLevel; }

    /** 파일명 접두: --name, 없으면 모드별 기본값 */
    public String nameBase() {
        if (name != null && !name.isBlank()) return name;
        switch (mode) {
            case SINGLE: return "single_page_report";
            case CRAWL: return "full_site_report";
            default: return "custom_scrape_report";
        }
    }
}
