package com.sitescraper.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 스크랩 설정 (scrape.yml 매핑 대상): 순수 설정 보관용.
 * 엔진 진입점마다 명시적으로 전달되며, 엔진은 전역 상태를 두지 않는다.
 */
public final class ScrapeConfig {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (compatible; SiteScraper/0.1; +robots-aware)";

    public static final List<String> DEFAULT_SKIP_EXTENSIONS = List.of(
            ".pdf", ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp",
            ".doc", ".docx", ".xls", ".xlsx", ".zip", ".mp4", ".mp3");

    /** robots.txt 관련 하위 설정: YAML의 `robots:` 섹션과 매핑 */
    public static final class RobotsCfg {
        private boolean respect = true;
        /** 성공 캐시 TTL(분). 실패 캐시는 이 값과 10분 중 작은 값 */
        private int cacheTtlMinutes = 30;

        public boolean isRespect() { return respect; }
        public RobotsCfg setRespect(boolean respect) { this.respect = respect; return this; }

        public int getCacheTtlMinutes() { return cacheTtlMinutes; }
        public RobotsCfg setCacheTtlMinutes(int cacheTtlMinutes) { this.cacheTtlMinutes = cacheTtlMinutes; return this; }
    }

    // ---------- 요청/재시도 ----------
    private Duration baseDelay = Duration.ofSeconds(2);      // 같은 호스트 요청 간 최소 간격
    private int maxRetries = 3;
    private Duration timeout = Duration.ofSeconds(30);
    private Duration retryBaseDelay = Duration.ofSeconds(1);
    private Duration retryMaxDelay = Duration.ofSeconds(30);
    private double retryJitter = 0.1;                        // ±비율
    private Duration politenessMaxWait = Duration.ofSeconds(60);
    private String userAgent = DEFAULT_USER_AGENT;
    private boolean followRedirects = true;

    // ---------- 크롤 범위 ----------
    private int maxDepth = 2;
    private int maxPages = 100;
    private boolean sameDomainOnly = true;
    private boolean includeSubdomains = false;
    private int maxConcurrentFetches = 4;
    private List<String> skipExtensions = DEFAULT_SKIP_EXTENSIONS;
    private List<String> excludePaths = List.of();

    // ---------- 추출/출력 ----------
    private int textMaxLength = 5000;
    private Set<ExportFormat> exportFormats = EnumSet.of(ExportFormat.JSON);
    private Path outputDir = Path.of("out");

    private RobotsCfg robots = new RobotsCfg();

    // ---------- getters ----------
    public Duration getBaseDelay() { return baseDelay; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getTimeout() { return timeout; }
    public Duration getRetryBaseDelay() { return retryBaseDelay; }
    public Duration getRetryMaxDelay() { return retryMaxDelay; }
    public double getRetryJitter() { return retryJitter; }
    public Duration getPolitenessMaxWait() { return politenessMaxWait; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
    public boolean isSameDomainOnly() { return sameDomainOnly; }
    public boolean isIncludeSubdomains() { return includeSubdomains; }
    public int getMaxConcurrentFetches() { return maxConcurrentFetches; }
    public List<String> getSkipExtensions() { return skipExtensions; }
    public List<String> getExcludePaths() { return excludePaths; }
    public int getTextMaxLength() { return textMaxLength; }
    public Set<ExportFormat> getExportFormats() { return exportFormats; }
    public Path getOutputDir() { return outputDir; }
    public RobotsCfg getRobots() { return robots; }

    // ---------- fluent setters ----------
    public ScrapeConfig setBaseDelay(Duration v) { this.baseDelay = v; return this; }
    public ScrapeConfig setMaxRetries(int v) { this.maxRetries = v; return this; }
    public ScrapeConfig setTimeout(Duration v) { this.timeout = v; return this; }
    public ScrapeConfig setRetryBaseDelay(Duration v) { this.retryBaseDelay = v; return this; }
    public ScrapeConfig setRetryMaxDelay(Duration v) { this.retryMaxDelay = v; return this; }
    public ScrapeConfig setRetryJitter(double v) { this.retryJitter = v; return this; }
    public ScrapeConfig setPolitenessMaxWait(Duration v) { this.politenessMaxWait = v; return this; }
    public ScrapeConfig setUserAgent(String v) { this.userAgent = v; return this; }
    public ScrapeConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ScrapeConfig setMaxDepth(int v) { this.maxDepth = v; return this; }
    public ScrapeConfig setMaxPages(int v) { this.maxPages = v; return this; }
    public ScrapeConfig setSameDomainOnly(boolean v) { this.sameDomainOnly = v; return this; }
    public ScrapeConfig setIncludeSubdomains(boolean v) { this.includeSubdomains = v; return this; }
    public ScrapeConfig setMaxConcurrentFetches(int v) { this.maxConcurrentFetches = v; return this; }
    public ScrapeConfig setSkipExtensions(List<String> v) { this.skipExtensions = (v == null ? List.of() : List.copyOf(v)); return this; }
    public ScrapeConfig setExcludePaths(List<String> v) { this.excludePaths = (v == null ? List.of() : List.copyOf(v)); return this; }
    public ScrapeConfig setTextMaxLength(int v) { this.textMaxLength = v; return this; }
    public ScrapeConfig setOutputDir(Path v) { this.outputDir = v; return this; }
    public ScrapeConfig setRobots(RobotsCfg v) { this.robots = (v != null ? v : new RobotsCfg()); return this; }

    public ScrapeConfig setExportFormats(Set<ExportFormat> v) {
        this.exportFormats = (v == null || v.isEmpty()) ? EnumSet.noneOf(ExportFormat.class) : EnumSet.copyOf(v);
        return this;
    }

    public ScrapeConfig setBaseDelayMs(long ms) { this.baseDelay = Duration.ofMillis(Math.max(0, ms)); return this; }
    public ScrapeConfig setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }

    // ---------- validate ----------
    /** 잘못된 값이면 {@link ScrapeConfigException} (키 이름 포함) */
    public ScrapeConfig validate() {
        requireDuration(baseDelay, "baseDelay", true);
        requireDuration(timeout, "timeout", false);
        requireDuration(retryBaseDelay, "retry.baseDelay", true);
        requireDuration(retryMaxDelay, "retry.maxDelay", true);
        requireDuration(politenessMaxWait, "politenessMaxWait", true);
        if (retryMaxDelay.compareTo(retryBaseDelay) < 0)
            throw new ScrapeConfigException("retry.maxDelay must be >= retry.baseDelay");
        if (maxRetries < 0) throw new ScrapeConfigException("maxRetries must be >= 0");
        if (retryJitter < 0.0 || retryJitter >= 1.0) throw new ScrapeConfigException("retry.jitter must be in [0, 1)");
        if (maxDepth < 0) throw new ScrapeConfigException("maxDepth must be >= 0");
        if (maxPages < 1) throw new ScrapeConfigException("maxPages must be >= 1");
        if (maxConcurrentFetches < 1) throw new ScrapeConfigException("maxConcurrentFetches must be >= 1");
        if (textMaxLength < 1) throw new ScrapeConfigException("textMaxLength must be >= 1");
        if (userAgent == null || userAgent.isBlank()) throw new ScrapeConfigException("userAgent must not be blank");
        if (outputDir == null) throw new ScrapeConfigException("outputDir must not be null");
        if (exportFormats == null || exportFormats.isEmpty())
            throw new ScrapeConfigException("output.formats must not be empty");
        if (robots == null) throw new ScrapeConfigException("robots must not be null");
        if (robots.getCacheTtlMinutes() < 0)
            throw new ScrapeConfigException("robots.cacheTtlMinutes must be >= 0");
        return this;
    }

    private static void requireDuration(Duration d, String key, boolean zeroOk) {
        if (d == null) throw new ScrapeConfigException(key + " must not be null");
        if (d.isNegative() || (!zeroOk && d.isZero()))
            throw new ScrapeConfigException(key + (zeroOk ? " must be >= 0" : " must be > 0"));
    }

    // ---------- helpers ----------
    public static ScrapeConfig defaults() { return new ScrapeConfig(); }

    /** robots 실패 캐시 TTL: 성공 TTL 과 10분 중 짧은 쪽 */
    public Duration robotsFailureTtl() {
        return Duration.ofMinutes(Math.min(10, robots.getCacheTtlMinutes()));
    }

    public Duration robotsSuccessTtl() {
        return Duration.ofMinutes(robots.getCacheTtlMinutes());
    }
}
