package com.sitescraper.core.util;

import com.sitescraper.core.model.ExportFormat;
import com.sitescraper.core.model.ScrapeConfig;
import com.sitescraper.core.model.ScrapeConfigException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * scrape.yml 을 읽어 ScrapeConfig 로 변환. 없는 키는 기본값 유지.
 *
 * 예상 YAML 키:
 * baseDelayMs: 2000
 * maxRetries: 3
 * timeoutMs: 30000
 * maxConcurrentFetches: 4
 * politenessMaxWaitMs: 60000
 * userAgent: "..."
 * followRedirects: true
 * textMaxLength: 5000
 * crawl:
 *   maxDepth: 2
 *   maxPages: 100
 *   sameDomainOnly: true
 *   includeSubdomains: false
 *   skipExtensions: [".pdf", ".jpg"]
 *   excludePaths: ["/logout", "re:\\?sessionid="]
 * retry:
 *   baseDelayMs: 1000
 *   maxDelayMs: 30000
 *   jitter: 0.1
 * robots:
 *   respect: true
 *   cacheTtlMinutes: 30
 * output:
 *   dir: "out"
 *   formats: [json, csv, excel]
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "scrape.yml";

    private YamlConfigLoader() {}

    public static ScrapeConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ScrapeConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scrape.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static ScrapeConfig load(InputStream in) {
        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new ScrapeConfigException("invalid yaml: " + e.getMessage(), e);
        }

        ScrapeConfig cfg = ScrapeConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg.validate();
        }

        // 1) 평면 키
        setLongAsDurationMs(map, "baseDelayMs", cfg::setBaseDelay);
        setInt(map, "maxRetries", cfg::setMaxRetries);
        setLongAsDurationMs(map, "timeoutMs", cfg::setTimeout);
        setInt(map, "maxConcurrentFetches", cfg::setMaxConcurrentFetches);
        setLongAsDurationMs(map, "politenessMaxWaitMs", cfg::setPolitenessMaxWait);
        setString(map, "userAgent", cfg::setUserAgent);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setInt(map, "textMaxLength", cfg::setTextMaxLength);

        // 2) crawl.*
        Map<String, Object> crawl = getMap(map, "crawl");
        if (crawl != null) {
            setInt(crawl, "maxDepth", cfg::setMaxDepth);
            setInt(crawl, "maxPages", cfg::setMaxPages);
            setBoolean(crawl, "sameDomainOnly", cfg::setSameDomainOnly);
            setBoolean(crawl, "includeSubdomains", cfg::setIncludeSubdomains);
            setStringList(crawl, "skipExtensions", cfg::setSkipExtensions);
            setStringList(crawl, "excludePaths", cfg::setExcludePaths);
        }

        // 3) retry.*
        Map<String, Object> retry = getMap(map, "retry");
        if (retry != null) {
            setLongAsDurationMs(retry, "baseDelayMs", cfg::setRetryBaseDelay);
            setLongAsDurationMs(retry, "maxDelayMs", cfg::setRetryMaxDelay);
            Object j = retry.get("jitter");
            if (j != null) cfg.setRetryJitter(parseDouble("retry.jitter", j));
        }

        // 4) robots.*
        Map<String, Object> robots = getMap(map, "robots");
        if (robots != null) {
            var r = cfg.getRobots();
            setBoolean(robots, "respect", r::setRespect);
            setInt(robots, "cacheTtlMinutes", r::setCacheTtlMinutes);
        }

        // 5) output.dir / output.formats
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
            setStringList(output, "formats", names -> cfg.setExportFormats(ExportFormat.parseAll(names)));
        }

        return cfg.validate();
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept((int) parseLong(key, v));
    }

    private static void setLongAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : parseLong(key, v);
        setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static long parseLong(String key, Object v) {
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new ScrapeConfigException(key + " must be a number: " + v, e);
        }
    }

    private static double parseDouble(String key, Object v) {
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new ScrapeConfigException(key + " must be a number: " + v, e);
        }
    }
}
