package com.sitescraper.core.crawler.robots;

import com.sitescraper.core.util.MillisClock;
import com.sitescraper.core.util.StructuredLog;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * host:port 별 robots 정책 캐시.
 * - 호스트마다 한 번만 가져온다(동시 요청은 같은 락에서 대기)
 * - 2xx 로 읽은 정책은 내용과 상관없이 긴 TTL (전부 허용이어도)
 * - 가져오기 실패/404/5xx 는 allow-all (fail-open), 짧은 TTL 로 캐시
 * - 리다이렉트는 같은 host 안에서 최대 3번까지 따라간다
 */
public final class RobotsRepository {

    public static final Duration DEFAULT_SUCCESS_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_FAILURE_TTL = Duration.ofMinutes(10);
    private static final int MAX_REDIRECTS = 3;

    private static final StructuredLog SLOG = StructuredLog.get(RobotsRepository.class);

    private final RobotsFetcher fetcher;
    private final MillisClock clock;
    private final Duration successTtl;
    private final Duration failureTtl;
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public RobotsRepository(RobotsFetcher fetcher, MillisClock clock) {
        this(fetcher, clock, DEFAULT_SUCCESS_TTL, DEFAULT_FAILURE_TTL);
    }

    public RobotsRepository(RobotsFetcher fetcher, MillisClock clock, Duration successTtl, Duration failureTtl) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.successTtl = (successTtl == null ? DEFAULT_SUCCESS_TTL : successTtl);
        this.failureTtl = (failureTtl == null ? DEFAULT_FAILURE_TTL : failureTtl);
    }

    /** host:port 키 (포트 없으면 스킴 기본포트) */
    static String cacheKey(URI pageUri) {
        String scheme = pageUri.getScheme() == null ? "https" : pageUri.getScheme().toLowerCase(Locale.ROOT);
        String host = pageUri.getHost() == null ? "" : pageUri.getHost().toLowerCase(Locale.ROOT);
        int port = pageUri.getPort();
        if (port < 0) port = scheme.equals("http") ? 80 : 443;
        return host + ":" + port;
    }

    /** pageUri 가 속한 호스트의 정책 (캐시 사용) */
    public RobotsPolicy policyFor(URI pageUri, String userAgent) {
        String key = cacheKey(pageUri);
        CacheEntry hit = fresh(key);
        if (hit != null) return hit.policy;

        synchronized (locks.computeIfAbsent(key, k -> new Object())) {
            hit = fresh(key);
            if (hit != null) return hit.policy;

            Loaded loaded = load(pageUri, userAgent);
            long ttl = loaded.fetched() ? successTtl.toMillis() : failureTtl.toMillis();
            cache.put(key, new CacheEntry(loaded.policy(), clock.nowMillis() + ttl));
            return loaded.policy();
        }
    }

    private CacheEntry fresh(String key) {
        CacheEntry e = cache.get(key);
        return (e != null && e.expiresAt > clock.nowMillis()) ? e : null;
    }

    private Loaded load(URI pageUri, String userAgent) {
        URI cur = robotsTxtUri(pageUri);
        if (cur == null) return Loaded.unavailable();

        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            RobotsFetcher.Response r = fetcher.fetch(cur);
            int s = r.status();
            if (s >= 200 && s < 300) {
                SLOG.debug("robots-loaded", "url", cur, "bytes", r.body().length());
                return new Loaded(RobotsPolicy.parse(r.body(), userAgent), true);
            }
            if (s >= 300 && s < 400 && r.location() != null && sameHost(cur, r.location())) {
                cur = r.location();
                continue;
            }
            SLOG.debug("robots-unavailable", "url", cur, "status", s);
            return Loaded.unavailable();
        }
        return Loaded.unavailable();
    }

    private static boolean sameHost(URI a, URI b) {
        String ha = a.getHost() == null ? "" : a.getHost();
        String hb = b.getHost() == null ? "" : b.getHost();
        return ha.equalsIgnoreCase(hb);
    }

    static URI robotsTxtUri(URI page) {
        String host = page.getHost();
        if (host == null || host.isEmpty()) return null;
        String scheme = page.getScheme() == null ? "https" : page.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;
        int port = page.getPort();
        return URI.create(scheme + "://" + host + (port < 0 ? "" : ":" + port) + "/robots.txt");
    }

    private record CacheEntry(RobotsPolicy policy, long expiresAt) {}

    /** fetched: robots.txt 를 2xx 로 받았는지 */
    private record Loaded(RobotsPolicy policy, boolean fetched) {
        static Loaded unavailable() { return new Loaded(RobotsPolicy.allowAll(), false); }
    }
}
