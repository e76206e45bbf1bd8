package com.sitescraper.core.crawler;

import com.sitescraper.core.api.IPolitenessGate;
import com.sitescraper.core.crawler.robots.HttpRobotsFetcher;
import com.sitescraper.core.crawler.robots.RobotsPolicy;
import com.sitescraper.core.crawler.robots.RobotsRepository;
import com.sitescraper.core.model.ScrapeConfig;
import com.sitescraper.core.util.HostRateLimiter;
import com.sitescraper.core.util.MillisClock;
import com.sitescraper.core.util.UrlUtils;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * robots 허용 확인 → 호스트 간격 대기 순서의 관문.
 * robots 가 막은 경로는 네트워크 호출 없이 DISALLOWED.
 * robots Crawl-delay 가 기본 간격보다 길면 그 호스트 간격을 늘린다.
 */
public final class PolitenessGate implements IPolitenessGate {

    private final RobotsRepository robots;   // null 이면 robots 미사용
    private final HostRateLimiter limiter;
    private final String userAgent;

    public PolitenessGate(RobotsRepository robots, HostRateLimiter limiter, String userAgent) {
        this.robots = robots;
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    }

    /** 실행 1회분 게이트 (캐시/호스트 상태는 실행마다 새로) */
    public static PolitenessGate create(ScrapeConfig cfg) {
        RobotsRepository repo = null;
        if (cfg.getRobots().isRespect()) {
            repo = new RobotsRepository(
                    HttpRobotsFetcher.create(cfg.getUserAgent(), cfg.getTimeout()),
                    MillisClock.SYSTEM,
                    cfg.robotsSuccessTtl(),
                    cfg.robotsFailureTtl());
        }
        return new PolitenessGate(repo, new HostRateLimiter(cfg.getBaseDelay()), cfg.getUserAgent());
    }

    @Override
    public Verdict admit(URI url, Duration maxWait) throws InterruptedException {
        String host = UrlUtils.host(url);
        if (robots != null) {
            RobotsPolicy policy = robots.policyFor(url, userAgent);
            if (!policy.allow(url)) return Verdict.DISALLOWED;
            policy.crawlDelay().ifPresent(d -> limiter.raiseMinDelay(host, d));
        }
        return limiter.acquire(host, maxWait) ? Verdict.ADMITTED : Verdict.TIMED_OUT;
    }
}
