package com.sitescraper.core.crawler.robots;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/** 호스트 하나에 대해 UA 가 선택된 robots 정책. 실패/없음이면 allowAll. */
public final class RobotsPolicy {

    private static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(new RobotsRules(), true);

    private final RobotsRules rules;
    private final boolean allowAll;

    private RobotsPolicy(RobotsRules rules, boolean allowAll) {
        this.rules = rules;
        this.allowAll = allowAll;
    }

    public static RobotsPolicy parse(String robotsTxt, String userAgent) {
        return new RobotsPolicy(RobotsParser.parse(robotsTxt).selectFor(userAgent), false);
    }

    public static RobotsPolicy allowAll() {
        return ALLOW_ALL;
    }

    public boolean allow(URI url) {
        return allowAll || RobotsMatcher.isAllowed(url, rules);
    }

    public Optional<Duration> crawlDelay() {
        return allowAll ? Optional.empty() : rules.crawlDelay();
    }

    /** 파일을 가져오지 못해 열어둔 정책인지 (캐시 TTL 구분용) */
    public boolean isAllowAll() {
        return allowAll;
    }
}
