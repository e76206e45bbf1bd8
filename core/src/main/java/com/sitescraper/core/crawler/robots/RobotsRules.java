package com.sitescraper.core.crawler.robots;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** user-agent 그룹 하나의 규칙 묶음 (Allow/Disallow + Crawl-delay) */
public final class RobotsRules {

    /** 정규화된 규칙 하나. path 는 %HEX 대문자화, 끝의 '$' 보존 */
    public record Rule(boolean allow, String path) {}

    private final List<Rule> rules = new ArrayList<>();
    private Duration crawlDelay;

    public RobotsRules addAllow(String path) {
        if (path != null && !path.isBlank()) rules.add(new Rule(true, RobotsMatcher.normalizeRule(path)));
        return this;
    }

    /** "Disallow:" (빈값) 은 규칙으로 취급하지 않음 */
    public RobotsRules addDisallow(String path) {
        if (path != null && !path.isBlank()) rules.add(new Rule(false, RobotsMatcher.normalizeRule(path)));
        return this;
    }

    /** 같은 그룹에 여러 번 나오면 마지막 값 */
    public RobotsRules crawlDelay(Duration d) {
        if (d != null && !d.isNegative()) this.crawlDelay = d;
        return this;
    }

    public List<Rule> rules() { return Collections.unmodifiableList(rules); }

    public Optional<Duration> crawlDelay() { return Optional.ofNullable(crawlDelay); }

    public boolean isEmpty() { return rules.isEmpty() && crawlDelay == null; }
}
