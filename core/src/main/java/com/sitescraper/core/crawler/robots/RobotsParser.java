package com.sitescraper.core.crawler.robots;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 파서
 * - 지시어: User-agent / Allow / Disallow / Crawl-delay (키 대소문자 무시)
 * - 연속된 User-agent 라인은 한 그룹. 같은 UA 가 여러 그룹에 나오면 규칙을 합친다
 * - 그룹 선택: UA 문자열에 포함된 가장 긴 그룹 이름, 없으면 "*"
 */
public final class RobotsParser {

    private RobotsParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");
    static final String UA_ALL = "*";

    public static ParsedRobots parse(String robotsTxt) {
        Map<String, RobotsRules> byUa = new LinkedHashMap<>();
        if (robotsTxt == null || robotsTxt.isEmpty()) return new ParsedRobots(byUa);

        List<String> group = new ArrayList<>();
        boolean lastWasUa = false;

        for (String rawLine : robotsTxt.split("\\r?\\n|\\r")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            if (key.equals("user-agent")) {
                if (!lastWasUa) group = new ArrayList<>();
                String ua = val.isEmpty() ? UA_ALL : val.toLowerCase(Locale.ROOT);
                group.add(ua);
                byUa.computeIfAbsent(ua, k -> new RobotsRules());
                lastWasUa = true;
                continue;
            }
            lastWasUa = false;
            if (group.isEmpty()) continue; // 그룹 밖 규칙은 무시

            switch (key) {
                case "allow" -> group.forEach(ua -> byUa.get(ua).addAllow(val));
                case "disallow" -> group.forEach(ua -> byUa.get(ua).addDisallow(val));
                case "crawl-delay" -> {
                    Duration d = parseDelay(val);
                    if (d != null) group.forEach(ua -> byUa.get(ua).crawlDelay(d));
                }
                default -> { /* sitemap 등 기타 지시어 무시 */ }
            }
        }
        return new ParsedRobots(byUa);
    }

    /** "10" / "0.5" 초 단위. 해석 불가면 null */
    static Duration parseDelay(String v) {
        try {
            double sec = Double.parseDouble(v);
            if (sec < 0 || Double.isNaN(sec) || Double.isInfinite(sec)) return null;
            return Duration.ofMillis(Math.round(sec * 1000));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }

    /** UA(소문자) → 규칙 */
    public record ParsedRobots(Map<String, RobotsRules> byUa) {

        public RobotsRules selectFor(String userAgent) {
            String ua = (userAgent == null) ? "" : userAgent.toLowerCase(Locale.ROOT);
            RobotsRules best = null;
            int bestLen = 0;
            for (var e : byUa.entrySet()) {
                String name = e.getKey();
                if (name.equals(UA_ALL)) continue;
                if (!ua.isEmpty() && ua.contains(name) && name.length() > bestLen) {
                    best = e.getValue();
                    bestLen = name.length();
                }
            }
            if (best != null) return best;
            RobotsRules star = byUa.get(UA_ALL);
            return star != null ? star : new RobotsRules();
        }
    }
}
