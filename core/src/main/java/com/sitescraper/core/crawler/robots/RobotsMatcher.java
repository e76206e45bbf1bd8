package com.sitescraper.core.crawler.robots;

import java.net.URI;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * robots 경로 매칭 (RFC 9309):
 * - 대상은 rawPath(+?rawQuery), 퍼센트 인코딩은 HEX 대문자로만 통일
 * - 규칙은 접두 매칭, '*' 는 임의 길이, 끝의 '$' 는 경로 끝 고정
 * - 가장 구체적인(와일드카드 제외 글자 수가 많은) 규칙이 이김, 동률이면 Allow
 * - 매칭 규칙이 없으면 허용
 */
public final class RobotsMatcher {
    private RobotsMatcher() {}

    public static boolean isAllowed(URI url, RobotsRules rules) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(rules, "rules");

        String target = normalizeTarget(url);
        RobotsRules.Rule best = null;
        for (RobotsRules.Rule r : rules.rules()) {
            if (!matches(target, r.path())) continue;
            if (best == null) { best = r; continue; }
            int lb = specificity(best.path()), lr = specificity(r.path());
            if (lr > lb || (lr == lb && r.allow() && !best.allow())) best = r;
        }
        return best == null || best.allow();
    }

    static boolean matches(String target, String rule) {
        if (rule == null || rule.isEmpty()) return false;
        boolean anchored = rule.endsWith("$");
        String body = anchored ? rule.substring(0, rule.length() - 1) : rule;

        if (body.indexOf('*') < 0) {
            return anchored ? target.equals(body) : target.startsWith(body);
        }
        StringBuilder rx = new StringBuilder("^");
        int from = 0;
        for (int i = body.indexOf('*'); i >= 0; i = body.indexOf('*', from)) {
            if (i > from) rx.append(Pattern.quote(body.substring(from, i)));
            rx.append(".*");
            from = i + 1;
        }
        if (from < body.length()) rx.append(Pattern.quote(body.substring(from)));
        rx.append(anchored ? "$" : "");
        return Pattern.compile(rx.toString()).matcher(target).find();
    }

    /** 와일드카드와 끝 '$' 를 뺀 글자 수 */
    static int specificity(String rule) {
        int end = rule.endsWith("$") ? rule.length() - 1 : rule.length();
        int n = 0;
        for (int i = 0; i < end; i++) if (rule.charAt(i) != '*') n++;
        return n;
    }

    /** 규칙 문자열 정규화(퍼센트 인코딩 HEX 대문자). '$'는 보존 */
    static String normalizeRule(String rule) {
        if (rule == null) return "";
        return uppercasePctHex(rule.trim());
    }

    /** URL → 매칭 대상 문자열: rawPath(없으면 "/") + ?rawQuery */
    static String normalizeTarget(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        String q = uri.getRawQuery();
        return uppercasePctHex(q == null ? path : path + "?" + q);
    }

    static String uppercasePctHex(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                out.append('%')
                   .append(Character.toUpperCase(s.charAt(i + 1)))
                   .append(Character.toUpperCase(s.charAt(i + 2)));
                i += 2;
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
