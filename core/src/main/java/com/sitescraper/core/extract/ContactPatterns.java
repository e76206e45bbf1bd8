package com.sitescraper.core.extract;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 텍스트에서 연락처(이메일/전화)와 소셜 프로필 링크를 찾는다. 모두 등장 순서 유지 */
public final class ContactPatterns {
    private ContactPatterns() {}

    static final Pattern EMAIL =
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    /** +1 (555) 123-4567 / 555.123.4567 / 555 123 4567 */
    static final Pattern PHONE =
            Pattern.compile("(?<![\\w+])(\\+\\d{1,3}[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}(?!\\w)");

    private static final List<String> SOCIAL_HOSTS = List.of(
            "facebook.com", "twitter.com", "x.com", "linkedin.com",
            "instagram.com", "youtube.com", "pinterest.com");

    /** 소문자로 통일 */
    public static Set<String> emails(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) return out;
        Matcher m = EMAIL.matcher(text);
        while (m.find()) out.add(m.group().toLowerCase(Locale.ROOT));
        return out;
    }

    /** "mailto:a@b.com?subject=x" → "a@b.com" (형식이 아니면 null) */
    public static String emailFromMailto(String href) {
        if (href == null) return null;
        String s = href.trim();
        if (!s.regionMatches(true, 0, "mailto:", 0, 7)) return null;
        s = s.substring(7);
        int q = s.indexOf('?');
        if (q >= 0) s = s.substring(0, q);
        Matcher m = EMAIL.matcher(s);
        return m.find() ? m.group().toLowerCase(Locale.ROOT) : null;
    }

    /** 공백 하나로 정리한 원문 그대로 */
    public static Set<String> phones(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) return out;
        Matcher m = PHONE.matcher(text);
        while (m.find()) out.add(m.group().trim().replaceAll("\\s+", " "));
        return out;
    }

    /** host 가 소셜 서비스(또는 그 하위 도메인)이고 경로가 있는 링크 */
    public static boolean isSocialProfile(URI link) {
        if (link == null || link.getHost() == null) return false;
        String path = link.getRawPath();
        if (path == null || path.length() <= 1) return false;
        String host = link.getHost().toLowerCase(Locale.ROOT);
        for (String s : SOCIAL_HOSTS) {
            if (host.equals(s) || host.endsWith("." + s)) return true;
        }
        return false;
    }
}
