package com.sitescraper.core.util;

import com.sitescraper.core.model.ScrapeConfigException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + 도메인 스코프 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로는 "/", 중복 슬래시 축소, 루트가 아닌 경로의 끝 슬래시 제거
     * - fragment 제거
     * 퍼센트 인코딩은 raw 그대로 유지한다(디코드 후 재인코딩하지 않음).
     */
    public static URI normalize(URI u) {
        if (u == null) return null;
        if (u.isOpaque() || u.getHost() == null) return u;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost().toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = u.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        path = path.replaceAll("/{2,}", "/");
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());

        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /**
     * fetch 용 정리: scheme/host 소문자, 기본 포트 제거, 빈 경로는 "/", fragment 제거.
     * 경로는 그대로 둔다(끝 슬래시 유지). 상대 링크의 기준 URL 이 되기 때문.
     * 방문 집합 비교에는 {@link #normalize(URI)} 를 쓴다.
     */
    public static URI clean(URI u) {
        if (u == null) return null;
        if (u.isOpaque() || u.getHost() == null) return u;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }
        String path = u.getRawPath();
        if (path == null || path.isEmpty()) path = "/";

        StringBuilder sb = new StringBuilder(scheme).append("://");
        if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
        sb.append(u.getHost().toLowerCase(Locale.ROOT));
        if (port >= 0) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());

        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /** 방문 집합/번들 키: normalize 결과 문자열 */
    public static String key(URI u) {
        return normalize(u).toString();
    }

    /** 소문자 host (없으면 빈 문자열) */
    public static String host(URI u) {
        if (u == null || u.getHost() == null) return "";
        return u.getHost().toLowerCase(Locale.ROOT);
    }

    /** host 기준 동일 도메인 판정(소문자 비교) */
    public static boolean sameDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        return host(a).equals(host(b));
    }

    /** scopeHost 와 같거나, includeSubdomains 일 때 그 하위 도메인이면 true */
    public static boolean inScope(URI u, String scopeHost, boolean includeSubdomains) {
        String h = host(u);
        if (h.isEmpty() || scopeHost == null) return false;
        String scope = scopeHost.toLowerCase(Locale.ROOT);
        if (h.equals(scope)) return true;
        return includeSubdomains && h.endsWith("." + scope);
    }

    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme().toLowerCase(Locale.ROOT);
        return (s.equals("http") || s.equals("https")) && !host(u).isEmpty();
    }

    /**
     * 사용자 입력 URL 검증. 절대 http/https URL 이 아니면 ScrapeConfigException.
     * 실행 전에 호출되어 fetch 가 한 번도 일어나지 않도록 한다.
     */
    public static URI parseSeed(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ScrapeConfigException("url must not be blank");
        }
        URI u;
        try {
            u = new URI(raw.trim());
        } catch (URISyntaxException e) {
            throw new ScrapeConfigException("malformed url: " + raw, e);
        }
        if (!isHttp(u)) {
            throw new ScrapeConfigException("url must be absolute http/https: " + raw);
        }
        return clean(u);
    }
}
