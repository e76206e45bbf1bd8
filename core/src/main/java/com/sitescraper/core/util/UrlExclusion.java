package com.sitescraper.core.util;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** 크롤 중 발견 링크 제외 규칙 (경로 패턴 + 확장자) */
public final class UrlExclusion {
    private UrlExclusion(){}

    /**
     * patterns 지원:
     * <ul>
     *   <li>접두(prefix): {@code "/logout"} 또는 {@code "https://host/path"}</li>
     *   <li>glob: {@code '*'}, {@code '?'} 포함 (예: {@code "/admin/*"})</li>
     *   <li>정규식: {@code "re:"} 접두 (예: {@code re:\?.*sessionid=})</li>
     * </ul>
     */
    public static boolean isExcluded(URI url, List<String> patterns){
        if (url == null || patterns == null || patterns.isEmpty()) return false;
        final String s = url.toString();
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;

            if (p.startsWith("re:")) {
                if (Pattern.compile(p.substring(3), Pattern.CASE_INSENSITIVE).matcher(s).find()) return true;
            } else if (p.indexOf('*') >= 0 || p.indexOf('?') >= 0) {
                String rx = p.startsWith("/") ? globToRegex(p) + "$" : globToRegex(p);
                String subject = p.startsWith("/") ? pathAndQuery(url) : s;
                if (Pattern.compile("^" + rx, Pattern.CASE_INSENSITIVE).matcher(subject).find()) return true;
            } else {
                if (s.startsWith(p)) return true;
                if (p.startsWith("/") && pathAndQuery(url).startsWith(p)) return true;
            }
        }
        return false;
    }

    /** 경로의 마지막 세그먼트 확장자가 목록에 있으면 true (".pdf" 또는 "pdf" 모두 허용) */
    public static boolean hasSkippedExtension(URI url, List<String> extensions) {
        if (url == null || extensions == null || extensions.isEmpty()) return false;
        String path = url.getRawPath();
        if (path == null) return false;
        int slash = path.lastIndexOf('/');
        String last = path.substring(slash + 1).toLowerCase(Locale.ROOT);
        int dot = last.lastIndexOf('.');
        if (dot < 0) return false;
        String ext = last.substring(dot);
        for (String e : extensions) {
            if (e == null || e.isBlank()) continue;
            String norm = e.trim().toLowerCase(Locale.ROOT);
            if (!norm.startsWith(".")) norm = "." + norm;
            if (norm.equals(ext)) return true;
        }
        return false;
    }

    private static String pathAndQuery(URI url) {
        String path = url.getRawPath() == null || url.getRawPath().isEmpty() ? "/" : url.getRawPath();
        return url.getRawQuery() == null ? path : path + "?" + url.getRawQuery();
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append(".*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
