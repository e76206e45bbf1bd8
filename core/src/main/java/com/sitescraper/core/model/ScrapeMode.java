package com.sitescraper.core.model;

import java.util.Locale;

/** 실행 모드: 단일 페이지 / 사이트 크롤 / URL 목록 */
public enum ScrapeMode {
    SINGLE, CRAWL, BATCH;

    public static ScrapeMode parse(String s) {
        if (s == null || s.isBlank()) throw new ScrapeConfigException("mode must not be blank");
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "1": case "single": return SINGLE;
            case "2": case "crawl": return CRAWL;
            case "3": case "batch": case "list": return BATCH;
            default: throw new ScrapeConfigException("unknown mode: " + s);
        }
    }
}
