package com.sitescraper.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 방문한 URL 하나의 결과. record 와 error 중 정확히 하나만 존재한다.
 * key 는 정규화된 URL 문자열, url 은 실제로 요청한 URL.
 */
public record PageOutcome(String key, URI url, int depth, int attempts, PageRecord record, ErrorMarker error) {

    public PageOutcome {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(url, "url");
        if ((record == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of record/error must be set");
        }
    }

    public static PageOutcome success(URI url, int depth, int attempts, PageRecord record) {
        return success(url.toString(), url, depth, attempts, record);
    }

    public static PageOutcome success(String key, URI url, int depth, int attempts, PageRecord record) {
        return new PageOutcome(key, url, depth, attempts, Objects.requireNonNull(record, "record"), null);
    }

    public static PageOutcome failure(URI url, int depth, int attempts, ErrorMarker error) {
        return failure(url.toString(), url, depth, attempts, error);
    }

    public static PageOutcome failure(String key, URI url, int depth, int attempts, ErrorMarker error) {
        return new PageOutcome(key, url, depth, attempts, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() { return record != null; }

    /** 한 줄 요약: "OK 200 https://..." / "FAIL TIMEOUT https://..." */
    public String summary() {
        if (record != null) return "OK " + record.getStatus() + " " + url;
        return "FAIL " + error.label() + " " + url;
    }
}
