package com.sitescraper.core.model;

import com.sitescraper.core.util.UrlUtils;

import java.net.URI;
import java.util.Objects;

/** 시도 1회분 요청. attempt 는 1부터. */
public record FetchRequest(URI url, int attempt, String domain) {

    public FetchRequest {
        Objects.requireNonNull(url, "url");
        if (!url.isAbsolute()) throw new IllegalArgumentException("url must be absolute: " + url);
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
        domain = (domain == null) ? UrlUtils.host(url) : domain;
    }

    public static FetchRequest of(URI url, int attempt) {
        return new FetchRequest(url, attempt, UrlUtils.host(url));
    }
}
