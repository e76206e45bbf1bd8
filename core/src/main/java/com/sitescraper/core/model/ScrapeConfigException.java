package com.sitescraper.core.model;

/** 잘못된 설정/입력(URL 포함). 실행 시작 전에 호출자에게 바로 전달된다. */
public class ScrapeConfigException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ScrapeConfigException(String message) {
        super(message);
    }

    public ScrapeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
