package com.sitescraper.core.api;

import com.sitescraper.core.model.PageRecord;

import java.net.URI;

/** 원시 마크업 → PageRecord. 네트워크 I/O 없음, 어떤 입력에도 예외 없이 결과를 낸다. */
public interface IPageExtractor {
    PageRecord extract(byte[] body, URI baseUrl);
}
