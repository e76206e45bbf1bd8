package com.sitescraper.core.api;

import com.sitescraper.core.model.FetchRequest;
import com.sitescraper.core.model.FetchResult;

/**
 * 요청 1회 = 네트워크 호출 1회. 결과는 항상 분류된 값으로 돌려주고 예외를 던지지 않는다.
 * 재시도/간격 제어는 호출자 몫.
 */
public interface IFetcher extends AutoCloseable {
    FetchResult fetch(FetchRequest request);
    @Override default void close() throws Exception {}
}
