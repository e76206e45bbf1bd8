package com.sitescraper.core.util;

/** epoch millis 공급자 (robots 캐시 TTL, 호스트 지연 계산용) */
@FunctionalInterface
public interface MillisClock {
    long nowMillis();

    MillisClock SYSTEM = System::currentTimeMillis;
}
