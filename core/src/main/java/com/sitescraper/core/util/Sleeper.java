package com.sitescraper.core.util;

import java.time.Duration;

/** 대기 추상화. 테스트에서는 가짜 구현으로 시간을 흘려보낸다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
