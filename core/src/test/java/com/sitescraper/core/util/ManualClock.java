package com.sitescraper.core.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** 손으로 돌리는 시계. sleeper() 는 잠드는 대신 시계를 앞으로 민다 */
final class ManualClock implements MillisClock {
    private final AtomicLong now;
    final List<Duration> sleeps = new ArrayList<>();

    ManualClock(long start) { this.now = new AtomicLong(start); }

    void advance(long ms) { now.addAndGet(ms); }

    @Override public long nowMillis() { return now.get(); }

    Sleeper sleeper() {
        return d -> {
            sleeps.add(d);
            advance(d.toMillis());
        };
    }
}
