package com.sitescraper.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 실행 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong attemptsTotal = new AtomicLong(0);   // fetch 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicLong successes = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);
    private final AtomicLong sumWallMs = new AtomicLong(0);       // URL 별 fetch+extract 벽시계 합
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addAttempts(long attempts) {
        attemptsTotal.addAndGet(attempts);
        if (attempts > 1) retriesTotal.addAndGet(attempts - 1);
    }
    public void addWallTimeMs(long wallMs) { sumWallMs.addAndGet(wallMs); }
    public void recordOutcome(PageOutcome o) {
        if (o.isSuccess()) successes.incrementAndGet(); else failures.incrementAndGet();
    }

    /** 작업 시작 시 호출. 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void enter() {
        int cur = inFlight.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(cur, Math::max);
    }
    public void exit() { inFlight.decrementAndGet(); }

    public Snapshot snapshot() {
        long visited = successes.get() + failures.get();
        long avg = (visited == 0) ? 0 : sumWallMs.get() / visited;
        return new Snapshot(attemptsTotal.get(), retriesTotal.get(), successes.get(), failures.get(),
                maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 */
    public record Snapshot(long attemptsTotal, long retriesTotal, long successes, long failures,
                           int maxObservedConcurrency, long avgPageMs) {}
}
