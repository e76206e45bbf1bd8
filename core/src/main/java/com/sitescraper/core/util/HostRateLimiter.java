package com.sitescraper.core.util;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 호스트별 최소 간격 리미터.
 * - 같은 호스트에 대한 두 통과 시각의 차이는 항상 minDelay 이상
 * - "마지막 시각 확인 → 대기 → 기록" 을 호스트 락 하나 안에서 수행
 * - 모든 대기는 maxWait 로 상한. 넘을 것 같으면 통과시키지 않고 false
 */
public final class HostRateLimiter {

    private final long baseDelayMs;
    private final MillisClock clock;
    private final Sleeper sleeper;
    private final Map<String, HostSlot> slots = new ConcurrentHashMap<>();

    public HostRateLimiter(Duration minDelay) {
        this(minDelay, MillisClock.SYSTEM, DefaultSleeper.INSTANCE);
    }

    public HostRateLimiter(Duration minDelay, MillisClock clock, Sleeper sleeper) {
        Objects.requireNonNull(minDelay, "minDelay");
        if (minDelay.isNegative()) throw new IllegalArgumentException("minDelay must be >= 0");
        this.baseDelayMs = minDelay.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * host 에 대한 통과권을 얻는다.
     * @return 통과하면 true, maxWait 안에 통과할 수 없으면 false (시각 기록 없음)
     */
    public boolean acquire(String host, Duration maxWait) throws InterruptedException {
        long budgetMs = (maxWait == null) ? 0 : Math.max(0, maxWait.toMillis());
        long deadline = clock.nowMillis() + budgetMs;
        HostSlot slot = slot(host);

        if (!slot.lock.tryLock(budgetMs, TimeUnit.MILLISECONDS)) {
            return false;
        }
        try {
            long now = clock.nowMillis();
            if (slot.passed) {
                long nextAllowed = slot.lastPassMs + slot.delayMs;
                long wait = nextAllowed - now;
                if (wait > 0) {
                    if (now + wait > deadline) return false;
                    sleeper.sleep(Duration.ofMillis(wait));
                    now = Math.max(clock.nowMillis(), nextAllowed);
                }
            }
            slot.lastPassMs = now;
            slot.passed = true;
            return true;
        } finally {
            slot.lock.unlock();
        }
    }

    /** robots Crawl-delay 등으로 호스트별 간격을 늘린다. 기본값보다 작아지지는 않음 */
    public void raiseMinDelay(String host, Duration delay) {
        if (delay == null) return;
        HostSlot slot = slot(host);
        slot.lock.lock();
        try {
            slot.delayMs = Math.max(slot.delayMs, delay.toMillis());
        } finally {
            slot.lock.unlock();
        }
    }

    public Duration minDelayFor(String host) {
        HostSlot slot = slots.get(key(host));
        return Duration.ofMillis(slot == null ? baseDelayMs : slot.delayMs);
    }

    private HostSlot slot(String host) {
        return slots.computeIfAbsent(key(host), k -> new HostSlot(baseDelayMs));
    }

    private static String key(String host) {
        return host == null ? "" : host.toLowerCase(Locale.ROOT);
    }

    private static final class HostSlot {
        final ReentrantLock lock = new ReentrantLock(true);
        long delayMs;
        long lastPassMs;
        boolean passed;
        HostSlot(long delayMs) { this.delayMs = delayMs; }
    }
}
