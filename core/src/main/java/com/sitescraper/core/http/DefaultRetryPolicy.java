package com.sitescraper.core.http;

import com.sitescraper.core.model.FetchResult;
import com.sitescraper.core.model.ScrapeConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * retriable 실패에서만 재시도.
 * 지연 = min(base × 2^(attempt-1), max) 에 ±jitter, 다시 max 로 상한.
 * 예: base 1s, max 30s → 1s, 2s, 4s, ... 30s
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final double jitter;
    private final DoubleSupplier random;   // [0,1)

    public DefaultRetryPolicy() { this(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.1); }

    public DefaultRetryPolicy(int maxRetries, Duration base, Duration max, double jitter) {
        this(maxRetries, base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    public DefaultRetryPolicy(int maxRetries, Duration base, Duration max, double jitter, DoubleSupplier random) {
        this.maxAttempts = 1 + Math.max(0, maxRetries);
        this.baseMillis = Math.max(0, base.toMillis());
        this.maxMillis = Math.max(baseMillis, max.toMillis());
        this.jitter = Math.max(0.0, Math.min(0.99, jitter));
        this.random = Objects.requireNonNull(random, "random");
    }

    public static DefaultRetryPolicy from(ScrapeConfig cfg) {
        return new DefaultRetryPolicy(cfg.getMaxRetries(), cfg.getRetryBaseDelay(),
                cfg.getRetryMaxDelay(), cfg.getRetryJitter());
    }

    @Override public boolean shouldRetry(FetchResult.Failure failure, int attempt) {
        if (attempt >= maxAttempts) return false;
        return failure != null && failure.retriable();
    }

    @Override public Duration nextDelay(int attempt) {
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long raw = Math.min(maxMillis, baseMillis * (1L << shift));
        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        long ms = Math.min(maxMillis, Math.round(raw * factor));
        return Duration.ofMillis(Math.max(0, ms));
    }

    @Override public int maxAttempts() { return maxAttempts; }

    @Override public Duration maxDelay() { return Duration.ofMillis(maxMillis); }
}
