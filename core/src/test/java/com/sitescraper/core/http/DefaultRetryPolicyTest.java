package com.sitescraper.core.http;

import com.sitescraper.core.model.FetchResult;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DefaultRetryPolicyTest {

    private static final URI U = URI.create("https://ex.com/");

    @Test
    void exponentialCappedWithoutJitter() {
        var p = new DefaultRetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(5), 0.0);
        assertEquals(Duration.ofSeconds(1), p.nextDelay(1));
        assertEquals(Duration.ofSeconds(2), p.nextDelay(2));
        assertEquals(Duration.ofSeconds(4), p.nextDelay(3));
        assertEquals(Duration.ofSeconds(5), p.nextDelay(4));   // 8s → 5s 상한
        assertEquals(Duration.ofSeconds(5), p.nextDelay(40));  // 오버플로 없음
    }

    @Test
    void jitterStaysWithinBandAndCap() {
        var low = new DefaultRetryPolicy(3, Duration.ofMillis(1000), Duration.ofSeconds(30), 0.1, () -> 0.0);
        var high = new DefaultRetryPolicy(3, Duration.ofMillis(1000), Duration.ofSeconds(30), 0.1, () -> 0.999999);
        assertEquals(900, low.nextDelay(1).toMillis());
        assertEquals(1100, high.nextDelay(1).toMillis());

        var capped = new DefaultRetryPolicy(3, Duration.ofSeconds(30), Duration.ofSeconds(30), 0.5, () -> 0.999999);
        assertEquals(30_000, capped.nextDelay(1).toMillis());
    }

    @Test
    void retriesOnlyRetriableWithinBudget() {
        var p = new DefaultRetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(100), 0.0);
        assertEquals(4, p.maxAttempts());

        var s503 = FetchResult.Failure.httpStatus(U, 503, null, null);
        var s404 = FetchResult.Failure.httpStatus(U, 404, null, null);
        assertTrue(p.shouldRetry(s503, 1));
        assertTrue(p.shouldRetry(s503, 3));
        assertFalse(p.shouldRetry(s503, 4));
        assertFalse(p.shouldRetry(s404, 1));
    }

    @Test
    void zeroRetriesMeansSingleAttempt() {
        var p = new DefaultRetryPolicy(0, Duration.ofMillis(10), Duration.ofMillis(100), 0.0);
        assertEquals(1, p.maxAttempts());
        assertFalse(p.shouldRetry(FetchResult.Failure.timeout(U, "t", null), 1));
    }
}
