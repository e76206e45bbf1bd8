package com.sitescraper.core.http;

import com.sitescraper.core.api.IFetcher;
import com.sitescraper.core.api.IPolitenessGate;
import com.sitescraper.core.model.FailureKind;
import com.sitescraper.core.model.FetchRequest;
import com.sitescraper.core.model.FetchResult;
import com.sitescraper.core.util.Sleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryingFetcher — 재시도 상태기계")
class RetryingFetcherTest {

    private static final URI U = URI.create("https://ex.com/p");

    /** 준비된 결과를 순서대로 돌려주는 fetcher */
    static final class ScriptedFetcher implements IFetcher {
        final Deque<FetchResult> script = new ArrayDeque<>();
        final List<FetchRequest> requests = new ArrayList<>();

        ScriptedFetcher then(FetchResult r) { script.addLast(r); return this; }

        @Override public FetchResult fetch(FetchRequest request) {
            requests.add(request);
            return script.isEmpty() ? status(200) : script.pollFirst();
        }
    }

    private static FetchResult status(int s) {
        if (s < 400) return new FetchResult.Success(U, U, s, new byte[0], null, "text/html", null);
        return FetchResult.Failure.httpStatus(U, s, null, null);
    }

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper sleeper = sleeps::add;
    private final RetryPolicy policy = new DefaultRetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(2), 0.0);

    private RetryingFetcher retrying(IFetcher f, IPolitenessGate gate) {
        return new RetryingFetcher(f, gate, policy, sleeper, Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("503 세 번 후 200 → Success, 시도 4회, 지연 100/200/400ms")
    void recoversAfterTransientErrors() {
        var f = new ScriptedFetcher().then(status(503)).then(status(503)).then(status(503)).then(status(200));
        var r = retrying(f, IPolitenessGate.OPEN).fetch(U, new AtomicBoolean(false));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.attempts()).isEqualTo(4);
        assertThat(f.requests).extracting(FetchRequest::attempt).containsExactly(1, 2, 3, 4);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
    }

    @Test
    @DisplayName("404 는 재시도하지 않음")
    void permanentFailureNotRetried() {
        var f = new ScriptedFetcher().then(status(404));
        var r = retrying(f, IPolitenessGate.OPEN).fetch(U, null);

        assertThat(r.attempts()).isEqualTo(1);
        assertThat(((FetchResult.Failure) r.last()).status()).isEqualTo(404);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("재시도 소진 → 마지막 실패 반환 (예외 아님)")
    void exhaustion() {
        var f = new ScriptedFetcher();
        for (int i = 0; i < 10; i++) f.then(status(500));
        var r = retrying(f, IPolitenessGate.OPEN).fetch(U, null);

        assertThat(r.isSuccess()).isFalse();
        assertThat(r.attempts()).isEqualTo(4);
        assertThat(f.requests).hasSize(4);
        assertThat(sleeps).hasSize(3);
    }

    @Test
    @DisplayName("Retry-After 힌트가 있으면 그 값(최대 지연으로 상한)")
    void retryAfterHonoredAndCapped() {
        var f = new ScriptedFetcher()
                .then(FetchResult.Failure.httpStatus(U, 429, Duration.ofMillis(700), null))
                .then(FetchResult.Failure.httpStatus(U, 429, Duration.ofMinutes(5), null))
                .then(status(200));
        var r = retrying(f, IPolitenessGate.OPEN).fetch(U, null);

        assertThat(r.isSuccess()).isTrue();
        assertThat(sleeps).containsExactly(Duration.ofMillis(700), Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("게이트는 매 시도 직전에 다시 확인")
    void gateConsultedEveryAttempt() {
        AtomicInteger admits = new AtomicInteger();
        IPolitenessGate counting = (url, maxWait) -> {
            admits.incrementAndGet();
            return IPolitenessGate.Verdict.ADMITTED;
        };
        var f = new ScriptedFetcher().then(status(502)).then(status(200));
        retrying(f, counting).fetch(U, null);

        assertThat(admits.get()).isEqualTo(2);
        assertThat(f.requests).hasSize(2);
    }

    @Test
    @DisplayName("robots 차단 → 네트워크 호출 없이 DISALLOWED")
    void disallowedNeverFetches() {
        var f = new ScriptedFetcher();
        var r = retrying(f, (url, w) -> IPolitenessGate.Verdict.DISALLOWED).fetch(U, null);

        assertThat(((FetchResult.Failure) r.last()).kind()).isEqualTo(FailureKind.DISALLOWED_BY_ROBOTS);
        assertThat(r.attempts()).isZero();
        assertThat(f.requests).isEmpty();
    }

    @Test
    @DisplayName("게이트 대기 초과는 재시도 가능, 계속 초과하면 POLITENESS_TIMEOUT")
    void politenessTimeout() {
        var f = new ScriptedFetcher();
        var r = retrying(f, (url, w) -> IPolitenessGate.Verdict.TIMED_OUT).fetch(U, null);

        assertThat(((FetchResult.Failure) r.last()).kind()).isEqualTo(FailureKind.POLITENESS_TIMEOUT);
        assertThat(f.requests).isEmpty();
        assertThat(sleeps).hasSize(3);

        sleeps.clear();
        AtomicInteger calls = new AtomicInteger();
        IPolitenessGate onceBusy = (url, w) -> calls.getAndIncrement() == 0
                ? IPolitenessGate.Verdict.TIMED_OUT : IPolitenessGate.Verdict.ADMITTED;
        var ok = retrying(new ScriptedFetcher(), onceBusy).fetch(U, null);
        assertThat(ok.isSuccess()).isTrue();
        assertThat(ok.attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("취소 플래그가 서 있으면 시도하지 않음")
    void cancelledBeforeAttempt() {
        var f = new ScriptedFetcher();
        var r = retrying(f, IPolitenessGate.OPEN).fetch(U, new AtomicBoolean(true));

        assertThat(((FetchResult.Failure) r.last()).kind()).isEqualTo(FailureKind.CANCELLED);
        assertThat(f.requests).isEmpty();
    }

    @Test
    @DisplayName("재시도 대기 중 취소되면 다음 시도 없이 CANCELLED")
    void cancelledDuringBackoff() {
        AtomicBoolean cancel = new AtomicBoolean(false);
        var f = new ScriptedFetcher().then(status(503)).then(status(200));
        Sleeper cancelling = d -> cancel.set(true);
        var r = new RetryingFetcher(f, IPolitenessGate.OPEN, policy, cancelling, Duration.ofSeconds(1))
                .fetch(U, cancel);

        assertThat(((FetchResult.Failure) r.last()).kind()).isEqualTo(FailureKind.CANCELLED);
        assertThat(r.attempts()).isEqualTo(1);
    }
}
