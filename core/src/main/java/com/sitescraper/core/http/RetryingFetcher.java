package com.sitescraper.core.http;

import com.sitescraper.core.api.IFetcher;
import com.sitescraper.core.api.IPolitenessGate;
import com.sitescraper.core.model.FetchRequest;
import com.sitescraper.core.model.FetchResult;
import com.sitescraper.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 재시도 상태기계: 시도 카운터 + 상한 있는 지수 지연.
 * 매 시도 직전에 취소 플래그와 politeness 게이트를 다시 확인한다.
 * 재시도 소진은 마지막 Failure 를 돌려줄 뿐 예외가 아니다.
 */
public final class RetryingFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingFetcher.class);

    /** 최종 결과 + 실제로 네트워크까지 간 시도 수 */
    public record Result(FetchResult last, int attempts) {
        public boolean isSuccess() { return last.isSuccess(); }
    }

    private final IFetcher fetcher;
    private final IPolitenessGate gate;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Duration gateMaxWait;

    public RetryingFetcher(IFetcher fetcher, IPolitenessGate gate, RetryPolicy policy,
                           Sleeper sleeper, Duration gateMaxWait) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.gateMaxWait = Objects.requireNonNull(gateMaxWait, "gateMaxWait");
    }

    public Result fetch(URI url, AtomicBoolean cancel) {
        Objects.requireNonNull(url, "url");
        FetchResult last = null;
        int sent = 0;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (cancelled(cancel)) return new Result(FetchResult.Failure.cancelled(url), sent);

            IPolitenessGate.Verdict verdict;
            try {
                verdict = gate.admit(url, gateMaxWait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Result(FetchResult.Failure.cancelled(url), sent);
            }

            if (verdict == IPolitenessGate.Verdict.DISALLOWED) {
                return new Result(FetchResult.Failure.disallowed(url), sent);
            }
            if (verdict == IPolitenessGate.Verdict.TIMED_OUT) {
                last = FetchResult.Failure.politenessTimeout(url, gateMaxWait);
            } else {
                if (cancelled(cancel)) return new Result(FetchResult.Failure.cancelled(url), sent);
                last = fetcher.fetch(FetchRequest.of(url, attempt));
                sent++;
            }

            if (!(last instanceof FetchResult.Failure f) || !policy.shouldRetry(f, attempt)) {
                return new Result(last, sent);
            }

            final int done = attempt;
            Duration delay = f.retryAfterHint()
                    .map(ra -> ra.compareTo(policy.maxDelay()) > 0 ? policy.maxDelay() : ra)
                    .orElseGet(() -> policy.nextDelay(done));
            LOG.debug("Retry {} for {} after {}ms ({})", attempt, url, delay.toMillis(), f.kind());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Result(FetchResult.Failure.cancelled(url), sent);
            }
        }
        return new Result(last, sent);
    }

    private static boolean cancelled(AtomicBoolean cancel) {
        return Thread.currentThread().isInterrupted() || (cancel != null && cancel.get());
    }
}
