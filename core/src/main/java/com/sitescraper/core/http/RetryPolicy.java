package com.sitescraper.core.http;

import com.sitescraper.core.model.FetchResult;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt는 1부터 시작(방금 끝난 시도 번호). true면 지연 후 재시도. */
    boolean shouldRetry(FetchResult.Failure failure, int attempt);
    /** attempt 실패 후 다음 시도까지의 지연. */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함). maxRetries=3 이면 4. */
    int maxAttempts();
    /** 서버 Retry-After 를 따를 때의 상한 */
    Duration maxDelay();
}
