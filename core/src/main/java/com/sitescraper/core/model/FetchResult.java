package com.sitescraper.core.model;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fetcher 결과: {@link Success} 또는 {@link Failure}.
 * 한 번 생성되면 불변이며 Extractor 또는 재시도 로직이 한 번 소비한다.
 */
public interface FetchResult {

    URI url();

    Duration elapsed();

    default boolean isSuccess() { return this instanceof Success; }

    /** 2xx/3xx (리다이렉트 해소 후) 응답 */
    record Success(URI url,
                   URI finalUrl,
                   int status,
                   byte[] body,
                   Map<String, List<String>> headers,
                   String contentType,
                   Duration elapsed) implements FetchResult {

        public Success {
            Objects.requireNonNull(url, "url");
            finalUrl = (finalUrl == null) ? url : finalUrl;
            body = (body == null) ? new byte[0] : body;
            headers = (headers == null) ? Map.of() : Map.copyOf(headers);
            contentType = (contentType == null) ? "" : contentType;
            elapsed = (elapsed == null) ? Duration.ZERO : elapsed;
        }

        /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
        public String header(String name) {
            if (name == null) return null;
            for (var e : headers.entrySet()) {
                if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
                    List<String> vs = e.getValue();
                    return (vs == null || vs.isEmpty()) ? null : vs.get(0);
                }
            }
            return null;
        }
    }

    /**
     * 분류된 실패. status 는 HTTP 상태가 없으면 0.
     * retryAfter 는 서버가 Retry-After(초)를 준 경우에만 존재.
     */
    record Failure(URI url,
                   FailureKind kind,
                   boolean retriable,
                   int status,
                   String message,
                   Duration retryAfter,
                   Duration elapsed) implements FetchResult {

        public Failure {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(kind, "kind");
            message = (message == null) ? "" : message;
            elapsed = (elapsed == null) ? Duration.ZERO : elapsed;
        }

        public Optional<Duration> retryAfterHint() { return Optional.ofNullable(retryAfter); }

        public static Failure network(URI url, String msg, Duration elapsed) {
            return new Failure(url, FailureKind.NETWORK_ERROR, true, 0, msg, null, elapsed);
        }

        public static Failure timeout(URI url, String msg, Duration elapsed) {
            return new Failure(url, FailureKind.TIMEOUT, true, 0, msg, null, elapsed);
        }

        /** 429/5xx 는 재시도 가능, 그 외 4xx 는 불가 */
        public static Failure httpStatus(URI url, int status, Duration retryAfter, Duration elapsed) {
            boolean retriable = status == 429 || status >= 500;
            return new Failure(url, FailureKind.HTTP_STATUS, retriable, status,
                    "HTTP " + status, retriable ? retryAfter : null, elapsed);
        }

        public static Failure disallowed(URI url) {
            return new Failure(url, FailureKind.DISALLOWED_BY_ROBOTS, false, 0,
                    "disallowed by robots.txt", null, Duration.ZERO);
        }

        /** 다음 시도에서 게이트를 다시 확인하므로 재시도 가능으로 둔다 */
        public static Failure politenessTimeout(URI url, Duration waited) {
            return new Failure(url, FailureKind.POLITENESS_TIMEOUT, true, 0,
                    "per-host delay wait exceeded " + waited.toMillis() + "ms", null, waited);
        }

        public static Failure cancelled(URI url) {
            return new Failure(url, FailureKind.CANCELLED, false, 0, "cancelled", null, Duration.ZERO);
        }
    }
}
