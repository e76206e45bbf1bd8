package com.sitescraper.core.http;

import com.sitescraper.core.api.IFetcher;
import com.sitescraper.core.model.FailureKind;
import com.sitescraper.core.model.FetchRequest;
import com.sitescraper.core.model.FetchResult;
import com.sitescraper.core.model.ScrapeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/** java.net.http 기반 Fetcher: 요청 1회를 보내고 결과를 Success/Failure 로 분류 */
public class HttpFetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final ScrapeConfig config;
    private final HttpSender sender;

    public HttpFetcher(ScrapeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpFetcher(ScrapeConfig config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    public FetchResult fetch(FetchRequest request) {
        Objects.requireNonNull(request, "request");
        URI url = request.url();
        long start = System.nanoTime();
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.5")
                    .GET()
                    .build();

            HttpResponse<byte[]> resp = sender.send(req);
            Duration elapsed = since(start);
            int status = resp.statusCode();

            if (status >= 200 && status < 400) {
                return new FetchResult.Success(
                        url,
                        resp.uri() == null ? url : resp.uri(),
                        status,
                        resp.body(),
                        resp.headers().map(),
                        resp.headers().firstValue("Content-Type").orElse(""),
                        elapsed);
            }
            Duration retryAfter = parseRetryAfter(resp.headers().firstValue("Retry-After").orElse(null), Instant.now());
            LOG.debug("HTTP {} for {} (attempt {})", status, url, request.attempt());
            return FetchResult.Failure.httpStatus(url, status, retryAfter, elapsed);

        } catch (HttpTimeoutException e) {
            return FetchResult.Failure.timeout(url, e.getMessage(), since(start));
        } catch (IOException e) {
            return FetchResult.Failure.network(url, e.toString(), since(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.Failure.cancelled(url);
        } catch (IllegalArgumentException e) {
            // 요청 자체를 만들 수 없는 URL: 재시도해도 같음
            return new FetchResult.Failure(url, FailureKind.NETWORK_ERROR, false,
                    0, e.getMessage(), null, since(start));
        }
    }

    /** Retry-After: 초(정수) 또는 HTTP-date. 해석 불가면 null */
    static Duration parseRetryAfter(String value, Instant now) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim();
        try {
            long sec = Long.parseLong(v);
            return sec < 0 ? null : Duration.ofSeconds(sec);
        } catch (NumberFormatException ignore) {
            // HTTP-date 형태로 재시도
        }
        try {
            Instant at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration d = Duration.between(now, at);
            return d.isNegative() ? Duration.ZERO : d;
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
