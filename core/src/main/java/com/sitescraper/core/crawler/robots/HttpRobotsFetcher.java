package com.sitescraper.core.crawler.robots;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

public final class HttpRobotsFetcher implements RobotsFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpRobotsFetcher.class);

    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;

    /** client 는 Redirect.NEVER 여야 repository 가 리다이렉트를 판단할 수 있다 */
    public HttpRobotsFetcher(HttpClient client, String userAgent, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public static HttpRobotsFetcher create(String userAgent, Duration timeout) {
        HttpClient c = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(timeout)
                .build();
        return new HttpRobotsFetcher(c, userAgent, timeout);
    }

    @Override
    public Response fetch(URI robotsTxtUri) {
        try {
            HttpRequest req = HttpRequest.newBuilder(robotsTxtUri)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/plain,*/*;q=0.8")
                    .GET()
                    .build();
            HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int code = res.statusCode();
            if (code == 301 || code == 302 || code == 303 || code == 307 || code == 308) {
                URI next = res.headers().firstValue("Location").map(robotsTxtUri::resolve).orElse(null);
                return Response.redirect(code, next);
            }
            return Response.ok(code, res.body());
        } catch (IOException | IllegalArgumentException e) {
            LOG.debug("robots.txt fetch failed: {} ({})", robotsTxtUri, e.toString());
            return Response.networkError();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Response.networkError();
        }
    }
}
