package com.sitescraper.core.service;

import com.sitescraper.core.model.ExportBundle;
import com.sitescraper.core.model.ExportFormat;
import com.sitescraper.core.model.ExportReport;
import com.sitescraper.core.model.FailureKind;
import com.sitescraper.core.model.PageOutcome;
import com.sitescraper.core.model.ScrapeConfig;
import com.sitescraper.core.model.ScrapeConfigException;
import com.sitescraper.core.service.export.JsonBundleExporter;
import com.sitescraper.core.util.ProgressListener;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScrapeService: 로컬 HTTP 서버 대상 통합 테스트")
class ScrapeServiceTest {

    private HttpServer server;
    private String base;
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

    @TempDir
    Path tmp;

    private static final Map<String, String> PAGES = Map.of(
            "/", """
                 <html><head><title>Home</title></head><body>
                 <h1>Welcome</h1>
                 <a href="/a">A</a> <a href="/b">B</a> <a href="/private/x">secret</a>
                 <a href="/missing">gone</a> <a href="https://other.example/">elsewhere</a>
                 <a href="/files/report.pdf">pdf</a>
                 </body></html>
                 """,
            "/a", """
                  <html><head><title>Page A</title></head><body>
                  <p>Mail us at team@example.com</p><a href="/c">deeper</a>
                  </body></html>
                  """,
            "/b", "<html><head><title>Page B</title></head><body><p>just b</p></body></html>",
            "/c", "<html><head><title>Page C</title></head><body>too deep</body></html>",
            "/private/x", "<html><body>should never be fetched</body></html>");

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(HttpExchange ex) throws IOException {
        String path = ex.getRequestURI().getPath();
        hits.computeIfAbsent(path, k -> new AtomicInteger()).incrementAndGet();

        int status = 200;
        String type = "text/html; charset=utf-8";
        String body;
        if (path.equals("/robots.txt")) {
            type = "text/plain";
            body = "User-agent: *\nDisallow: /private/\n";
        } else if (PAGES.containsKey(path)) {
            body = PAGES.get(path);
        } else {
            status = 404;
            body = "not found";
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", type);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private int hitsOf(String path) {
        AtomicInteger n = hits.get(path);
        return n == null ? 0 : n.get();
    }

    private ScrapeConfig cfg() {
        return ScrapeConfig.defaults()
                .setBaseDelay(Duration.ZERO)
                .setTimeout(Duration.ofSeconds(5))
                .setMaxRetries(1)
                .setRetryBaseDelay(Duration.ofMillis(10))
                .setRetryMaxDelay(Duration.ofMillis(20))
                .setRetryJitter(0)
                .setMaxConcurrentFetches(2)
                .setMaxDepth(1)
                .setMaxPages(50)
                .setOutputDir(tmp);
    }

    @Test
    @DisplayName("crawlSite: 깊이 1, 도메인 안, robots 금지 경로는 요청 없이 실패 표식")
    void crawlSite() {
        ScrapeService svc = new ScrapeService();
        List<PageOutcome> seen = new ArrayList<>();

        ExportBundle bundle = svc.crawlSite(base + "/", cfg(), new ProgressListener() {
            @Override public void onProgress(double p, String phase, long done, long total) {}
            @Override public synchronized void onOutcome(PageOutcome o) { seen.add(o); }
        }, new AtomicBoolean(false));

        assertThat(bundle.isSealed()).isTrue();
        assertThat(bundle.isCancelled()).isFalse();
        assertThat(bundle.outcomes().keySet()).containsExactlyInAnyOrder(
                base + "/", base + "/a", base + "/b", base + "/private/x", base + "/missing");
        assertThat(seen).hasSize(bundle.size());

        assertThat(bundle.get(base + "/").record().getTitle()).isEqualTo("Home");
        assertThat(bundle.get(base + "/a").record().getEmails()).containsExactly("team@example.com");

        PageOutcome disallowed = bundle.get(base + "/private/x");
        assertThat(disallowed.error().kind()).isEqualTo(FailureKind.DISALLOWED_BY_ROBOTS);
        assertThat(hitsOf("/private/x")).isZero();

        PageOutcome missing = bundle.get(base + "/missing");
        assertThat(missing.error().kind()).isEqualTo(FailureKind.HTTP_STATUS);
        assertThat(missing.error().httpStatus()).isEqualTo(404);
        assertThat(missing.attempts()).isEqualTo(1);

        assertThat(hitsOf("/c")).isZero();
        assertThat(hitsOf("/files/report.pdf")).isZero();
        assertThat(hitsOf("/robots.txt")).isEqualTo(1);
        assertThat(hitsOf("/a")).isEqualTo(1);

        assertThat(svc.lastStats().successes()).isEqualTo(3);
    }

    @Test
    @DisplayName("robots 무시 설정이면 robots.txt 를 읽지 않는다")
    void robotsIgnored() {
        ScrapeConfig c = cfg();
        c.getRobots().setRespect(false);

        ExportBundle bundle = new ScrapeService().crawlSite(base + "/", c);

        assertThat(hitsOf("/robots.txt")).isZero();
        assertThat(bundle.get(base + "/private/x").isSuccess()).isTrue();
    }

    @Test
    @DisplayName("scrapeSingle: 링크는 따라가지 않는다")
    void single() {
        PageOutcome o = new ScrapeService().scrapeSingle(base + "/a", cfg());

        assertThat(o.isSuccess()).isTrue();
        assertThat(o.record().getTitle()).isEqualTo("Page A");
        assertThat(o.record().getLinks()).extracting(Object::toString).contains(base + "/c");
        assertThat(hitsOf("/c")).isZero();
    }

    @Test
    @DisplayName("scrapeBatch: 중복은 한 번만, 실패도 결과에 남는다")
    void batch() {
        ExportBundle bundle = new ScrapeService().scrapeBatch(
                List.of(base + "/a", base + "/a#frag", base + "/b", base + "/nope"), cfg());

        assertThat(bundle.size()).isEqualTo(3);
        assertThat(bundle.successCount()).isEqualTo(2);
        assertThat(hitsOf("/a")).isEqualTo(1);
        assertThat(hitsOf("/c")).isZero();
        assertThat(bundle.get(base + "/nope").error().httpStatus()).isEqualTo(404);
    }

    @Test
    @DisplayName("scrapeBatch: 잘못된 URL 이 하나라도 있으면 요청 전에 거부")
    void batchRejectsMalformed() {
        ScrapeService svc = new ScrapeService();
        assertThatThrownBy(() -> svc.scrapeBatch(List.of(base + "/a", "not a url"), cfg()))
                .isInstanceOf(ScrapeConfigException.class);
        assertThatThrownBy(() -> svc.scrapeBatch(List.of(), cfg()))
                .isInstanceOf(ScrapeConfigException.class);
        assertThatThrownBy(() -> svc.crawlSite("ftp://example.com/", cfg()))
                .isInstanceOf(ScrapeConfigException.class);
        assertThat(hits).isEmpty();
    }

    @Test
    @DisplayName("잘못된 설정은 fetch 전에 거부")
    void invalidConfig() {
        assertThatThrownBy(() -> new ScrapeService().crawlSite(base + "/", cfg().setMaxPages(0)))
                .isInstanceOf(ScrapeConfigException.class)
                .hasMessageContaining("maxPages");
        assertThat(hits).isEmpty();
    }

    @Test
    @DisplayName("취소된 상태로 시작하면 아무것도 가져오지 않는다")
    void cancelledBeforeStart() {
        PageOutcome o = new ScrapeService().scrapeSingle(base + "/a", cfg(),
                ProgressListener.NONE, new AtomicBoolean(true));

        assertThat(o.isSuccess()).isFalse();
        assertThat(o.error().kind()).isEqualTo(FailureKind.CANCELLED);
        assertThat(hitsOf("/a")).isZero();
    }

    @Test
    @DisplayName("export: 출력 디렉터리에 포맷별 파일, JSON 은 다시 읽힌다")
    void exportToOutputDir() throws Exception {
        ScrapeService svc = new ScrapeService();
        ExportBundle bundle = svc.crawlSite(base + "/", cfg());

        ExportReport report = svc.export(bundle, EnumSet.of(ExportFormat.JSON, ExportFormat.CSV), "local", cfg());

        assertThat(report.hasFailures()).isFalse();
        assertThat(report.writtenPaths()).hasSize(2).allSatisfy(p -> assertThat(p.getParent()).isEqualTo(tmp));
        ExportBundle back = new JsonBundleExporter().read(report.getWritten().get(ExportFormat.JSON));
        assertThat(back.outcomes().keySet()).containsExactlyElementsOf(bundle.outcomes().keySet());
        assertThat(Files.readAllLines(report.getWritten().get(ExportFormat.CSV))).isNotEmpty();

        assertThatThrownBy(() -> svc.export(bundle, EnumSet.noneOf(ExportFormat.class), "x", cfg()))
                .isInstanceOf(ScrapeConfigException.class);
    }
}
