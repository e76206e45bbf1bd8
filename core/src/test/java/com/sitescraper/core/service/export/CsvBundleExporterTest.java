package com.sitescraper.core.service.export;

import com.sitescraper.core.model.ExportBundle;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CsvBundleExporter: 헤더 + 행, 목록은 ' | ' 로 연결")
class CsvBundleExporterTest {

    @TempDir
    Path tmp;

    private List<CSVRecord> writeAndParse(ExportBundle bundle, List<String> header) throws Exception {
        List<BundleRow> rows = new ArrayList<>();
        bundle.list().forEach(o -> rows.add(BundleRow.of(o)));
        Path file = tmp.resolve("out.csv");
        new CsvBundleExporter().write(rows, file);

        CSVFormat fmt = CSVFormat.RFC4180.builder().setHeader().setSkipHeaderRecord(true).build();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CSVParser.parse(r, fmt)) {
            header.addAll(parser.getHeaderNames());
            return parser.getRecords();
        }
    }

    @Test
    @DisplayName("헤더는 고정 열 순서, 행 수 = 번들 크기")
    void headerAndRowCount() throws Exception {
        List<String> header = new ArrayList<>();
        List<CSVRecord> records = writeAndParse(Bundles.mixed(), header);

        assertThat(header).containsExactlyElementsOf(BundleRow.COLUMNS);
        assertThat(records).hasSize(4);
        assertThat(records).extracting(rec -> rec.get("key"))
                .containsExactly("https://ex.com/", "https://ex.com/bare", "https://ex.com/gone", "https://ex.com/slow");
    }

    @Test
    @DisplayName("쉼표/따옴표/줄바꿈이 있는 값도 그대로 복원")
    void quotingSurvivesParse() throws Exception {
        CSVRecord first = writeAndParse(Bundles.mixed(), new ArrayList<>()).get(0);

        assertThat(first.get("title")).isEqualTo("Home, \"quoted\"");
        assertThat(first.get("meta_description")).isEqualTo("Line one\nline two");
        assertThat(first.get("fetched_at")).isEqualTo("2024-05-01T10:15:30Z");
    }

    @Test
    @DisplayName("목록/맵 셀은 ' | ' 로 연결")
    void listCells() throws Exception {
        CSVRecord first = writeAndParse(Bundles.mixed(), new ArrayList<>()).get(0);

        assertThat(first.get("links")).isEqualTo("https://ex.com/a | https://ex.com/b?x=1");
        assertThat(first.get("headings")).isEqualTo("h1: Welcome | h2: News | h2: Contact");
        assertThat(first.get("meta")).isEqualTo("og:title=Home");
        assertThat(first.get("emails")).isEqualTo("info@ex.com");
    }

    @Test
    @DisplayName("표는 개수, 목록/폼/JSON-LD 는 연결 문자열")
    void structureCells() throws Exception {
        CSVRecord first = writeAndParse(Bundles.mixed(), new ArrayList<>()).get(0);

        assertThat(first.get("paragraphs")).isEqualTo("Welcome to the site, friends");
        assertThat(first.get("tables")).isEqualTo("1");
        assertThat(first.get("ordered_lists")).isEqualTo("first; second");
        assertThat(first.get("unordered_lists")).isEqualTo("apple");
        assertThat(first.get("forms")).isEqualTo("POST /login (2 inputs)");
        assertThat(first.get("scripts")).isEqualTo("https://ex.com/app.js");
        assertThat(first.get("stylesheets")).isEqualTo("https://ex.com/site.css");
        assertThat(first.get("structured_data")).isEqualTo("{\"@type\":\"Organization\",\"name\":\"Ex\"}");
        assertThat(first.get("link_texts")).isEqualTo("https://ex.com/a=About us");
        assertThat(first.get("image_alts")).isEqualTo("https://ex.com/logo.png=Logo");

        CSVRecord bare = writeAndParse(Bundles.mixed(), new ArrayList<>()).get(1);
        assertThat(bare.get("tables")).isEqualTo("0");
        assertThat(bare.get("forms")).isEmpty();
    }

    @Test
    @DisplayName("실패 행: 추출 필드는 비고 error_kind/status 채움")
    void failureRows() throws Exception {
        List<CSVRecord> records = writeAndParse(Bundles.mixed(), new ArrayList<>());

        CSVRecord gone = records.get(2);
        assertThat(gone.get("outcome")).isEqualTo(BundleRow.FAILED);
        assertThat(gone.get("status")).isEqualTo("404");
        assertThat(gone.get("error_kind")).isEqualTo("HTTP_STATUS");
        assertThat(gone.get("title")).isEmpty();
        assertThat(gone.get("links")).isEmpty();

        CSVRecord slow = records.get(3);
        assertThat(slow.get("status")).isEmpty();
        assertThat(slow.get("attempts")).isEqualTo("4");
        assertThat(slow.get("error_message")).isEqualTo("read timed out");
    }
}
