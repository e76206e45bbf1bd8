package com.sitescraper.core.service.export;

import com.sitescraper.core.model.ExportFormat;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** CSV (RFC 4180, UTF-8): 헤더 1줄 + 행마다 1줄, 목록 값은 " | " 로 연결 */
public final class CsvBundleExporter implements BundleExporter {

    static final CSVFormat FORMAT = CSVFormat.RFC4180.builder()
            .setHeader(BundleRow.COLUMNS.toArray(new String[0]))
            .build();

    @Override public ExportFormat format() { return ExportFormat.CSV; }

    @Override
    public void write(List<BundleRow> rows, Path target) throws IOException {
        try (Writer w = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, FORMAT)) {
            for (BundleRow r : rows) {
                printer.printRecord(r.cells());
            }
        }
    }
}
