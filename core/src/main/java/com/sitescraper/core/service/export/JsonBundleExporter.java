package com.sitescraper.core.service.export;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sitescraper.core.model.ExportBundle;
import com.sitescraper.core.model.ExportFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/** JSON: 행 객체 배열 (indent 2, 시각은 ISO-8601) */
public final class JsonBundleExporter implements BundleExporter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override public ExportFormat format() { return ExportFormat.JSON; }

    @Override
    public void write(List<BundleRow> rows, Path target) throws IOException {
        om.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), rows);
    }

    public List<BundleRow> readRows(Path file) throws IOException {
        if (!Files.exists(file)) throw new IOException("not found: " + file);
        return om.readValue(file.toFile(), new TypeReference<List<BundleRow>>() {});
    }

    /** 내보낸 JSON 을 다시 번들로 (순서 유지, 봉인 상태로 반환) */
    public ExportBundle read(Path file) throws IOException {
        ExportBundle bundle = new ExportBundle(Instant.now());
        for (BundleRow r : readRows(file)) {
            try {
                bundle.add(r.toOutcome());
            } catch (IllegalArgumentException e) {
                throw new IOException("invalid row '" + r.key + "': " + e.getMessage(), e);
            }
        }
        return bundle.seal(Instant.now());
    }
}
