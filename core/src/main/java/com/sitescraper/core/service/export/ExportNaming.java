package com.sitescraper.core.service.export;

import com.sitescraper.core.model.ExportFormat;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 출력 파일명: {@code <base>_<yyyyMMdd_HHmmss>.<ext>} */
public final class ExportNaming {
    private ExportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.systemDefault());

    public static Path path(Path dir, String nameBase, Instant at, ExportFormat format) {
        return dir.resolve(slug(nameBase) + "_" + TS_FMT.format(at) + "." + format.extension());
    }

    /** 파일명에 안전한 형태로. 비면 "scrape_report" */
    static String slug(String name) {
        if (name == null || name.isBlank()) return "scrape_report";
        String s = name.trim().toLowerCase(Locale.ROOT)
                .replaceFirst("^https?://", "")
                .replaceAll("[^a-z0-9._-]", "_")
                .replaceAll("_{2,}", "_")
                .replaceAll("^[_.]+|[_.]+$", "");
        if (s.length() > 60) s = s.substring(0, 60);
        return s.isEmpty() ? "scrape_report" : s;
    }
}
