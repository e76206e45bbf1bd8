package com.sitescraper.core.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum ExportFormat {
    JSON("json"),
    CSV("csv"),
    EXCEL("xlsx");

    private final String extension;

    ExportFormat(String extension) { this.extension = extension; }

    public String extension() { return extension; }

    /** "json" / "csv" / "excel" / "xlsx" (대소문자 무시) */
    public static ExportFormat parse(String s) {
        if (s == null) throw new ScrapeConfigException("export format must not be null");
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "json": return JSON;
            case "csv": return CSV;
            case "excel": case "xlsx": return EXCEL;
            default: throw new ScrapeConfigException("unknown export format: " + s);
        }
    }

    public static Set<ExportFormat> parseAll(Collection<String> names) {
        EnumSet<ExportFormat> out = EnumSet.noneOf(ExportFormat.class);
        if (names != null) {
            for (String n : names) {
                if (n != null && !n.isBlank()) out.add(parse(n));
            }
        }
        return out;
    }
}
