package com.sitescraper.core.service.export;

import com.sitescraper.core.model.ExportBundle;
import com.sitescraper.core.model.ExportFormat;
import com.sitescraper.core.model.ExportReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 번들 → 요청된 포맷들. 포맷마다 독립적으로 시도하고,
 * 한 포맷이 실패해도 나머지는 계속 쓴다. 실패는 ExportReport 에 포맷별로 남긴다.
 */
public final class ExportCoordinator {

    private static final Logger LOG = Logger.getLogger(ExportCoordinator.class.getName());

    private final Map<ExportFormat, BundleExporter> exporters = new EnumMap<>(ExportFormat.class);

    public ExportCoordinator() {
        this(List.of(new JsonBundleExporter(), new CsvBundleExporter(), new ExcelBundleExporter()));
    }

    /** 테스트/확장용: 포맷별 exporter 교체 */
    public ExportCoordinator(List<? extends BundleExporter> exporters) {
        for (BundleExporter e : exporters) this.exporters.put(e.format(), e);
    }

    public ExportReport export(ExportBundle bundle, Set<ExportFormat> formats, Path dir, String nameBase) {
        return export(bundle, formats, dir, nameBase, Instant.now());
    }

    public ExportReport export(ExportBundle bundle, Set<ExportFormat> formats, Path dir,
                               String nameBase, Instant at) {
        Objects.requireNonNull(bundle, "bundle");
        Objects.requireNonNull(formats, "formats");
        Objects.requireNonNull(dir, "dir");

        ExportReport report = new ExportReport();
        List<BundleRow> rows = new ArrayList<>(bundle.size());
        bundle.outcomes().values().forEach(o -> rows.add(BundleRow.of(o)));

        LOG.info(() -> "[Export plan] formats=" + formats + ", rows=" + rows.size() + ", dir=" + dir);

        for (ExportFormat format : ExportFormat.values()) {
            if (!formats.contains(format)) continue;
            Path target = ExportNaming.path(dir, nameBase, at, format);
            try {
                writeOne(format, List.copyOf(rows), target);
                report.written(format, target);
                LOG.info(() -> "[Export] " + format + " -> " + target.toAbsolutePath());
            } catch (ExportException e) {
                report.failed(format, e.getMessage());
                LOG.log(Level.WARNING, "[Export] " + format + " failed; continuing with other formats", e);
            }
        }
        return report;
    }

    private void writeOne(ExportFormat format, List<BundleRow> rows, Path target) throws ExportException {
        BundleExporter exporter = exporters.get(format);
        if (exporter == null) {
            throw new ExportException(format, "no exporter registered", null);
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            exporter.write(rows, target);
        } catch (IOException | RuntimeException e) {
            throw new ExportException(format, String.valueOf(e.getMessage()), e);
        }
    }
}
