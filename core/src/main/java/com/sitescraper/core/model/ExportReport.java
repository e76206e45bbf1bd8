package com.sitescraper.core.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** 포맷별 내보내기 결과: 성공한 파일 경로 + 실패 사유 (서로 독립) */
public final class ExportReport {

    private final Map<ExportFormat, Path> written = new EnumMap<>(ExportFormat.class);
    private final Map<ExportFormat, String> failures = new EnumMap<>(ExportFormat.class);

    public void written(ExportFormat format, Path path) { written.put(format, path); }
    public void failed(ExportFormat format, String reason) { failures.put(format, reason == null ? "" : reason); }

    public Map<ExportFormat, Path> getWritten() { return Collections.unmodifiableMap(written); }
    public Map<ExportFormat, String> getFailures() { return Collections.unmodifiableMap(failures); }

    /** 작성된 파일 경로 (포맷 선언 순서) */
    public List<Path> writtenPaths() { return new ArrayList<>(written.values()); }

    public boolean hasFailures() { return !failures.isEmpty(); }
}
