package com.sitescraper.core.service.export;

import com.sitescraper.core.model.ExportFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** 행 목록을 한 포맷으로 직렬화. 입력은 읽기만 한다 */
public interface BundleExporter {

    ExportFormat format();

    /**
     * @param rows   번들 순서 그대로의 행
     * @param target 쓸 파일 (상위 디렉터리는 이미 존재)
     */
    void write(List<BundleRow> rows, Path target) throws IOException;
}
