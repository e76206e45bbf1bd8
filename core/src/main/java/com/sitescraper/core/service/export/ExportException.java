package com.sitescraper.core.service.export;

import com.sitescraper.core.model.ExportFormat;

import java.io.IOException;

/** 한 포맷의 쓰기 실패. 다른 포맷에는 영향 없음 */
public class ExportException extends IOException {
    private static final long serialVersionUID = 1L;

    private final ExportFormat format;

    public ExportException(ExportFormat format, String message, Throwable cause) {
        super(format + " export failed: " + message, cause);
        this.format = format;
    }

    public ExportFormat getFormat() { return format; }
}
