package com.sitescraper.core.util;

import com.sitescraper.core.model.PageOutcome;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0 (모르면 0.0)
     * @param phase    "crawl" | "batch" | "single" | "export"
     * @param done     처리 수(모르면 -1)
     * @param total    전체 수(모르면 -1)
     */
    void onProgress(double progress, String phase, long done, long total);

    /** URL 하나의 최종 결과(성공/실패). 기본은 무시. */
    default void onOutcome(PageOutcome outcome) {}

    ProgressListener NONE = (p, phase, d, t) -> {};
}
