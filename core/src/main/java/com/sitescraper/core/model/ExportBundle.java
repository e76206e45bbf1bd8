package com.sitescraper.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 실행 한 번의 누적 결과. key(정규화 URL) → 성공 레코드 또는 실패 표식.
 * 크롤러 제어 루프만 채우고, seal() 이후에는 읽기 전용.
 * 순서는 방문(완료) 순서를 유지한다.
 */
public final class ExportBundle {

    private final Map<String, PageOutcome> outcomes = new LinkedHashMap<>();
    private final Instant startedAt;
    private Instant finishedAt;
    private boolean cancelled;
    private boolean sealed;

    public ExportBundle() {
        this(Instant.now());
    }

    public ExportBundle(Instant startedAt) {
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    /** 같은 key 가 이미 있으면 false (덮어쓰지 않음) */
    public boolean add(PageOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        ensureOpen();
        return outcomes.putIfAbsent(outcome.key(), outcome) == null;
    }

    public void markCancelled() {
        ensureOpen();
        this.cancelled = true;
    }

    public ExportBundle seal(Instant finishedAt) {
        ensureOpen();
        this.finishedAt = finishedAt;
        this.sealed = true;
        return this;
    }

    private void ensureOpen() {
        if (sealed) throw new IllegalStateException("bundle is sealed");
    }

    public Map<String, PageOutcome> outcomes() { return Collections.unmodifiableMap(outcomes); }
    public List<PageOutcome> list() { return List.copyOf(outcomes.values()); }
    public PageOutcome get(String key) { return outcomes.get(key); }
    public int size() { return outcomes.size(); }
    public boolean isEmpty() { return outcomes.isEmpty(); }
    public boolean isCancelled() { return cancelled; }
    public boolean isSealed() { return sealed; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    public List<PageRecord> records() {
        List<PageRecord> out = new ArrayList<>();
        for (PageOutcome o : outcomes.values()) if (o.isSuccess()) out.add(o.record());
        return out;
    }

    public long successCount() {
        return outcomes.values().stream().filter(PageOutcome::isSuccess).count();
    }

    public long failureCount() {
        return outcomes.size() - successCount();
    }
}
