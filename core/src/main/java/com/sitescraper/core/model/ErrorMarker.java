package com.sitescraper.core.model;

import java.util.Objects;

/** 번들에 남는 URL 단위 최종 실패 표식 */
public record ErrorMarker(FailureKind kind, int httpStatus, String message) {

    public ErrorMarker {
        Objects.requireNonNull(kind, "kind");
        message = (message == null) ? "" : message;
    }

    public static ErrorMarker of(FetchResult.Failure f) {
        return new ErrorMarker(f.kind(), f.status(), f.message());
    }

    /** 사용자 표시용: "HTTP_STATUS(404)" / "TIMEOUT" */
    public String label() {
        return (kind == FailureKind.HTTP_STATUS && httpStatus > 0) ? kind + "(" + httpStatus + ")" : kind.name();
    }
}
