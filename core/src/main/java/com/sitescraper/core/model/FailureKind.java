package com.sitescraper.core.model;

/** URL 단위 실패 분류. 모두 값으로 기록되며 예외로 던지지 않는다. */
public enum FailureKind {
    /** 연결/DNS/IO 실패 */
    NETWORK_ERROR,
    /** 요청 타임아웃 */
    TIMEOUT,
    /** 비정상 HTTP 상태 코드 */
    HTTP_STATUS,
    /** robots.txt 가 경로를 막음 (네트워크 호출 없음) */
    DISALLOWED_BY_ROBOTS,
    /** 호스트 간격 대기가 상한을 넘음 */
    POLITENESS_TIMEOUT,
    /** 실행 취소 */
    CANCELLED
}
