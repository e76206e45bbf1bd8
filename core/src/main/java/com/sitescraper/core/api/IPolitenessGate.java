package com.sitescraper.core.api;

import java.net.URI;
import java.time.Duration;

/** fetch 직전마다 확인하는 관문: robots 허용 여부 + 호스트 간격 */
@FunctionalInterface
public interface IPolitenessGate {

    enum Verdict { ADMITTED, DISALLOWED, TIMED_OUT }

    /** maxWait 안에 통과 못 하면 TIMED_OUT. 대기 중 인터럽트되면 InterruptedException */
    Verdict admit(URI url, Duration maxWait) throws InterruptedException;

    IPolitenessGate OPEN = (url, maxWait) -> Verdict.ADMITTED;
}
