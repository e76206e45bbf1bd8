package com.sitescraper.core.crawler.robots;

import java.net.URI;

/** robots.txt 를 받아온다. 리다이렉트는 호출자(RobotsRepository)가 처리한다. */
@FunctionalInterface
public interface RobotsFetcher {

    /**
     * @param status   HTTP 상태 (0 이면 네트워크 오류)
     * @param body     본문 (없으면 "")
     * @param location 3xx 일 때 Location 을 해석한 URI, 그 외 null
     */
    record Response(int status, String body, URI location) {
        public Response {
            body = (body == null) ? "" : body;
        }
        public static Response ok(int status, String body) { return new Response(status, body, null); }
        public static Response redirect(int status, URI location) { return new Response(status, "", location); }
        public static Response networkError() { return new Response(0, "", null); }
    }

    Response fetch(URI robotsTxtUri);
}
