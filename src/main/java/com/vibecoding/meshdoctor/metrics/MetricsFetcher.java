package com.vibecoding.meshdoctor.metrics;

/**
 * URL에 GET 요청을 보내 응답 본문 전체를 읽는다. 2xx가 아니면 예외.
 */
@FunctionalInterface
public interface MetricsFetcher {
    byte[] fetch(String url) throws Exception;
}
