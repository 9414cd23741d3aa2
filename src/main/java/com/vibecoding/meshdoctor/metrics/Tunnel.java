package com.vibecoding.meshdoctor.metrics;

/**
 * 컨테이너 포트로 연결된 로컬 터널. close()는 여러 번 호출해도 안전해야 한다.
 */
public interface Tunnel extends AutoCloseable {

    /**
     * 터널을 통해 접근할 URL (예: http://localhost:40123/metrics)
     */
    String urlFor(String path);

    @Override
    void close();
}
