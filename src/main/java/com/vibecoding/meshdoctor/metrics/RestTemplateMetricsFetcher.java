package com.vibecoding.meshdoctor.metrics;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;

/**
 * RestTemplate 기반 메트릭 조회
 */
@Component
public class RestTemplateMetricsFetcher implements MetricsFetcher {

    private final RestTemplate restTemplate;

    public RestTemplateMetricsFetcher(@Qualifier("metricsRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * 2xx가 아닌 응답과 전송 오류는 IOException으로 보고한다.
     */
    @Override
    public byte[] fetch(String url) throws IOException {
        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.getForEntity(url, byte[].class);
        } catch (RestClientResponseException e) {
            throw new IOException("Unexpected status " + e.getStatusCode().value() + " from " + url, e);
        } catch (RestClientException e) {
            throw new IOException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new IOException("Unexpected status " + response.getStatusCode().value() + " from " + url);
        }
        return response.getBody() != null ? response.getBody() : new byte[0];
    }
}
