package com.vibecoding.meshdoctor.controlplane;

import com.vibecoding.meshdoctor.exception.ControlPlaneApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;

/**
 * 컨트롤 플레인 API 주소로 직접 접속하는 클라이언트 (클러스터 내부 실행 시)
 */
public class HttpControlPlaneApiClient implements ControlPlaneApiClient {

    private static final Logger log = LoggerFactory.getLogger(HttpControlPlaneApiClient.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpControlPlaneApiClient(RestTemplate restTemplate, String apiAddr) {
        this.restTemplate = restTemplate;
        this.baseUrl = apiAddr.startsWith("http://") || apiAddr.startsWith("https://")
            ? apiAddr
            : "http://" + apiAddr;
    }

    @Override
    public SelfCheckResponse selfCheck() {
        SelfCheckResponse response = post(SELF_CHECK_PATH, SelfCheckResponse.class);
        if (response.getResults() == null) {
            response.setResults(Collections.emptyList());
        }
        return response;
    }

    @Override
    public ControlPlaneVersion version() {
        return post(VERSION_PATH, ControlPlaneVersion.class);
    }

    private <T> T post(String path, Class<T> responseType) {
        String url = baseUrl + path;
        try {
            T response = restTemplate.postForObject(url, Collections.emptyMap(), responseType);
            if (response == null) {
                throw new ControlPlaneApiException("Empty response from " + url);
            }
            return response;
        } catch (RestClientException e) {
            log.error("Control plane API call failed: {}", url, e);
            throw new ControlPlaneApiException("Failed to call " + url + ": " + e.getMessage(), e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
