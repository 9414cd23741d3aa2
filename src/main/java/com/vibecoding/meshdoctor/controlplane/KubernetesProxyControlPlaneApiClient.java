package com.vibecoding.meshdoctor.controlplane;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.meshdoctor.exception.ControlPlaneApiException;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * Kubernetes API 서버의 서비스 프록시를 통해 컨트롤 플레인 API를 호출하는 클라이언트 (클러스터 외부 실행 시)
 *
 * <p>전달받은 클라이언트(RPC 타임아웃이 적용된 전용 클라이언트)를 소유하며 {@link #close()}에서 닫는다.
 */
public class KubernetesProxyControlPlaneApiClient implements ControlPlaneApiClient {

    private static final Logger log = LoggerFactory.getLogger(KubernetesProxyControlPlaneApiClient.class);

    private final KubernetesClient client;
    private final ObjectMapper objectMapper;
    private final String proxyBaseUrl;

    public KubernetesProxyControlPlaneApiClient(KubernetesClient client, ObjectMapper objectMapper,
                                                String namespace, String serviceName) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.proxyBaseUrl = proxyBaseUrl(client.getMasterUrl().toString(), namespace, serviceName);
    }

    /**
     * {master}/api/v1/namespaces/{ns}/services/{svc}:http/proxy
     */
    static String proxyBaseUrl(String masterUrl, String namespace, String serviceName) {
        String master = masterUrl.endsWith("/") ? masterUrl.substring(0, masterUrl.length() - 1) : masterUrl;
        return String.format("%s/api/v1/namespaces/%s/services/%s:http/proxy", master, namespace, serviceName);
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
        String url = proxyBaseUrl + path;
        try {
            String body = client.raw(url, "POST", Collections.emptyMap());
            if (body == null || body.isBlank()) {
                throw new ControlPlaneApiException("Empty response from " + url);
            }
            return objectMapper.readValue(body, responseType);
        } catch (KubernetesClientException e) {
            log.error("Control plane API call via Kubernetes proxy failed: {}", url, e);
            throw new ControlPlaneApiException("Failed to call " + url + ": " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ControlPlaneApiException("Unexpected response from " + url + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void close() {
        client.close();
    }

    public String getProxyBaseUrl() {
        return proxyBaseUrl;
    }
}
