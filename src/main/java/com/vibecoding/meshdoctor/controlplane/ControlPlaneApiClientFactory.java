package com.vibecoding.meshdoctor.controlplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.meshdoctor.config.MeshDoctorProperties;
import com.vibecoding.meshdoctor.k8s.KubernetesClientFactory;
import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * 컨트롤 플레인 API 클라이언트 생성
 */
@Component
@RequiredArgsConstructor
public class ControlPlaneApiClientFactory {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneApiClientFactory.class);

    @Qualifier("controlPlaneRestTemplate")
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final KubernetesClientFactory clientFactory;
    private final MeshDoctorProperties properties;

    /**
     * apiAddr이 있으면 직접 접속, 없으면 Kubernetes API 프록시 경유.
     * 두 경로 모두 meshdoctor.rpc-timeout-ms를 요청 타임아웃으로 사용한다.
     */
    public ControlPlaneApiClient create(String apiAddr, String namespace, String serviceName,
                                        KubernetesClient kubernetesClient) {
        if (apiAddr != null && !apiAddr.isBlank()) {
            log.debug("Using direct control plane API client: {}", apiAddr);
            return new HttpControlPlaneApiClient(restTemplate, apiAddr);
        }
        if (kubernetesClient == null) {
            throw new IllegalStateException("Kubernetes client is required when no API address is configured");
        }
        log.debug("Using Kubernetes proxy control plane API client: {}/{} (timeout {}ms)",
            namespace, serviceName, properties.getRpcTimeoutMs());
        KubernetesClient rpcClient = clientFactory.withRequestTimeout(kubernetesClient, properties.rpcTimeout());
        return new KubernetesProxyControlPlaneApiClient(rpcClient, objectMapper, namespace, serviceName);
    }
}
