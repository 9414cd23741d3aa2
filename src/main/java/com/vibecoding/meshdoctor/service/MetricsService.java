package com.vibecoding.meshdoctor.service;

import com.vibecoding.meshdoctor.config.MeshDoctorProperties;
import com.vibecoding.meshdoctor.k8s.KubernetesApiService;
import com.vibecoding.meshdoctor.metrics.MetricsCollector;
import com.vibecoding.meshdoctor.metrics.MetricsResult;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 메트릭 수집 서비스 - 대상 Pod을 찾아 MetricsCollector로 스크레이핑
 */
@Service
public class MetricsService {

    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

    private final KubernetesClient client;
    private final KubernetesApiService kubernetesApi;
    private final MetricsCollector collector;
    private final MeshDoctorProperties properties;

    public MetricsService(@Lazy KubernetesClient client,
                          KubernetesApiService kubernetesApi,
                          MetricsCollector collector,
                          MeshDoctorProperties properties) {
        this.client = client;
        this.kubernetesApi = kubernetesApi;
        this.collector = collector;
        this.properties = properties;
    }

    /**
     * 컨트롤 플레인 컴포넌트의 관리 포트 메트릭
     */
    public List<MetricsResult> controlPlaneMetrics(Duration timeout) {
        String namespace = properties.getControlPlaneNamespace();
        log.info("Collecting control plane metrics in namespace {}", namespace);

        List<Pod> pods = kubernetesApi.listPods(client, namespace, null);
        return collector.collect(pods, properties.getMetrics().getControlPlanePort(),
            orDefault(timeout), properties.getMetrics().isEmitLogs());
    }

    /**
     * 네임스페이스의 메시 프록시 메트릭
     *
     * @param labels Pod 레이블 셀렉터 (선택)
     */
    public List<MetricsResult> proxyMetrics(String namespace, Map<String, String> labels, Duration timeout) {
        log.info("Collecting proxy metrics in namespace {} (labels={})", namespace, labels);

        List<Pod> pods = kubernetesApi.listPods(client, namespace, labels);
        return collector.collect(pods, properties.getMetrics().getProxyPort(),
            orDefault(timeout), properties.getMetrics().isEmitLogs());
    }

    private Duration orDefault(Duration timeout) {
        return timeout != null ? timeout : properties.metricsTimeout();
    }
}
