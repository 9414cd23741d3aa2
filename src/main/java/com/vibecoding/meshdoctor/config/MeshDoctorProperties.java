package com.vibecoding.meshdoctor.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 메시 진단 설정 (application.yml의 meshdoctor.*)
 */
@ConfigurationProperties(prefix = "meshdoctor")
@Data
public class MeshDoctorProperties {

    private static final Logger log = LoggerFactory.getLogger(MeshDoctorProperties.class);

    private String controlPlaneNamespace = "linkerd";
    private String kubeconfig;
    private String kubeContext;
    private String apiAddr;
    private String controllerService = "linkerd-controller-api";
    private String cliVersion = "dev-undefined";
    private String versionCheckUrl = "https://versioncheck.linkerd.io/version.json";
    private String minKubernetesVersion = "1.8.0";
    private String proxyContainerName = "linkerd-proxy";
    private long rpcTimeoutMs = 5000;

    private Metrics metrics = new Metrics();
    private Retry retry = new Retry();

    @Data
    public static class Metrics {
        private long timeoutMs = 30000;
        private boolean emitLogs = false;
        private String controlPlanePort = "admin-http";
        private String proxyPort = "linkerd-admin";
    }

    @Data
    public static class Retry {
        private long intervalMs = 5000;
        private long waitMs = 300000;
    }

    @PostConstruct
    public void init() {
        // KUBECONFIG는 설정 파일보다 시스템 프로퍼티(.env) 우선, 그 다음 환경변수
        if (kubeconfig == null || kubeconfig.isBlank()) {
            kubeconfig = System.getProperty("KUBECONFIG");
        }
        if (kubeconfig == null || kubeconfig.isBlank()) {
            kubeconfig = System.getenv("KUBECONFIG");
        }

        validateConfig();
    }

    public void validateConfig() {
        if (controlPlaneNamespace == null || controlPlaneNamespace.isBlank()) {
            throw new IllegalStateException("meshdoctor.control-plane-namespace must be set");
        }
        if (rpcTimeoutMs <= 0 || metrics.getTimeoutMs() <= 0) {
            throw new IllegalStateException("meshdoctor timeouts must be positive");
        }
        if (retry.getIntervalMs() <= 0) {
            throw new IllegalStateException("meshdoctor.retry.interval-ms must be positive");
        }

        log.info("Mesh doctor configuration validated successfully");
        log.info("  - Control plane namespace: {}", controlPlaneNamespace);
        log.info("  - Kubeconfig: {}", kubeconfig != null ? kubeconfig : "(auto)");
        log.info("  - API address: {}", apiAddr != null ? apiAddr : "(via Kubernetes API proxy)");
        log.info("  - Metrics timeout: {}ms", metrics.getTimeoutMs());
    }

    public Duration rpcTimeout() {
        return Duration.ofMillis(rpcTimeoutMs);
    }

    public Duration metricsTimeout() {
        return Duration.ofMillis(metrics.getTimeoutMs());
    }
}
