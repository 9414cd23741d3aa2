package com.vibecoding.meshdoctor.service;

import com.vibecoding.meshdoctor.config.MeshDoctorProperties;
import com.vibecoding.meshdoctor.controlplane.ControlPlaneApiClientFactory;
import com.vibecoding.meshdoctor.healthcheck.CheckObserver;
import com.vibecoding.meshdoctor.healthcheck.CheckOptions;
import com.vibecoding.meshdoctor.healthcheck.HealthChecker;
import com.vibecoding.meshdoctor.healthcheck.MeshHealthChecks;
import com.vibecoding.meshdoctor.healthcheck.RetryingCheckRunner;
import com.vibecoding.meshdoctor.k8s.KubernetesApiService;
import com.vibecoding.meshdoctor.k8s.KubernetesClientFactory;
import com.vibecoding.meshdoctor.version.VersionService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * 헬스 체크 실행 서비스 - 옵션에 맞는 카테고리로 엔진을 구성하고 실행
 */
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final MeshDoctorProperties properties;
    private final KubernetesClientFactory clientFactory;
    private final KubernetesApiService kubernetesApi;
    private final ControlPlaneApiClientFactory apiClientFactory;
    private final VersionService versionService;

    /**
     * 설정 파일 기본값으로 채운 옵션
     */
    public CheckOptions.CheckOptionsBuilder defaultOptions() {
        return CheckOptions.builder()
            .controlPlaneNamespace(properties.getControlPlaneNamespace())
            .kubeconfig(properties.getKubeconfig())
            .kubeContext(properties.getKubeContext())
            .apiAddr(properties.getApiAddr());
    }

    /**
     * 체크를 실행하고 결과를 observer로 전달한다. shouldRetry이면 성공하거나 대기 시간이 끝날 때까지 재실행.
     *
     * @return 전체 성공 여부
     */
    public boolean runChecks(CheckOptions options, CheckObserver observer) {
        log.info("Running health checks (pre={}, proxy={}, wait={}) for namespace {}",
            options.isPreInstallOnly(), options.isDataPlaneOnly(), options.isShouldRetry(),
            options.getControlPlaneNamespace());

        try (MeshHealthChecks checks = newChecks(options)) {
            HealthChecker checker = checks.build();
            boolean success;
            if (options.isShouldRetry()) {
                RetryingCheckRunner runner = new RetryingCheckRunner(
                    Duration.ofMillis(properties.getRetry().getWaitMs()),
                    Duration.ofMillis(properties.getRetry().getIntervalMs()));
                success = runner.run(checker, observer);
            } else {
                success = checker.runChecks(observer);
            }

            log.info("Status check results are {}", success ? "[ok]" : "[FAIL]");
            return success;
        }
    }

    MeshHealthChecks newChecks(CheckOptions options) {
        return new MeshHealthChecks(options, properties, clientFactory, kubernetesApi, apiClientFactory, versionService);
    }
}
