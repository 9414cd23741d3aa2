package com.vibecoding.meshdoctor.healthcheck;

import com.vibecoding.meshdoctor.config.MeshDoctorProperties;
import com.vibecoding.meshdoctor.controlplane.ControlPlaneApiClient;
import com.vibecoding.meshdoctor.controlplane.ControlPlaneApiClientFactory;
import com.vibecoding.meshdoctor.exception.CheckRetryException;
import com.vibecoding.meshdoctor.exception.HealthCheckException;
import com.vibecoding.meshdoctor.k8s.KubernetesApiService;
import com.vibecoding.meshdoctor.k8s.KubernetesClientFactory;
import com.vibecoding.meshdoctor.version.VersionService;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.VersionInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * 표준 체크 카테고리 묶음. 한 번의 실행(및 재실행) 동안 앞선 체크가 만든 클라이언트와 버전 정보를 공유한다.
 *
 * <p>카테고리 사이에 의존 관계가 있으므로 {@link #build()}가 정한 순서대로 등록해야 한다.
 */
public class MeshHealthChecks implements AutoCloseable {

    private final CheckOptions options;
    private final MeshDoctorProperties properties;
    private final KubernetesClientFactory clientFactory;
    private final KubernetesApiService kubernetesApi;
    private final ControlPlaneApiClientFactory apiClientFactory;
    private final VersionService versionService;

    private KubernetesClient kubernetesClient;
    private VersionInfo kubernetesVersion;
    private ControlPlaneApiClient apiClient;
    private String latestVersion;

    public MeshHealthChecks(CheckOptions options,
                            MeshDoctorProperties properties,
                            KubernetesClientFactory clientFactory,
                            KubernetesApiService kubernetesApi,
                            ControlPlaneApiClientFactory apiClientFactory,
                            VersionService versionService) {
        this.options = options;
        this.properties = properties;
        this.clientFactory = clientFactory;
        this.kubernetesApi = kubernetesApi;
        this.apiClientFactory = apiClientFactory;
        this.versionService = versionService;
    }

    /**
     * 옵션에 따라 카테고리를 선택해 엔진을 구성한다.
     * Kubernetes API 체크는 항상, 그 다음 데이터 플레인 / 설치 전 / 컨트롤 플레인 API 중 하나, 마지막으로 버전 체크.
     */
    public HealthChecker build() {
        HealthChecker checker = new HealthChecker();
        checker.addAll(kubernetesApiChecks());

        if (options.isDataPlaneOnly()) {
            checker.addAll(dataPlaneChecks());
        } else if (options.isPreInstallOnly()) {
            checker.addAll(preInstallChecks());
        } else {
            checker.addAll(controlPlaneApiChecks());
        }

        checker.addAll(versionChecks());
        return checker;
    }

    /**
     * 클러스터에 접속 가능하고 최소 Kubernetes 버전을 만족하는지 확인
     */
    public List<Check> kubernetesApiChecks() {
        List<Check> checks = new ArrayList<>();

        checks.add(Check.local(CheckCategory.KUBERNETES_API, "can initialize the client", true, () -> {
            closeClient();
            kubernetesClient = clientFactory.create(options.getKubeconfig(), options.getKubeContext());
        }));

        checks.add(Check.local(CheckCategory.KUBERNETES_API, "can query the Kubernetes API", true, () ->
            kubernetesVersion = kubernetesApi.getVersionInfo(kubernetesClient)));

        if (options.isShouldCheckKubeVersion()) {
            checks.add(Check.local(CheckCategory.KUBERNETES_API, "is running the minimum Kubernetes API version", false, () ->
                kubernetesApi.checkVersion(kubernetesVersion, properties.getMinKubernetesVersion())));
        }

        return checks;
    }

    /**
     * 컨트롤 플레인을 설치할 수 있는 상태인지 확인
     */
    public List<Check> preInstallChecks() {
        return List.of(
            Check.local(CheckCategory.PRE_INSTALL, "control plane namespace does not already exist", false, () ->
                kubernetesApi.checkNamespaceDoesNotExist(kubernetesClient, options.getControlPlaneNamespace()))
        );
    }

    /**
     * 컨트롤 플레인 네임스페이스가 있고 공개 API가 응답하는지 확인. Kubernetes API 체크가 먼저 등록되어야 한다.
     */
    public List<Check> controlPlaneApiChecks() {
        List<Check> checks = new ArrayList<>();

        checks.add(Check.local(CheckCategory.CONTROL_PLANE_API, "control plane namespace exists", true, () ->
            kubernetesApi.checkNamespaceExists(kubernetesClient, options.getControlPlaneNamespace())));

        checks.add(Check.local(CheckCategory.CONTROL_PLANE_API, "can initialize the client", true, () -> {
            closeApiClient();
            apiClient = apiClientFactory.create(
                options.getApiAddr(),
                options.getControlPlaneNamespace(),
                properties.getControllerService(),
                kubernetesClient);
        }));

        checks.add(Check.remote(CheckCategory.CONTROL_PLANE_API, "can query the control plane API", true, () ->
            apiClient.selfCheck()));

        return checks;
    }

    /**
     * 대상 네임스페이스의 메시 프록시가 모두 준비되었는지 확인
     */
    public List<Check> dataPlaneChecks() {
        String namespace = dataPlaneNamespace();
        List<Check> checks = new ArrayList<>();

        checks.add(Check.local(CheckCategory.DATA_PLANE, "data plane namespace exists", true, () ->
            kubernetesApi.checkNamespaceExists(kubernetesClient, namespace)));

        checks.add(Check.local(CheckCategory.DATA_PLANE, "data plane proxies are ready", false, () ->
            checkDataPlaneProxiesReady(namespace)));

        return checks;
    }

    /**
     * CLI와 컨트롤 플레인이 최신 버전인지 확인. 최신 버전 조회만 fatal이고 나머지는 경고로 보고한다.
     */
    public List<Check> versionChecks() {
        List<Check> checks = new ArrayList<>();

        checks.add(Check.local(CheckCategory.MESH_VERSION, "can get the latest version", true, () -> {
            if (options.getVersionOverride() != null && !options.getVersionOverride().isBlank()) {
                latestVersion = options.getVersionOverride();
            } else {
                latestVersion = versionService.getLatestVersion();
            }
        }));

        checks.add(Check.warning(CheckCategory.MESH_VERSION, "cli is up-to-date", () ->
            versionService.checkClientVersion(latestVersion)));

        if (options.isShouldCheckControlPlaneVersion() && !options.isPreInstallOnly() && !options.isDataPlaneOnly()) {
            checks.add(Check.warning(CheckCategory.MESH_VERSION, "control plane is up-to-date", () ->
                versionService.checkServerVersion(apiClient, latestVersion)));
        }

        return checks;
    }

    private void checkDataPlaneProxiesReady(String namespace) {
        String proxyContainer = properties.getProxyContainerName();
        List<Pod> pods = kubernetesApi.filterPodsWithContainer(
            kubernetesApi.listPods(kubernetesClient, namespace, null), proxyContainer);

        if (pods.isEmpty()) {
            notReady(String.format("No \"%s\" containers found in the \"%s\" namespace", proxyContainer, namespace));
        }

        for (Pod pod : pods) {
            if (!kubernetesApi.isContainerReady(pod, proxyContainer)) {
                notReady(String.format("The \"%s\" pod's \"%s\" container is not ready",
                    pod.getMetadata().getName(), proxyContainer));
            }
        }
    }

    private void notReady(String message) {
        if (options.isShouldRetry()) {
            throw new CheckRetryException(message);
        }
        throw new HealthCheckException(message);
    }

    private String dataPlaneNamespace() {
        String namespace = options.getDataPlaneNamespace();
        return namespace != null && !namespace.isBlank() ? namespace : options.getControlPlaneNamespace();
    }

    public KubernetesClient getKubernetesClient() {
        return kubernetesClient;
    }

    /**
     * 체크 실행 후 구성된 컨트롤 플레인 클라이언트 (컨트롤 플레인 API 체크를 실행한 경우에만 설정됨)
     */
    public ControlPlaneApiClient getApiClient() {
        return apiClient;
    }

    private void closeApiClient() {
        if (apiClient != null) {
            apiClient.close();
            apiClient = null;
        }
    }

    private void closeClient() {
        if (kubernetesClient != null) {
            kubernetesClient.close();
            kubernetesClient = null;
        }
    }

    @Override
    public void close() {
        closeApiClient();
        closeClient();
    }
}
