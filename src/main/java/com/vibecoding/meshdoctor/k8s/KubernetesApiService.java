package com.vibecoding.meshdoctor.k8s;

import com.vibecoding.meshdoctor.exception.K8sApiException;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 헬스 체크와 메트릭 수집에 필요한 Kubernetes 리소스 조회 서비스
 */
@Service
public class KubernetesApiService {

    private static final Logger log = LoggerFactory.getLogger(KubernetesApiService.class);

    // ========== Version ==========

    public VersionInfo getVersionInfo(KubernetesClient client) {
        try {
            VersionInfo version = client.getKubernetesVersion();
            if (version == null) {
                throw new K8sApiException("Kubernetes API returned no version information");
            }
            return version;
        } catch (KubernetesClientException e) {
            log.error("Failed to query Kubernetes API version: {}", client.getMasterUrl(), e);
            throw new K8sApiException("Failed to query the Kubernetes API: " + e.getMessage(), e);
        }
    }

    /**
     * 서버 버전이 최소 요구 버전 이상인지 확인
     */
    public void checkVersion(VersionInfo versionInfo, String minimumVersion) {
        if (versionInfo == null) {
            throw new K8sApiException("Kubernetes version is unknown");
        }

        KubernetesVersion minimum = KubernetesVersion.parse(minimumVersion);
        KubernetesVersion actual = versionInfo.getGitVersion() != null && !versionInfo.getGitVersion().isBlank()
            ? KubernetesVersion.parse(versionInfo.getGitVersion())
            : KubernetesVersion.of(versionInfo.getMajor(), versionInfo.getMinor());

        if (!actual.isAtLeast(minimum)) {
            throw new K8sApiException(String.format(
                "Kubernetes is on version [%s], but version [%s] or more recent is required",
                actual, minimum));
        }
    }

    // ========== Namespace ==========

    public Optional<Namespace> findNamespace(KubernetesClient client, String name) {
        try {
            return Optional.ofNullable(client.namespaces().withName(name).get());
        } catch (KubernetesClientException e) {
            log.error("Failed to get namespace: {}", name, e);
            throw new K8sApiException("Failed to get namespace " + name + ": " + e.getMessage(), e);
        }
    }

    public void checkNamespaceExists(KubernetesClient client, String name) {
        if (findNamespace(client, name).isEmpty()) {
            throw new K8sApiException(String.format("The \"%s\" namespace does not exist", name));
        }
    }

    public void checkNamespaceDoesNotExist(KubernetesClient client, String name) {
        if (findNamespace(client, name).isPresent()) {
            throw new K8sApiException(String.format("The \"%s\" namespace already exists", name));
        }
    }

    // ========== Pod ==========

    /**
     * 네임스페이스의 Pod 목록을 이름순으로 조회
     *
     * @param labels 레이블 셀렉터 (null 또는 비어 있으면 전체)
     */
    public List<Pod> listPods(KubernetesClient client, String namespace, Map<String, String> labels) {
        try {
            List<Pod> pods = (labels == null || labels.isEmpty())
                ? client.pods().inNamespace(namespace).list().getItems()
                : client.pods().inNamespace(namespace).withLabels(labels).list().getItems();

            return pods.stream()
                .sorted(Comparator.comparing(p -> p.getMetadata().getName()))
                .collect(Collectors.toList());
        } catch (KubernetesClientException e) {
            log.error("Failed to list pods in namespace: {}", namespace, e);
            throw new K8sApiException("Failed to list pods in namespace " + namespace + ": " + e.getMessage(), e);
        }
    }

    /**
     * containerName 컨테이너가 있는 Pod만 필터링 (메시에 주입된 프록시 탐색용)
     */
    public List<Pod> filterPodsWithContainer(List<Pod> pods, String containerName) {
        return pods.stream()
            .filter(pod -> pod.getSpec() != null && pod.getSpec().getContainers() != null)
            .filter(pod -> pod.getSpec().getContainers().stream()
                .anyMatch(c -> containerName.equals(c.getName())))
            .collect(Collectors.toList());
    }

    /**
     * Pod이 Running이고 containerName 컨테이너가 ready 상태인지 확인
     */
    public boolean isContainerReady(Pod pod, String containerName) {
        if (pod.getStatus() == null || !"Running".equals(pod.getStatus().getPhase())) {
            return false;
        }
        List<ContainerStatus> statuses = pod.getStatus().getContainerStatuses();
        if (statuses == null) {
            return false;
        }
        return statuses.stream()
            .filter(s -> containerName.equals(s.getName()))
            .anyMatch(s -> Boolean.TRUE.equals(s.getReady()));
    }
}
