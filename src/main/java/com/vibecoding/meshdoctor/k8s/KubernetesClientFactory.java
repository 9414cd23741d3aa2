package com.vibecoding.meshdoctor.k8s;

import com.vibecoding.meshdoctor.exception.K8sApiException;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * kubeconfig 기반 Kubernetes 클라이언트 생성
 */
@Component
public class KubernetesClientFactory {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientFactory.class);

    private static final int REQUEST_TIMEOUT_MS = 30000;
    private static final int CONNECTION_TIMEOUT_MS = 10000;

    /**
     * kubeconfigPath가 비어 있으면 기본 로딩 규칙(KUBECONFIG, ~/.kube/config, in-cluster)을 따른다.
     *
     * @param kubeconfigPath kubeconfig 파일 경로 (선택)
     * @param context        사용할 kubeconfig 컨텍스트 (선택, 없으면 current-context)
     */
    public KubernetesClient create(String kubeconfigPath, String context) {
        Config config = loadConfig(kubeconfigPath, context);
        config.setRequestTimeout(REQUEST_TIMEOUT_MS);
        config.setConnectionTimeout(CONNECTION_TIMEOUT_MS);
        return build(config);
    }

    private KubernetesClient build(Config config) {
        try {
            KubernetesClient client = new KubernetesClientBuilder()
                .withConfig(config)
                .build();
            log.debug("Created Kubernetes client for {}", config.getMasterUrl());
            return client;
        } catch (Exception e) {
            log.error("Failed to create Kubernetes client", e);
            throw new K8sApiException("Invalid Kubernetes configuration: " + e.getMessage(), e);
        }
    }

    /**
     * 같은 클러스터 설정에 요청 타임아웃만 바꾼 새 클라이언트. 호출자가 닫아야 한다.
     */
    public KubernetesClient withRequestTimeout(KubernetesClient base, Duration requestTimeout) {
        Config config = new ConfigBuilder(base.getConfiguration())
            .withRequestTimeout((int) requestTimeout.toMillis())
            .build();
        return build(config);
    }

    private Config loadConfig(String kubeconfigPath, String context) {
        if (kubeconfigPath == null || kubeconfigPath.isBlank()) {
            return Config.autoConfigure(blankToNull(context));
        }

        try {
            String content = Files.readString(Path.of(kubeconfigPath));
            return Config.fromKubeconfig(blankToNull(context), content, kubeconfigPath);
        } catch (IOException e) {
            throw new K8sApiException("Failed to read kubeconfig: " + kubeconfigPath, e);
        } catch (RuntimeException e) {
            throw new K8sApiException("Invalid kubeconfig " + kubeconfigPath + ": " + e.getMessage(), e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
