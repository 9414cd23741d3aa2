package com.vibecoding.meshdoctor.k8s;

import com.vibecoding.meshdoctor.exception.K8sApiException;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("KubernetesClientFactory")
class KubernetesClientFactoryTest {

    private static final String KUBECONFIG = String.join("\n",
        "apiVersion: v1",
        "kind: Config",
        "clusters:",
        "- name: dev",
        "  cluster:",
        "    server: https://10.0.0.1:6443",
        "contexts:",
        "- name: dev",
        "  context:",
        "    cluster: dev",
        "    user: dev",
        "current-context: dev",
        "users:",
        "- name: dev",
        "  user:",
        "    token: abc",
        "");

    private final KubernetesClientFactory factory = new KubernetesClientFactory();

    @Test
    @DisplayName("should build a client from a kubeconfig file with default timeouts")
    void shouldCreateFromKubeconfig(@TempDir Path dir) throws Exception {
        Path kubeconfig = Files.writeString(dir.resolve("config"), KUBECONFIG);

        try (KubernetesClient client = factory.create(kubeconfig.toString(), null)) {
            assertThat(client.getMasterUrl().toString()).startsWith("https://10.0.0.1:6443");
            assertThat(client.getConfiguration().getRequestTimeout()).isEqualTo(30000);
            assertThat(client.getConfiguration().getConnectionTimeout()).isEqualTo(10000);
        }
    }

    @Test
    @DisplayName("should report an unreadable kubeconfig")
    void shouldRejectMissingKubeconfig(@TempDir Path dir) {
        String missing = dir.resolve("missing").toString();

        assertThatThrownBy(() -> factory.create(missing, null))
            .isInstanceOf(K8sApiException.class)
            .hasMessageContaining(missing);
    }

    @Test
    @DisplayName("should derive a client for the same cluster with the given request timeout")
    void shouldApplyRequestTimeout() {
        try (KubernetesClient base = new KubernetesClientBuilder()
                .withConfig(new ConfigBuilder()
                    .withMasterUrl("https://10.0.0.1:6443/")
                    .withRequestTimeout(30000)
                    .build())
                .build();
             KubernetesClient rpc = factory.withRequestTimeout(base, Duration.ofSeconds(5))) {

            assertThat(rpc).isNotSameAs(base);
            assertThat(rpc.getConfiguration().getRequestTimeout()).isEqualTo(5000);
            assertThat(rpc.getMasterUrl()).isEqualTo(base.getMasterUrl());
            assertThat(base.getConfiguration().getRequestTimeout()).isEqualTo(30000);
        }
    }
}
