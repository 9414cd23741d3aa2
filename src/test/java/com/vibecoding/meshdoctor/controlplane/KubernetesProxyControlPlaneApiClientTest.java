package com.vibecoding.meshdoctor.controlplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.meshdoctor.exception.ControlPlaneApiException;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URL;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("KubernetesProxyControlPlaneApiClient")
class KubernetesProxyControlPlaneApiClientTest {

    private static final String BASE =
        "https://10.0.0.1:6443/api/v1/namespaces/linkerd/services/linkerd-controller-api:http/proxy";

    private KubernetesClient kubernetesClient;
    private KubernetesProxyControlPlaneApiClient client;

    @BeforeEach
    void setUp() throws Exception {
        kubernetesClient = mock(KubernetesClient.class);
        when(kubernetesClient.getMasterUrl()).thenReturn(new URL("https://10.0.0.1:6443/"));
        client = new KubernetesProxyControlPlaneApiClient(
            kubernetesClient, new ObjectMapper(), "linkerd", "linkerd-controller-api");
    }

    @Test
    @DisplayName("should build the service proxy URL without a double slash")
    void shouldBuildProxyUrl() {
        assertThat(client.getProxyBaseUrl()).isEqualTo(BASE);
        assertThat(KubernetesProxyControlPlaneApiClient.proxyBaseUrl("https://k8s", "ns", "svc"))
            .isEqualTo("https://k8s/api/v1/namespaces/ns/services/svc:http/proxy");
    }

    @Test
    @DisplayName("should post through the API server proxy and decode the response")
    void shouldDecodeVersion() {
        when(kubernetesClient.raw(eq(BASE + "/api/v1/Version"), eq("POST"), any()))
            .thenReturn("{\"releaseVersion\":\"edge-18.7.1\"}");

        assertThat(client.version().getReleaseVersion()).isEqualTo("edge-18.7.1");
    }

    @Test
    @DisplayName("should wrap proxy errors and malformed bodies")
    void shouldWrapErrors() {
        when(kubernetesClient.raw(eq(BASE + "/api/v1/SelfCheck"), eq("POST"), any()))
            .thenThrow(new KubernetesClientException("service unavailable"));
        when(kubernetesClient.raw(eq(BASE + "/api/v1/Version"), anyString(), any()))
            .thenReturn("not json");

        assertThatThrownBy(() -> client.selfCheck())
            .isInstanceOf(ControlPlaneApiException.class)
            .hasMessageContaining("service unavailable");
        assertThatThrownBy(() -> client.version())
            .isInstanceOf(ControlPlaneApiException.class)
            .hasMessageStartingWith("Unexpected response");
    }
}
