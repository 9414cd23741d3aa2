package com.vibecoding.meshdoctor.metrics;

import com.vibecoding.meshdoctor.exception.K8sApiException;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerPort;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.LocalPortForward;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Kubernetes port-forward로 컨테이너 포트에 터널을 연다.
 */
@Component
public class PortForwardTunnelProvider implements TunnelProvider {

    private static final Logger log = LoggerFactory.getLogger(PortForwardTunnelProvider.class);

    private final KubernetesClient client;

    public PortForwardTunnelProvider(@Lazy KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Tunnel open(Pod pod, Container container, String portName, boolean emitLogs) {
        String namespace = pod.getMetadata().getNamespace();
        String podName = pod.getMetadata().getName();
        int containerPort = resolvePort(container, portName);

        LocalPortForward portForward;
        try {
            portForward = client.pods()
                .inNamespace(namespace)
                .withName(podName)
                .portForward(containerPort);
        } catch (KubernetesClientException e) {
            throw new K8sApiException(String.format("Failed to port-forward to %s/%s:%d",
                namespace, podName, containerPort), e);
        }

        PortForwardTunnel tunnel = new PortForwardTunnel(portForward, podName + "/" + container.getName(), emitLogs);
        if (portForward.errorOccurred()) {
            tunnel.close();
            throw new K8sApiException(String.format("Error running port-forward to %s/%s:%d: %s",
                namespace, podName, containerPort, portForward.getClientThrowables()));
        }

        if (emitLogs) {
            log.info("Forwarding localhost:{} -> {}/{}:{} ({})",
                portForward.getLocalPort(), podName, container.getName(), containerPort, portName);
        }
        return tunnel;
    }

    static int resolvePort(Container container, String portName) {
        if (container.getPorts() != null) {
            for (ContainerPort port : container.getPorts()) {
                if (portName.equals(port.getName()) && port.getContainerPort() != null) {
                    return port.getContainerPort();
                }
            }
        }
        throw new IllegalArgumentException(String.format(
            "Container %s does not expose a port named %s", container.getName(), portName));
    }
}
