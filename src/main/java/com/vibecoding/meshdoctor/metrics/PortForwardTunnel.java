package com.vibecoding.meshdoctor.metrics;

import io.fabric8.kubernetes.client.LocalPortForward;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * LocalPortForward 래퍼
 */
class PortForwardTunnel implements Tunnel {

    private static final Logger log = LoggerFactory.getLogger(PortForwardTunnel.class);

    private final LocalPortForward portForward;
    private final String target;
    private final boolean emitLogs;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    PortForwardTunnel(LocalPortForward portForward, String target, boolean emitLogs) {
        this.portForward = portForward;
        this.target = target;
        this.emitLogs = emitLogs;
    }

    @Override
    public String urlFor(String path) {
        return "http://localhost:" + portForward.getLocalPort() + path;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            portForward.close();
            if (emitLogs) {
                log.info("Stopped port-forward to {}", target);
            }
        } catch (IOException e) {
            log.warn("Failed to stop port-forward to {}: {}", target, e.getMessage());
        }
    }
}
