package com.vibecoding.meshdoctor.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KubernetesConfig")
class KubernetesConfigTest {

    @Test
    @DisplayName("should run metrics fetches on named daemon threads")
    void shouldUseNamedDaemonThreads() throws Exception {
        ExecutorService executor = new KubernetesConfig().metricsExecutor();
        try {
            Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, executor).get(5, TimeUnit.SECONDS);

            assertThat(worker.getName()).startsWith("metrics-fetch-");
            assertThat(worker.isDaemon()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }
}
