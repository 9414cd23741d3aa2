package com.vibecoding.meshdoctor.metrics;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerPort;
import io.fabric8.kubernetes.api.model.Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 여러 Pod의 컨테이너에서 메트릭을 병렬로 수집한다.
 *
 * <p>적격 컨테이너마다 작업 하나를 실행하고 결과를 큐로 모은다. 모든 결과가 도착하거나 타임아웃이 지나면
 * 그때까지 도착한 결과만 (pod, container) 순으로 정렬해 반환한다. 타임아웃 이후 완료되는 작업의 결과는 버려진다.
 */
@Component
public class MetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    static final String METRICS_PATH = "/metrics";
    private static final String POD_RUNNING = "Running";

    private final TunnelProvider tunnelProvider;
    private final MetricsFetcher metricsFetcher;
    private final ExecutorService executor;

    public MetricsCollector(TunnelProvider tunnelProvider,
                            MetricsFetcher metricsFetcher,
                            @Qualifier("metricsExecutor") ExecutorService executor) {
        this.tunnelProvider = tunnelProvider;
        this.metricsFetcher = metricsFetcher;
        this.executor = executor;
    }

    /**
     * @param pods     대상 Pod 목록 (Running이 아닌 Pod은 건너뜀)
     * @param portName 컨테이너가 노출해야 하는 포트 이름
     * @param timeout  배치 전체의 최대 대기 시간
     * @param emitLogs 터널 진단 로그 출력 여부
     */
    public List<MetricsResult> collect(List<Pod> pods, String portName, Duration timeout, boolean emitLogs) {
        BlockingQueue<MetricsResult> completed = new LinkedBlockingQueue<>();
        AtomicInteger outstanding = new AtomicInteger();
        int dispatched = 0;

        for (Pod pod : pods) {
            for (Container container : eligibleContainers(pod, portName)) {
                dispatched++;
                outstanding.incrementAndGet();
                try {
                    executor.execute(() -> {
                        try {
                            completed.add(fetchContainerMetrics(pod, container, portName, emitLogs));
                        } finally {
                            outstanding.decrementAndGet();
                        }
                    });
                } catch (RejectedExecutionException e) {
                    outstanding.decrementAndGet();
                    completed.add(MetricsResult.failure(podName(pod), container.getName(), e));
                }
            }
        }

        log.info("Collecting {} metrics from {} containers in {} pods", portName, dispatched, pods.size());

        List<MetricsResult> results = awaitResults(completed, dispatched, timeout);
        if (results.size() < dispatched) {
            log.warn("Timed out after {}ms waiting for metrics: received {} of {}, {} still in flight",
                timeout.toMillis(), results.size(), dispatched, outstanding.get());
        }

        results.sort(MetricsResult.BY_POD_AND_CONTAINER);
        return results;
    }

    private List<MetricsResult> awaitResults(BlockingQueue<MetricsResult> completed, int expected, Duration timeout) {
        List<MetricsResult> results = new ArrayList<>(expected);
        long deadline = System.nanoTime() + timeout.toNanos();

        while (results.size() < expected) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                MetricsResult result = completed.poll(remaining, TimeUnit.NANOSECONDS);
                if (result == null) {
                    break;
                }
                results.add(result);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for metrics");
                break;
            }
        }

        // 타임아웃과 동시에 도착한 결과까지 포함
        if (results.size() < expected) {
            completed.drainTo(results, expected - results.size());
        }
        return results;
    }

    /**
     * Running Pod에서 portName 포트를 노출하는 컨테이너 목록
     */
    List<Container> eligibleContainers(Pod pod, String portName) {
        if (pod.getStatus() == null || !POD_RUNNING.equals(pod.getStatus().getPhase())) {
            log.warn("Skipping pod not running: {}", podName(pod));
            return Collections.emptyList();
        }
        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return Collections.emptyList();
        }

        List<Container> containers = new ArrayList<>();
        for (Container container : pod.getSpec().getContainers()) {
            if (exposesPort(container, portName)) {
                containers.add(container);
            }
        }
        return containers;
    }

    private static boolean exposesPort(Container container, String portName) {
        if (container.getPorts() == null) {
            return false;
        }
        for (ContainerPort port : container.getPorts()) {
            if (portName.equals(port.getName())) {
                return true;
            }
        }
        return false;
    }

    private MetricsResult fetchContainerMetrics(Pod pod, Container container, String portName, boolean emitLogs) {
        String podName = podName(pod);
        String containerName = container.getName();

        try (Tunnel tunnel = tunnelProvider.open(pod, container, portName, emitLogs)) {
            byte[] metrics = metricsFetcher.fetch(tunnel.urlFor(METRICS_PATH));
            log.debug("Fetched {} bytes of metrics from {}/{}", metrics.length, podName, containerName);
            return MetricsResult.success(podName, containerName, metrics);
        } catch (Exception e) {
            log.warn("Failed to fetch metrics from {}/{}: {}", podName, containerName, e.getMessage());
            return MetricsResult.failure(podName, containerName, e);
        }
    }

    private static String podName(Pod pod) {
        return pod.getMetadata() != null ? pod.getMetadata().getName() : "";
    }
}
