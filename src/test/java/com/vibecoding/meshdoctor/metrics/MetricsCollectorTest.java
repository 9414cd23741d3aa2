package com.vibecoding.meshdoctor.metrics;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("MetricsCollector")
class MetricsCollectorTest {

    private static final String PORT = "admin-http";
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private ExecutorService executor;
    private FakeTunnelProvider tunnels;
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        tunnels = new FakeTunnelProvider();
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    private static Container container(String name, String... portNames) {
        ContainerBuilder builder = new ContainerBuilder().withName(name);
        int port = 9990;
        for (String portName : portNames) {
            builder.addNewPort().withName(portName).withContainerPort(port++).endPort();
        }
        return builder.build();
    }

    private static Pod pod(String name, String phase, Container... containers) {
        return new PodBuilder()
            .withNewMetadata().withName(name).withNamespace("linkerd").endMetadata()
            .withNewSpec().withContainers(containers).endSpec()
            .withNewStatus().withPhase(phase).endStatus()
            .build();
    }

    /**
     * pod-a는 Running이 아니고, pod-b는 적격 컨테이너 2개, pod-c는 1개
     */
    private static List<Pod> threePods() {
        return List.of(
            pod("pod-c", "Running", container("proxy", PORT)),
            pod("pod-a", "Pending", container("proxy", PORT)),
            pod("pod-b", "Running",
                container("public-api", PORT, "http"),
                container("destination", PORT),
                container("sidecar", "grpc")));
    }

    private static byte[] body(String url) {
        return ("metrics from " + url).getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Eligibility and ordering")
    class EligibilityAndOrdering {

        @Test
        @DisplayName("should scrape only eligible containers of running pods, sorted by pod and container")
        void shouldCollectSortedResults() {
            MetricsCollector collector = new MetricsCollector(tunnels, MetricsCollectorTest::body, executor);

            List<MetricsResult> results = collector.collect(threePods(), PORT, TIMEOUT, false);

            assertThat(results)
                .extracting(MetricsResult::getPod, MetricsResult::getContainer, MetricsResult::isSuccess)
                .containsExactly(
                    tuple("pod-b", "destination", true),
                    tuple("pod-b", "public-api", true),
                    tuple("pod-c", "proxy", true));
            assertThat(new String(results.get(0).getMetrics(), StandardCharsets.UTF_8))
                .isEqualTo("metrics from http://tunnel/pod-b/destination/metrics");
            assertThat(tunnels.opened).hasValue(3);
            assertThat(tunnels.closed).hasValue(3);
        }

        @Test
        @DisplayName("should return immediately when no container is eligible")
        void shouldReturnImmediatelyWithoutEligibleContainers() {
            MetricsCollector collector = new MetricsCollector(tunnels, MetricsCollectorTest::body, executor);
            List<Pod> pods = List.of(
                pod("pod-a", "Succeeded", container("proxy", PORT)),
                pod("pod-b", "Running", container("app", "http")));

            long start = System.nanoTime();
            List<MetricsResult> results = collector.collect(pods, PORT, Duration.ofMinutes(5), false);

            assertThat(results).isEmpty();
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
            assertThat(tunnels.opened).hasValue(0);
        }

        @Test
        @DisplayName("should yield content-equivalent results on repeated runs")
        void shouldBeRepeatable() {
            MetricsCollector collector = new MetricsCollector(tunnels, MetricsCollectorTest::body, executor);

            List<MetricsResult> first = collector.collect(threePods(), PORT, TIMEOUT, false);
            List<MetricsResult> second = collector.collect(threePods(), PORT, TIMEOUT, false);

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("should keep sibling results when one tunnel cannot be opened")
        void shouldIsolateTunnelFailure() {
            tunnels.failFor.put("pod-b/public-api", new IOException("port-forward refused"));
            MetricsCollector collector = new MetricsCollector(tunnels, MetricsCollectorTest::body, executor);

            List<MetricsResult> results = collector.collect(threePods(), PORT, TIMEOUT, false);

            assertThat(results).hasSize(3);
            MetricsResult failed = results.get(1);
            assertThat(failed.getContainer()).isEqualTo("public-api");
            assertThat(failed.getError()).hasMessage("port-forward refused");
            assertThat(failed.getMetrics()).isNull();
            assertThat(results.get(0).isSuccess()).isTrue();
            assertThat(results.get(2).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("should close the tunnel when the fetch fails")
        void shouldCloseTunnelOnFetchFailure() {
            MetricsFetcher fetcher = url -> {
                if (url.contains("pod-c")) {
                    throw new IOException("Unexpected status 503");
                }
                return body(url);
            };
            MetricsCollector collector = new MetricsCollector(tunnels, fetcher, executor);

            List<MetricsResult> results = collector.collect(threePods(), PORT, TIMEOUT, false);

            assertThat(results).extracting(MetricsResult::isSuccess).containsExactly(true, true, false);
            assertThat(results.get(2).getError()).hasMessageContaining("503");
            assertThat(tunnels.opened).hasValue(3);
            assertThat(tunnels.closed).hasValue(3);
        }

        @Test
        @DisplayName("should record a failure when the executor rejects the task")
        void shouldRecordRejectedTask() {
            executor.shutdown();
            MetricsCollector collector = new MetricsCollector(tunnels, MetricsCollectorTest::body, executor);

            List<MetricsResult> results = collector.collect(threePods(), PORT, TIMEOUT, false);

            assertThat(results).hasSize(3).allMatch(r -> !r.isSuccess());
        }
    }

    @Nested
    @DisplayName("Deadline")
    class Deadline {

        @Test
        @DisplayName("should return the completed subset once the timeout elapses")
        void shouldReturnPartialResultsOnTimeout() throws Exception {
            MetricsFetcher fetcher = url -> {
                if (url.contains("pod-b/public-api")) {
                    release.await(30, TimeUnit.SECONDS);
                }
                return body(url);
            };
            MetricsCollector collector = new MetricsCollector(tunnels, fetcher, executor);

            long start = System.nanoTime();
            List<MetricsResult> results = collector.collect(threePods(), PORT, Duration.ofMillis(300), false);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(results)
                .extracting(MetricsResult::getPod, MetricsResult::getContainer)
                .containsExactly(tuple("pod-b", "destination"), tuple("pod-c", "proxy"));
            assertThat(elapsed).isLessThan(Duration.ofSeconds(5));

            // 늦게 끝난 작업의 결과는 반환된 목록에 추가되지 않는다
            release.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            assertThat(results).hasSize(2);
            assertThat(tunnels.closed).hasValue(3);
        }
    }

    /**
     * 실제 포트포워드 대신 http://tunnel/{pod}/{container} 주소를 돌려준다.
     */
    static class FakeTunnelProvider implements TunnelProvider {

        final AtomicInteger opened = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        final Map<String, Exception> failFor = new ConcurrentHashMap<>();

        @Override
        public Tunnel open(Pod pod, Container container, String portName, boolean emitLogs) throws Exception {
            String target = pod.getMetadata().getName() + "/" + container.getName();
            Exception failure = failFor.get(target);
            if (failure != null) {
                throw failure;
            }
            opened.incrementAndGet();
            return new Tunnel() {
                private boolean done;

                @Override
                public String urlFor(String path) {
                    return "http://tunnel/" + target + path;
                }

                @Override
                public synchronized void close() {
                    if (!done) {
                        done = true;
                        closed.incrementAndGet();
                    }
                }
            };
        }
    }
}
