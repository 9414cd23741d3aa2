package com.vibecoding.meshdoctor.config;

import com.vibecoding.meshdoctor.k8s.KubernetesClientFactory;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 메트릭 수집에 사용하는 Kubernetes 클라이언트와 스레드 풀
 */
@Configuration
public class KubernetesConfig {

    /**
     * 첫 사용 시점에 생성 (클러스터 없이도 애플리케이션 기동 가능)
     */
    @Bean(destroyMethod = "close")
    @Lazy
    public KubernetesClient kubernetesClient(KubernetesClientFactory factory, MeshDoctorProperties properties) {
        return factory.create(properties.getKubeconfig(), properties.getKubeContext());
    }

    /**
     * 컨테이너당 하나의 스크레이핑 작업. 타임아웃 이후 남은 작업은 인터럽트하지 않는다.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService metricsExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("metrics-fetch-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }
}
