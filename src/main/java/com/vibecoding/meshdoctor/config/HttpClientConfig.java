package com.vibecoding.meshdoctor.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP 클라이언트 설정
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final MeshDoctorProperties properties;

    /**
     * 컨트롤 플레인 API 및 버전 조회용 (RPC 타임아웃 적용)
     */
    @Bean
    public RestTemplate controlPlaneRestTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(properties.rpcTimeout())
            .build();
    }

    /**
     * 컨테이너 /metrics 스크레이핑용. 전체 배치 타임아웃은 MetricsCollector가 관리
     */
    @Bean
    public RestTemplate metricsRestTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(properties.metricsTimeout())
            .build();
    }
}
