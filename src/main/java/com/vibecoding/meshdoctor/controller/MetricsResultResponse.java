package com.vibecoding.meshdoctor.controller;

import com.vibecoding.meshdoctor.metrics.MetricsResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;

/**
 * 컨테이너 하나의 메트릭 (JSON). Prometheus 텍스트 포맷을 그대로 문자열로 전달한다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricsResultResponse {
    private String pod;
    private String container;
    private String metrics;
    private String error;

    public static MetricsResultResponse from(MetricsResult result) {
        return new MetricsResultResponse(
            result.getPod(),
            result.getContainer(),
            result.getMetrics() != null ? new String(result.getMetrics(), StandardCharsets.UTF_8) : null,
            result.getError() != null ? result.getError().getMessage() : null
        );
    }
}
