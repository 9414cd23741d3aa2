package com.vibecoding.meshdoctor.controller;

import com.vibecoding.meshdoctor.metrics.MetricsResult;
import com.vibecoding.meshdoctor.service.MetricsService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 메트릭 수집 API
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private static final Logger log = LoggerFactory.getLogger(MetricsController.class);

    private final MetricsService metricsService;

    /**
     * 컨트롤 플레인 컴포넌트 메트릭
     */
    @GetMapping("/control-plane")
    public List<MetricsResultResponse> controlPlane(@RequestParam(required = false) Long timeoutMs) {
        return toResponses(metricsService.controlPlaneMetrics(toDuration(timeoutMs)));
    }

    /**
     * 네임스페이스의 프록시 메트릭
     *
     * @param selector "app=web,tier=frontend" 형식의 레이블 셀렉터
     */
    @GetMapping("/proxy")
    public List<MetricsResultResponse> proxy(
            @RequestParam String namespace,
            @RequestParam(required = false) String selector,
            @RequestParam(required = false) Long timeoutMs
    ) {
        return toResponses(metricsService.proxyMetrics(namespace, parseSelector(selector), toDuration(timeoutMs)));
    }

    static Map<String, String> parseSelector(String selector) {
        Map<String, String> labels = new LinkedHashMap<>();
        if (selector == null || selector.isBlank()) {
            return labels;
        }
        for (String term : selector.split(",")) {
            String[] kv = term.split("=", 2);
            if (kv.length != 2 || kv[0].isBlank()) {
                throw new IllegalArgumentException("Invalid label selector: " + selector);
            }
            labels.put(kv[0].trim(), kv[1].trim());
        }
        return labels;
    }

    private static Duration toDuration(Long timeoutMs) {
        if (timeoutMs == null) {
            return null;
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        return Duration.ofMillis(timeoutMs);
    }

    private List<MetricsResultResponse> toResponses(List<MetricsResult> results) {
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("Returning metrics for {} containers ({} failed)", results.size(), failed);
        return results.stream()
            .map(MetricsResultResponse::from)
            .collect(Collectors.toList());
    }
}
