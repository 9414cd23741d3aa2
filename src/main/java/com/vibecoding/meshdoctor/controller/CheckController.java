package com.vibecoding.meshdoctor.controller;

import com.vibecoding.meshdoctor.healthcheck.CheckObserver;
import com.vibecoding.meshdoctor.healthcheck.CheckOptions;
import com.vibecoding.meshdoctor.healthcheck.CheckResult;
import com.vibecoding.meshdoctor.service.HealthCheckService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * 헬스 체크 API
 */
@RestController
@RequestMapping("/api/check")
@RequiredArgsConstructor
public class CheckController {

    private static final Logger log = LoggerFactory.getLogger(CheckController.class);

    private final HealthCheckService healthCheckService;

    /**
     * 헬스 체크 실행
     *
     * @param pre             설치 전 체크만 실행
     * @param proxy           데이터 플레인 체크만 실행
     * @param wait            준비될 때까지 재시도
     * @param namespace       데이터 플레인 체크 대상 네임스페이스
     * @param expectedVersion 최신 버전 조회 대신 사용할 버전
     */
    @GetMapping
    public CheckReport check(
            @RequestParam(defaultValue = "false") boolean pre,
            @RequestParam(defaultValue = "false") boolean proxy,
            @RequestParam(defaultValue = "false") boolean wait,
            @RequestParam(required = false) String namespace,
            @RequestParam(required = false) String expectedVersion
    ) {
        if (pre && proxy) {
            throw new IllegalArgumentException("pre and proxy checks cannot be combined");
        }

        CheckOptions options = healthCheckService.defaultOptions()
            .preInstallOnly(pre)
            .dataPlaneOnly(proxy)
            .shouldRetry(wait)
            .dataPlaneNamespace(namespace)
            .versionOverride(expectedVersion)
            .shouldCheckControlPlaneVersion(!pre)
            .build();

        // wait=true이면 마지막 실행의 결과만 보고
        List<CheckResultResponse> results = new ArrayList<>();
        boolean success = healthCheckService.runChecks(options, new CheckObserver() {
            @Override
            public void observe(CheckResult result) {
                logResult(result);
                results.add(CheckResultResponse.from(result));
            }

            @Override
            public void runStarted(int attempt) {
                if (attempt > 1) {
                    log.info("Retrying health checks (attempt {})", attempt);
                }
                results.clear();
            }
        });

        return new CheckReport(success, results);
    }

    private void logResult(CheckResult result) {
        if (result.isSuccess()) {
            log.info("{}: {} [ok]", result.getCategory(), result.getDescription());
        } else if (result.isRetry()) {
            log.info("{}: {} [retry] -- {}", result.getCategory(), result.getDescription(), result.getErrorMessage());
        } else if (result.isWarning()) {
            log.warn("{}: {} [warning] -- {}", result.getCategory(), result.getDescription(), result.getErrorMessage());
        } else {
            log.warn("{}: {} [FAIL] -- {}", result.getCategory(), result.getDescription(), result.getErrorMessage());
        }
    }
}
