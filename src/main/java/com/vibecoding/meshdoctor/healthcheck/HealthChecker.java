package com.vibecoding.meshdoctor.healthcheck;

import com.vibecoding.meshdoctor.controlplane.CheckStatus;
import com.vibecoding.meshdoctor.controlplane.SelfCheckResponse;
import com.vibecoding.meshdoctor.controlplane.SubsystemCheckResult;
import com.vibecoding.meshdoctor.exception.CheckRetryException;
import com.vibecoding.meshdoctor.exception.ControlPlaneApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 등록된 체크를 등록 순서대로, 호출 스레드에서 하나씩 실행한다.
 *
 * <p>카테고리는 의존 순서대로 추가해야 한다. 뒤의 체크는 앞의 체크가 만든 상태(클라이언트 등)를
 * 사용할 수 있으며, 엔진은 이 순서를 검증하지 않는다.
 */
public class HealthChecker {

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    private final List<Check> checks = new ArrayList<>();

    public HealthChecker add(Check check) {
        checks.add(check);
        return this;
    }

    /**
     * 카테고리 하나에 해당하는 체크 묶음 추가
     */
    public HealthChecker addAll(List<Check> categoryChecks) {
        checks.addAll(categoryChecks);
        return this;
    }

    public List<Check> getChecks() {
        return Collections.unmodifiableList(checks);
    }

    /**
     * 모든 체크를 실행하고 각 결과를 observer에 전달한다.
     *
     * <p>fatal 체크가 실패하면(재시도 힌트가 아닌 경우) 남은 체크를 모두 건너뛴다.
     * 원격 체크가 성공하면 응답의 서브시스템마다 "category[subsystem]" 결과를 하나씩 만든다.
     *
     * @return 경고가 아닌 실패가 하나도 없으면 true
     */
    public boolean runChecks(CheckObserver observer) {
        boolean success = true;
        int executed = 0;

        for (Check check : checks) {
            executed++;
            if (check instanceof Check.LocalCheck) {
                CheckResult result = runLocal((Check.LocalCheck) check);
                observer.observe(result);
                if (result.isFailure()) {
                    success = false;
                }
                if (shouldStop(check, result)) {
                    break;
                }
            } else if (check instanceof Check.RemoteCheck) {
                RemoteOutcome outcome = runRemote((Check.RemoteCheck) check);
                for (CheckResult result : outcome.results) {
                    observer.observe(result);
                    if (result.isFailure()) {
                        success = false;
                    }
                }
                if (outcome.transportFailed && shouldStop(check, outcome.results.get(0))) {
                    break;
                }
            } else {
                throw new IllegalStateException("Unsupported check type: " + check);
            }
        }

        if (executed < checks.size()) {
            log.info("Skipped {} remaining checks after fatal failure", checks.size() - executed);
        }
        log.debug("Health check run finished: success={}", success);
        return success;
    }

    private static boolean shouldStop(Check check, CheckResult result) {
        if (!result.isFailure() || result.isRetry() || !check.isFatal()) {
            return false;
        }
        log.warn("Fatal check failed: {}: {}", check.getCategory(), check.getDescription());
        return true;
    }

    private CheckResult runLocal(Check.LocalCheck check) {
        Exception error = null;
        try {
            check.getFunction().check();
        } catch (Exception e) {
            error = e;
        }
        log.debug("{}: {} -> {}", check.getCategory(), check.getDescription(), error == null ? "ok" : error.getMessage());
        return result(check, error);
    }

    private RemoteOutcome runRemote(Check.RemoteCheck check) {
        SelfCheckResponse response;
        try {
            response = check.getFunction().check();
            if (response == null) {
                throw new ControlPlaneApiException("Control plane returned an empty self-check response");
            }
        } catch (Exception e) {
            log.debug("{}: {} -> {}", check.getCategory(), check.getDescription(), e.getMessage());
            return new RemoteOutcome(List.of(result(check, e)), true);
        }

        List<CheckResult> results = new ArrayList<>();
        List<SubsystemCheckResult> subsystems = response.getResults() != null
            ? response.getResults()
            : Collections.emptyList();

        for (SubsystemCheckResult subsystem : subsystems) {
            Exception error = null;
            if (subsystem.getStatus() != CheckStatus.OK) {
                error = new ControlPlaneApiException(subsystemMessage(subsystem));
            }
            results.add(CheckResult.builder()
                .category(String.format("%s[%s]", check.getCategory(), subsystem.getSubsystemName()))
                .description(subsystem.getCheckDescription())
                .error(error)
                .warning(false)
                .build());
        }
        return new RemoteOutcome(results, false);
    }

    private static String subsystemMessage(SubsystemCheckResult subsystem) {
        String message = subsystem.getFriendlyMessageToUser();
        if (message == null || message.isBlank()) {
            return String.format("%s reported status %s", subsystem.getSubsystemName(), subsystem.getStatus());
        }
        return message;
    }

    private static CheckResult result(Check check, Exception error) {
        return CheckResult.builder()
            .category(check.getCategory())
            .description(check.getDescription())
            .error(error)
            .retry(error instanceof CheckRetryException)
            .warning(error != null && check.isWarning())
            .build();
    }

    private static final class RemoteOutcome {
        private final List<CheckResult> results;
        private final boolean transportFailed;

        private RemoteOutcome(List<CheckResult> results, boolean transportFailed) {
            this.results = results;
            this.transportFailed = transportFailed;
        }
    }
}
