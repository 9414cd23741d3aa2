package com.vibecoding.meshdoctor.healthcheck;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 전체 체크가 성공하거나 대기 시간이 끝날 때까지 고정 간격으로 runChecks를 다시 실행한다.
 * 매 실행마다 모든 체크를 처음부터 다시 수행한다.
 */
public class RetryingCheckRunner {

    private static final Logger log = LoggerFactory.getLogger(RetryingCheckRunner.class);

    private final Duration wait;
    private final Duration interval;

    public RetryingCheckRunner(Duration wait, Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.wait = wait;
        this.interval = interval;
    }

    /**
     * @return 마지막 실행의 성공 여부
     */
    public boolean run(HealthChecker checker, CheckObserver observer) {
        long deadline = System.nanoTime() + wait.toNanos();
        int attempt = 0;

        while (true) {
            attempt++;
            observer.runStarted(attempt);
            boolean success = checker.runChecks(observer);
            if (success) {
                log.info("Health checks passed on attempt {}", attempt);
                return true;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Health checks still failing after {} attempts, giving up", attempt);
                return false;
            }

            long sleepNanos = Math.min(remaining, interval.toNanos());
            log.info("Health checks failed on attempt {}, retrying in {}ms", attempt,
                Duration.ofNanos(sleepNanos).toMillis());
            try {
                Thread.sleep(Duration.ofNanos(sleepNanos).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting to retry health checks");
                return false;
            }
        }
    }

    public Duration getWait() {
        return wait;
    }

    public Duration getInterval() {
        return interval;
    }
}
