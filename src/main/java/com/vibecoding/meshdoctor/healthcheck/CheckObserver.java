package com.vibecoding.meshdoctor.healthcheck;

/**
 * 체크 결과 수신자. 실행 흐름에는 영향을 주지 않는다.
 */
@FunctionalInterface
public interface CheckObserver {

    void observe(CheckResult result);

    /**
     * 재실행 시 매 실행 시작 직전에 호출된다 (attempt는 1부터).
     * 마지막 실행 결과만 보고하려면 여기서 이전 결과를 비운다.
     */
    default void runStarted(int attempt) {
    }
}
