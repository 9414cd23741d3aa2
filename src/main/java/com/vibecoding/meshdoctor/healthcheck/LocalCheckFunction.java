package com.vibecoding.meshdoctor.healthcheck;

/**
 * 로컬 체크 함수. 정상 반환이면 통과, 예외를 던지면 실패.
 */
@FunctionalInterface
public interface LocalCheckFunction {
    void check() throws Exception;
}
