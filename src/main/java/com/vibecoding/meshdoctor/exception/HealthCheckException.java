package com.vibecoding.meshdoctor.exception;

/**
 * 헬스 체크 실패 (체크 함수가 던지는 기본 예외)
 */
public class HealthCheckException extends RuntimeException {

    public HealthCheckException(String message) {
        super(message);
    }

    public HealthCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
