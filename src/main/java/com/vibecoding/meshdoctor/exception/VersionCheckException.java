package com.vibecoding.meshdoctor.exception;

/**
 * 버전 조회 실패 또는 최신 버전과 불일치
 */
public class VersionCheckException extends HealthCheckException {

    public VersionCheckException(String message) {
        super(message);
    }

    public VersionCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
