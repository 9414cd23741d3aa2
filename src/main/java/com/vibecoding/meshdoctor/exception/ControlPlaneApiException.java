package com.vibecoding.meshdoctor.exception;

/**
 * 컨트롤 플레인 API(SelfCheck, Version) 호출 실패
 */
public class ControlPlaneApiException extends RuntimeException {

    public ControlPlaneApiException(String message) {
        super(message);
    }

    public ControlPlaneApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
