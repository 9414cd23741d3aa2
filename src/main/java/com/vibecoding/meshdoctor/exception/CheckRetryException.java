package com.vibecoding.meshdoctor.exception;

/**
 * 일시적으로 준비되지 않은 상태. 결과에 retry 플래그가 설정되며 이후 체크를 중단하지 않는다.
 */
public class CheckRetryException extends HealthCheckException {

    public CheckRetryException(String message) {
        super(message);
    }

    public CheckRetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
