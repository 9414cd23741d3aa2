package com.vibecoding.meshdoctor.healthcheck;

import com.vibecoding.meshdoctor.controlplane.SelfCheckResponse;

/**
 * 원격 SelfCheck 호출. 예외는 전송 실패(연결, 타임아웃)를 의미한다.
 */
@FunctionalInterface
public interface RemoteCheckFunction {
    SelfCheckResponse check() throws Exception;
}
