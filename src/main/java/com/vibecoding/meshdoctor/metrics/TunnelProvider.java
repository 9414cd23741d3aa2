package com.vibecoding.meshdoctor.metrics;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;

/**
 * Pod 컨테이너의 이름 있는 포트로 터널을 연다.
 */
public interface TunnelProvider {

    /**
     * 열기에 실패하면 중간에 할당한 자원을 정리한 뒤 예외를 던진다.
     *
     * @param emitLogs 터널 진단 로그 출력 여부
     */
    Tunnel open(Pod pod, Container container, String portName, boolean emitLogs) throws Exception;
}
