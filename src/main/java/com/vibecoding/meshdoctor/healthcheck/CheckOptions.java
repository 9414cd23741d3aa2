package com.vibecoding.meshdoctor.healthcheck;

import lombok.Builder;
import lombok.Value;

/**
 * 체크 실행 옵션 (어떤 카테고리를 어떤 대상에 대해 실행할지)
 */
@Value
@Builder(toBuilder = true)
public class CheckOptions {
    String controlPlaneNamespace;
    String dataPlaneNamespace;      // 데이터 플레인 체크 대상 (null이면 컨트롤 플레인 네임스페이스)
    String kubeconfig;
    String kubeContext;
    String apiAddr;
    String versionOverride;         // 최신 버전 조회 대신 사용할 버전 (테스트용)
    boolean preInstallOnly;
    boolean dataPlaneOnly;
    boolean shouldRetry;            // 준비되지 않은 상태를 retry로 보고
    @Builder.Default
    boolean shouldCheckKubeVersion = true;
    @Builder.Default
    boolean shouldCheckControlPlaneVersion = true;
}
