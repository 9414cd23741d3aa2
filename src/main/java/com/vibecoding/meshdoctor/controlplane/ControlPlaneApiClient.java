package com.vibecoding.meshdoctor.controlplane;

/**
 * 컨트롤 플레인 공개 API 클라이언트
 */
public interface ControlPlaneApiClient extends AutoCloseable {

    String SELF_CHECK_PATH = "/api/v1/SelfCheck";
    String VERSION_PATH = "/api/v1/Version";

    /**
     * 컨트롤 플레인의 서브시스템별 자체 점검 결과 조회
     */
    SelfCheckResponse selfCheck();

    /**
     * 컨트롤 플레인이 실행 중인 릴리스 버전 조회
     */
    ControlPlaneVersion version();

    /**
     * 클라이언트가 소유한 연결 자원 해제
     */
    @Override
    default void close() {
    }
}
