package com.vibecoding.meshdoctor.controlplane;

/**
 * SelfCheck 응답의 서브시스템 상태
 */
public enum CheckStatus {
    OK,
    FAIL,
    ERROR
}
