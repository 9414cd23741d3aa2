package com.vibecoding.meshdoctor.healthcheck;

import lombok.Builder;
import lombok.Value;

/**
 * 옵저버에 전달되는 체크 결과
 */
@Value
@Builder
public class CheckResult {
    String category;
    String description;
    Exception error;    // null이면 통과
    boolean retry;      // 일시적 실패: 잠시 후 재실행 권장
    boolean warning;    // 표시하되 전체 성공 여부에는 반영하지 않음

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * 전체 실행을 실패로 만드는 결과인지 (경고가 아닌 에러)
     */
    public boolean isFailure() {
        return error != null && !warning;
    }

    public String getErrorMessage() {
        return error != null ? error.getMessage() : null;
    }
}
