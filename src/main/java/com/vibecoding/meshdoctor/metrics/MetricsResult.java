package com.vibecoding.meshdoctor.metrics;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Comparator;

/**
 * 컨테이너 하나의 메트릭 스크레이핑 결과. metrics와 error 중 하나만 설정된다.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MetricsResult {

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    /**
     * (pod, container) 사전순, 이름이 없으면 앞쪽. 완료 순서와 무관하게 출력 순서를 고정한다.
     */
    public static final Comparator<MetricsResult> BY_POD_AND_CONTAINER =
        Comparator.comparing(MetricsResult::getPod, NULLS_FIRST)
            .thenComparing(MetricsResult::getContainer, NULLS_FIRST);

    String pod;
    String container;
    byte[] metrics;
    Exception error;

    public static MetricsResult success(String pod, String container, byte[] metrics) {
        return new MetricsResult(pod, container, metrics != null ? metrics.clone() : new byte[0], null);
    }

    public static MetricsResult failure(String pod, String container, Exception error) {
        return new MetricsResult(pod, container, null, error);
    }

    /**
     * 응답 본문의 복사본 (실패 결과이면 null)
     */
    public byte[] getMetrics() {
        return metrics != null ? metrics.clone() : null;
    }

    public boolean isSuccess() {
        return error == null;
    }
}
