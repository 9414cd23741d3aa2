package com.vibecoding.meshdoctor.controlplane;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 컨트롤 플레인 서브시스템 하나의 자체 점검 결과
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubsystemCheckResult {
    private String subsystemName;          // e.g. "kubernetes", "prometheus"
    private String checkDescription;
    private CheckStatus status;
    private String friendlyMessageToUser;  // status가 OK가 아닐 때 사용자에게 보여줄 메시지
}
