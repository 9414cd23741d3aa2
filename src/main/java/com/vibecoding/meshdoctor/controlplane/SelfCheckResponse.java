package com.vibecoding.meshdoctor.controlplane;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 컨트롤 플레인 SelfCheck RPC 응답
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SelfCheckResponse {
    @Builder.Default
    private List<SubsystemCheckResult> results = new ArrayList<>();
}
