package com.vibecoding.meshdoctor.controller;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 헬스 체크 실행 결과 전체
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckReport {
    private boolean success;
    private List<CheckResultResponse> results;
}
