package com.vibecoding.meshdoctor.controller;

import com.vibecoding.meshdoctor.healthcheck.CheckResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체크 결과 한 줄 (JSON)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckResultResponse {
    private String category;
    private String description;
    private String status;   // ok, retry, warning, fail
    private String error;

    public static CheckResultResponse from(CheckResult result) {
        String status;
        if (result.isSuccess()) {
            status = "ok";
        } else if (result.isRetry()) {
            status = "retry";
        } else if (result.isWarning()) {
            status = "warning";
        } else {
            status = "fail";
        }
        return new CheckResultResponse(result.getCategory(), result.getDescription(), status, result.getErrorMessage());
    }
}
