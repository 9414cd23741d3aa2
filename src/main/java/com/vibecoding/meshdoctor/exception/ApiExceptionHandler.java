package com.vibecoding.meshdoctor.exception;

import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API 예외 처리 핸들러
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(K8sApiException.class)
    public ResponseEntity<Map<String, Object>> handleK8sApiException(K8sApiException ex) {
        log.error("Kubernetes API error: {}", ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, "Kubernetes API 호출 실패: " + ex.getMessage());
    }

    @ExceptionHandler(KubernetesClientException.class)
    public ResponseEntity<Map<String, Object>> handleK8sClientException(KubernetesClientException ex) {
        log.error("Kubernetes client error: {}", ex.getMessage(), ex);

        if (ex.getCode() == 401 || ex.getCode() == 403) {
            return error(HttpStatus.FORBIDDEN, "Kubernetes 클러스터 접근 권한이 없습니다.");
        }
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Kubernetes 클러스터에 연결할 수 없습니다: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "예기치 않은 오류가 발생했습니다: " + ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
