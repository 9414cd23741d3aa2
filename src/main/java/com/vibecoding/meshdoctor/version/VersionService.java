package com.vibecoding.meshdoctor.version;

import com.fasterxml.jackson.databind.JsonNode;
import com.vibecoding.meshdoctor.config.MeshDoctorProperties;
import com.vibecoding.meshdoctor.controlplane.ControlPlaneApiClient;
import com.vibecoding.meshdoctor.controlplane.ControlPlaneVersion;
import com.vibecoding.meshdoctor.exception.ControlPlaneApiException;
import com.vibecoding.meshdoctor.exception.VersionCheckException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * CLI와 컨트롤 플레인 버전이 최신인지 확인
 */
@Service
@RequiredArgsConstructor
public class VersionService {

    private static final Logger log = LoggerFactory.getLogger(VersionService.class);

    @Qualifier("controlPlaneRestTemplate")
    private final RestTemplate restTemplate;
    private final MeshDoctorProperties properties;

    /**
     * 버전 체크 엔드포인트에서 최신 릴리스 버전 조회
     */
    public String getLatestVersion() {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getVersionCheckUrl())
            .queryParam("version", properties.getCliVersion())
            .queryParam("source", "cli")
            .toUriString();

        try {
            JsonNode body = restTemplate.getForObject(url, JsonNode.class);
            if (body == null || !body.hasNonNull("version") || body.get("version").asText().isBlank()) {
                throw new VersionCheckException("Version check response did not contain a version: " + url);
            }
            String latest = body.get("version").asText();
            log.debug("Latest version from {}: {}", properties.getVersionCheckUrl(), latest);
            return latest;
        } catch (RestClientException e) {
            log.error("Failed to get latest version from {}", url, e);
            throw new VersionCheckException("Failed to get the latest version: " + e.getMessage(), e);
        }
    }

    public void checkClientVersion(String latestVersion) {
        checkVersion(properties.getCliVersion(), latestVersion);
    }

    public void checkServerVersion(ControlPlaneApiClient apiClient, String latestVersion) {
        if (apiClient == null) {
            throw new VersionCheckException("Control plane API client is not initialized");
        }
        ControlPlaneVersion serverVersion;
        try {
            serverVersion = apiClient.version();
        } catch (ControlPlaneApiException e) {
            throw new VersionCheckException("Failed to get the control plane version: " + e.getMessage(), e);
        }
        checkVersion(serverVersion.getReleaseVersion(), latestVersion);
    }

    static void checkVersion(String version, String latestVersion) {
        if (latestVersion == null || latestVersion.isBlank()) {
            throw new VersionCheckException("Latest version is unknown");
        }
        if (!latestVersion.equals(version)) {
            throw new VersionCheckException(String.format(
                "is running version %s but the latest version is %s", version, latestVersion));
        }
    }
}
