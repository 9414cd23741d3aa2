package com.vibecoding.meshdoctor.k8s;

import java.util.Arrays;

/**
 * Kubernetes 서버 버전 (major.minor.patch) 비교
 */
public final class KubernetesVersion implements Comparable<KubernetesVersion> {

    private final int[] parts;

    private KubernetesVersion(int[] parts) {
        this.parts = parts;
    }

    /**
     * "v1.10.3", "1.8.0", "1.9+" 같은 문자열을 파싱. 숫자가 아닌 접미사(-gke.0, +)는 무시한다.
     */
    public static KubernetesVersion parse(String version) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Version must not be empty");
        }

        String trimmed = version.trim();
        if (trimmed.startsWith("v")) {
            trimmed = trimmed.substring(1);
        }

        String[] tokens = trimmed.split("\\.");
        int[] parsed = new int[3];
        for (int i = 0; i < parsed.length && i < tokens.length; i++) {
            parsed[i] = leadingNumber(tokens[i], version);
        }
        return new KubernetesVersion(parsed);
    }

    /**
     * VersionInfo의 major/minor 필드로 생성 (minor는 "8+" 형태일 수 있음)
     */
    public static KubernetesVersion of(String major, String minor) {
        return new KubernetesVersion(new int[]{
            leadingNumber(major, major + "." + minor),
            leadingNumber(minor, major + "." + minor),
            0
        });
    }

    private static int leadingNumber(String token, String original) {
        int end = 0;
        while (end < token.length() && Character.isDigit(token.charAt(end))) {
            end++;
        }
        if (end == 0) {
            throw new IllegalArgumentException("Invalid version: " + original);
        }
        return Integer.parseInt(token.substring(0, end));
    }

    public boolean isAtLeast(KubernetesVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(KubernetesVersion other) {
        return Arrays.compare(parts, other.parts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KubernetesVersion)) {
            return false;
        }
        return Arrays.equals(parts, ((KubernetesVersion) o).parts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(parts);
    }

    @Override
    public String toString() {
        return parts[0] + "." + parts[1] + "." + parts[2];
    }
}
