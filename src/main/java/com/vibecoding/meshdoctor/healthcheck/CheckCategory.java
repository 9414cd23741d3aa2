package com.vibecoding.meshdoctor.healthcheck;

/**
 * 체크 카테고리. 등록 순서가 곧 의존 순서다.
 */
public final class CheckCategory {

    public static final String KUBERNETES_API = "kubernetes-api";
    public static final String PRE_INSTALL = "pre-install";
    public static final String CONTROL_PLANE_API = "control-plane-api";
    public static final String DATA_PLANE = "data-plane";
    public static final String MESH_VERSION = "mesh-version";

    private CheckCategory() {
    }
}
