package com.vibecoding.meshdoctor.healthcheck;

import java.util.Objects;

/**
 * 등록된 헬스 체크 하나. {@link LocalCheck} 또는 {@link RemoteCheck} 중 하나이며 생성 후 변경되지 않는다.
 *
 * <p>fatal 체크가 실패하면 이후의 모든 체크를 건너뛴다. warning 체크의 실패는 결과에 표시되지만
 * 전체 성공 여부에는 영향을 주지 않는다.
 */
public abstract class Check {

    private final String category;
    private final String description;
    private final boolean fatal;
    private final boolean warning;

    private Check(String category, String description, boolean fatal, boolean warning) {
        this.category = Objects.requireNonNull(category, "category");
        this.description = Objects.requireNonNull(description, "description");
        this.fatal = fatal;
        this.warning = warning;
    }

    public static Check local(String category, String description, boolean fatal, LocalCheckFunction fn) {
        return new LocalCheck(category, description, fatal, false, fn);
    }

    public static Check remote(String category, String description, boolean fatal, RemoteCheckFunction fn) {
        return new RemoteCheck(category, description, fatal, fn);
    }

    /**
     * 실패해도 전체 실행을 실패로 만들지 않는 로컬 체크 (버전 최신 여부 등)
     */
    public static Check warning(String category, String description, LocalCheckFunction fn) {
        return new LocalCheck(category, description, false, true, fn);
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFatal() {
        return fatal;
    }

    public boolean isWarning() {
        return warning;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + category + ": " + description + (fatal ? ", fatal" : "") + "]";
    }

    public static final class LocalCheck extends Check {

        private final LocalCheckFunction function;

        private LocalCheck(String category, String description, boolean fatal, boolean warning,
                           LocalCheckFunction function) {
            super(category, description, fatal, warning);
            this.function = Objects.requireNonNull(function, "function");
        }

        public LocalCheckFunction getFunction() {
            return function;
        }
    }

    public static final class RemoteCheck extends Check {

        private final RemoteCheckFunction function;

        private RemoteCheck(String category, String description, boolean fatal, RemoteCheckFunction function) {
            super(category, description, fatal, false);
            this.function = Objects.requireNonNull(function, "function");
        }

        public RemoteCheckFunction getFunction() {
            return function;
        }
    }
}
