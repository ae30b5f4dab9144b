package com.ryuqq.conductor.core.error;

/**
 * 단일 시도가 시도당 타임아웃을 초과했을 때 발생.
 *
 * <p>재시도 계층에서는 항상 일시적 오류로 취급됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DependencyTimeoutException extends ConductorException {

    private final String dependencyName;
    private final long timeoutMs;

    public DependencyTimeoutException(String dependencyName, long timeoutMs) {
        super(ErrorCode.DEPENDENCY_TIMEOUT,
            "Attempt timed out for dependency: " + dependencyName + " (" + timeoutMs + "ms)");
        this.dependencyName = dependencyName;
        this.timeoutMs = timeoutMs;
    }

    public String getDependencyName() {
        return dependencyName;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
