package com.ryuqq.conductor.core.error;

/**
 * 일시적(transient) 오류로 재시도를 모두 소진했을 때 발생.
 *
 * <p>원인({@link #getCause()})은 마지막 시도의 오류입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DependencyExhaustedException extends ConductorException {

    private final String dependencyName;
    private final int attempts;

    public DependencyExhaustedException(String dependencyName, int attempts, Throwable lastError) {
        super(ErrorCode.DEPENDENCY_EXHAUSTED,
            "Retries exhausted for dependency: " + dependencyName + " after " + attempts + " attempt(s)", lastError);
        this.dependencyName = dependencyName;
        this.attempts = attempts;
    }

    public String getDependencyName() {
        return dependencyName;
    }

    public int getAttempts() {
        return attempts;
    }
}
