package com.ryuqq.conductor.core.error;

/**
 * Circuit Breaker가 열려 있어 호출을 시도하지 않고 즉시 실패했을 때 발생.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DependencyUnavailableException extends ConductorException {

    private final String dependencyName;

    public DependencyUnavailableException(String dependencyName) {
        this(dependencyName, null);
    }

    public DependencyUnavailableException(String dependencyName, Throwable lastError) {
        super(ErrorCode.DEPENDENCY_UNAVAILABLE, "Circuit breaker is open for dependency: " + dependencyName, lastError);
        this.dependencyName = dependencyName;
    }

    public String getDependencyName() {
        return dependencyName;
    }
}
