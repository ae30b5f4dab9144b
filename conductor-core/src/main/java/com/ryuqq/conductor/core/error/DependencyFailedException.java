package com.ryuqq.conductor.core.error;

/**
 * 일시적이지 않은(non-transient) checked 예외를 감싸서 전달할 때 사용.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DependencyFailedException extends ConductorException {

    private final String dependencyName;

    public DependencyFailedException(String dependencyName, Throwable cause) {
        super(ErrorCode.DEPENDENCY_FAILED, "Dependency call failed: " + dependencyName, cause);
        this.dependencyName = dependencyName;
    }

    public String getDependencyName() {
        return dependencyName;
    }
}
