package com.ryuqq.conductor.core.error;

/**
 * Bulkhead 슬롯을 대기 시간 내에 얻지 못했을 때 발생. operation은 호출되지 않습니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BulkheadTimeoutException extends ConductorException {

    private final String dependencyName;

    public BulkheadTimeoutException(String dependencyName, long waitedMs) {
        super(ErrorCode.BULKHEAD_TIMEOUT,
            "Bulkhead full for dependency: " + dependencyName + " (waited " + waitedMs + "ms)");
        this.dependencyName = dependencyName;
    }

    public String getDependencyName() {
        return dependencyName;
    }
}
