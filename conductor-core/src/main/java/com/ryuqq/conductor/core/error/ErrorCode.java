package com.ryuqq.conductor.core.error;

/**
 * 엔진 오류 분류 체계.
 *
 * <p>실패한 WorkUnit에는 항상 이 코드 중 하나가 기록됩니다.
 * {@link #isRetryable()}은 "호출 지점에서 즉시 재시도해도 되는가"를 의미하며,
 * 호출자가 WorkUnit 전체를 나중에 다시 제출하는 것과는 무관합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCode {

    BLOCKED_INPUT("CND-001", false),
    DEPENDENCY_UNAVAILABLE("CND-101", false),
    BULKHEAD_TIMEOUT("CND-102", false),
    DEPENDENCY_EXHAUSTED("CND-103", false),
    DEPENDENCY_TIMEOUT("CND-104", true),
    DEPENDENCY_FAILED("CND-105", false),
    DELEGATION_DEPTH_EXCEEDED("CND-201", false),
    DELEGATION_CYCLE_DETECTED("CND-202", false),
    BUDGET_EXCEEDED("CND-203", false),
    DEADLINE_EXCEEDED("CND-204", false),
    SHUTDOWN_INTERRUPTED("CND-301", false),
    VALIDATION_FAILURE("CND-401", false),
    HANDLER_FAILED("CND-501", false);

    private final String code;
    private final boolean retryable;

    ErrorCode(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    /**
     * 외부 노출용 코드 (예: CND-101).
     *
     * @return 코드 문자열
     */
    public String code() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
