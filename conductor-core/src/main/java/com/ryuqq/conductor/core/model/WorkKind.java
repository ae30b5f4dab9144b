package com.ryuqq.conductor.core.model;

/**
 * WorkUnit의 요청 유형.
 *
 * <p>Router의 유형 기반 규칙(kind rule)이 이 값을 보고 핸들러를 선택할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkKind {

    /**
     * 사용자 요청 (HTTP, CLI, 메신저 등 외부 intake).
     */
    USER_REQUEST,

    /**
     * 스케줄러가 발생시킨 주기 작업.
     */
    SCHEDULED_JOB,

    /**
     * 핸들러가 다른 핸들러에게 위임한 하위 작업.
     */
    DELEGATED_TASK
}
