package com.ryuqq.conductor.core.statemachine;

/**
 * WorkUnit의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (Coordinator 수락)
 * RUNNING ◄──────────────┐
 *    │                    │ (외부 승인 신호)
 *    ├─► AWAITING_APPROVAL┘
 *    │
 *    ├─► COMPLETED
 *    ├─► FAILED
 *    └─► CANCELLED
 *
 * PENDING, AWAITING_APPROVAL 에서도 FAILED/CANCELLED 로 직접 종료될 수 있습니다.
 * 종료 상태(COMPLETED, FAILED, CANCELLED)는 불변입니다.
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkStatus {

    /**
     * 생성됨, 아직 핸들러가 실행되지 않음.
     */
    PENDING,

    /**
     * 핸들러 실행 중 (미들웨어 체인 포함).
     */
    RUNNING,

    /**
     * 핸들러가 사람의 확인을 요청하여 실행이 중단된 상태.
     */
    AWAITING_APPROVAL,

    /**
     * 성공 종료.
     */
    COMPLETED,

    /**
     * 실패 종료 (WorkError 기록됨).
     */
    FAILED,

    /**
     * 취소 종료 (취소 신호 또는 승인 거절).
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED 인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
