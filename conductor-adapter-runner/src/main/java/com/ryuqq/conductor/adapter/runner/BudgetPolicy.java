package com.ryuqq.conductor.adapter.runner;

/**
 * 예산 초과 시 형제 위임 처리 정책.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum BudgetPolicy {

    /**
     * 진행 중인 형제 위임은 끝까지 실행하고 새 위임만 거부 (기본값).
     */
    BLOCK_NEW,

    /**
     * 루트의 취소 신호를 올려 진행 중인 형제 위임까지 중단.
     */
    CANCEL_SIBLINGS
}
