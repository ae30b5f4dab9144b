package com.ryuqq.conductor.application.middleware;

/**
 * 미들웨어 단계가 핸들러 실행 전/후 중 어디에 위치하는지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StagePhase {
    BEFORE,
    AFTER
}
