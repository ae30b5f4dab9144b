package com.ryuqq.conductor.application.middleware;

/**
 * 수평(cross-cutting) 미들웨어 단계.
 *
 * <p>단계가 던진 예외는 {@link #abortsOnFailure()}가 true일 때만 WorkUnit 실행을 중단시킵니다.
 * 그 외에는 {@link MiddlewareChain}이 로그를 남기고 다음 단계로 진행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Stage {

    String name();

    StagePhase phase();

    /**
     * 단계 실행.
     *
     * @param invocation 현재 핸들러 실행
     * @throws Exception 단계 실패
     */
    void apply(Invocation invocation) throws Exception;

    default boolean abortsOnFailure() {
        return false;
    }
}
