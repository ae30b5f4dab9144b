package com.ryuqq.conductor.application.middleware;

import com.ryuqq.conductor.core.delegation.DelegationContext;
import com.ryuqq.conductor.core.model.WorkUnit;

/**
 * 미들웨어 체인으로 감싼 핸들러.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ComposedHandler {

    String handlerName();

    /**
     * 고정 순서로 체인 실행.
     *
     * @param workUnit RUNNING 상태의 WorkUnit
     * @param context 핸들러가 진입한 위임 컨텍스트
     * @return 완료된 체인 상태 (결과, 예산 초과 여부, 단계별 결과)
     * @throws Exception 중단 단계(safety-check) 실패 또는 핸들러 실패
     */
    Invocation invoke(WorkUnit workUnit, DelegationContext context) throws Exception;
}
