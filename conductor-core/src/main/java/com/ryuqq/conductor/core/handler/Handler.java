package com.ryuqq.conductor.core.handler;

import com.ryuqq.conductor.core.delegation.DelegationContext;
import com.ryuqq.conductor.core.model.WorkUnit;

/**
 * 업무 로직 핸들러 SPI.
 *
 * <p>Coordinator가 Middleware Chain 안에서 호출합니다. 외부 시스템 호출은 반드시
 * {@link com.ryuqq.conductor.core.spi.ResilientCaller}를 거쳐야 하며, 재시도될 수 있으므로
 * 그 안의 호출은 멱등이어야 합니다.</p>
 *
 * <p><strong>예외 처리:</strong> 던져진 예외는 Coordinator가 잡아 WorkUnit을 FAILED로 기록합니다.
 * {@link com.ryuqq.conductor.core.error.ConductorException}이면 그 코드가, 아니면 HANDLER_FAILED가 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Handler {

    /**
     * 작업 실행.
     *
     * @param workUnit 실행 중인 WorkUnit (RUNNING 상태)
     * @param context 이 핸들러가 포함된 위임 컨텍스트
     * @return 실행 결과
     * @throws Exception 핸들러 실패
     */
    HandlerResult handle(WorkUnit workUnit, DelegationContext context) throws Exception;
}
