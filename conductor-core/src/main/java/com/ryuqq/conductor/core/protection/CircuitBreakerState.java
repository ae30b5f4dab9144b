package com.ryuqq.conductor.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN: 연속 실패가 임계값에 도달</li>
 *   <li>OPEN → HALF_OPEN: open 유지 시간 경과 후 첫 호출</li>
 *   <li>HALF_OPEN → CLOSED: 시험 호출 성공</li>
 *   <li>HALF_OPEN → OPEN: 시험 호출 실패 (open 시각 재설정)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태. 모든 호출을 통과시키고 연속 실패 수를 센다.
     */
    CLOSED,

    /**
     * 차단 상태. operation을 호출하지 않고 즉시 실패한다.
     */
    OPEN,

    /**
     * 복구 확인 상태. 단 하나의 시험 호출만 통과시킨다.
     */
    HALF_OPEN
}
