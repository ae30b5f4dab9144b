package com.ryuqq.conductor.core.protection;

/**
 * {@link CircuitBreaker#tryAcquire()}의 결과.
 *
 * <p>결과 기록 시 같은 값을 되돌려 주어야 합니다. HALF_OPEN에서 얻은 {@link #TRIAL}만
 * 회로를 닫거나 다시 열 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CallPermission {

    /** 회로가 열려 있어 호출 금지. */
    DENIED,

    /** CLOSED 상태의 일반 호출. */
    PERMITTED,

    /** HALF_OPEN 상태의 단일 시험 호출. */
    TRIAL;

    public boolean isGranted() {
        return this != DENIED;
    }
}
