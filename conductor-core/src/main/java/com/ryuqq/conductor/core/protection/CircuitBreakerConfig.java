package com.ryuqq.conductor.core.protection;

/**
 * Circuit Breaker 설정.
 *
 * @param failureThreshold OPEN으로 전이하는 연속 실패 수
 * @param openDurationMs OPEN 유지 시간 (밀리초)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(int failureThreshold, long openDurationMs) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_OPEN_DURATION_MS = 30_000L;

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException failureThreshold 또는 openDurationMs가 양수가 아닌 경우
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (openDurationMs <= 0) {
            throw new IllegalArgumentException("openDurationMs must be positive");
        }
    }

    public CircuitBreakerConfig() {
        this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_OPEN_DURATION_MS);
    }
}
