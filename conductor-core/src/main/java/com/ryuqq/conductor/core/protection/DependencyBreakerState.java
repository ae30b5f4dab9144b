package com.ryuqq.conductor.core.protection;

import java.time.Instant;

/**
 * 의존성 Circuit Breaker의 상태 스냅샷.
 *
 * @param dependencyName 의존성 이름
 * @param state 현재 상태
 * @param consecutiveFailures 연속 실패 수
 * @param openedAt 마지막으로 OPEN이 된 시각 (CLOSED이면 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DependencyBreakerState(
    String dependencyName,
    CircuitBreakerState state,
    int consecutiveFailures,
    Instant openedAt
) {

    public DependencyBreakerState {
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependencyName cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures cannot be negative");
        }
    }
}
