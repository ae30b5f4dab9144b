package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.protection.BulkheadConfig;
import com.ryuqq.conductor.core.protection.CircuitBreakerConfig;

/**
 * 외부 의존성 하나의 resilience 설정.
 *
 * @param name 의존성 이름
 * @param breaker Circuit Breaker 설정
 * @param retry 재시도 설정
 * @param bulkhead Bulkhead 설정
 * @param attemptTimeoutMs 시도당 타임아웃 (밀리초, 0이면 호출 스레드에서 제한 없이 실행)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DependencyConfig(
    String name,
    CircuitBreakerConfig breaker,
    RetryConfig retry,
    BulkheadConfig bulkhead,
    long attemptTimeoutMs
) {

    public static final long DEFAULT_ATTEMPT_TIMEOUT_MS = 10_000L;

    public DependencyConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (bulkhead == null) {
            throw new IllegalArgumentException("bulkhead cannot be null");
        }
        if (attemptTimeoutMs < 0) {
            throw new IllegalArgumentException("attemptTimeoutMs cannot be negative");
        }
    }

    /**
     * 기본값 설정.
     *
     * @param name 의존성 이름
     * @return 기본 설정
     */
    public static DependencyConfig defaults(String name) {
        return new DependencyConfig(name, new CircuitBreakerConfig(), new RetryConfig(), new BulkheadConfig(),
            DEFAULT_ATTEMPT_TIMEOUT_MS);
    }

    public DependencyConfig withBreaker(CircuitBreakerConfig value) {
        return new DependencyConfig(name, value, retry, bulkhead, attemptTimeoutMs);
    }

    public DependencyConfig withRetry(RetryConfig value) {
        return new DependencyConfig(name, breaker, value, bulkhead, attemptTimeoutMs);
    }

    public DependencyConfig withBulkhead(BulkheadConfig value) {
        return new DependencyConfig(name, breaker, retry, value, attemptTimeoutMs);
    }

    public DependencyConfig withAttemptTimeoutMs(long value) {
        return new DependencyConfig(name, breaker, retry, bulkhead, value);
    }
}
