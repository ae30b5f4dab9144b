package com.ryuqq.conductor.adapter.runner.lifecycle;

/**
 * 종료 시퀀스 설정 (불변 record).
 *
 * @param propagationDelayMs unhealthy 표시 후 intake 중단까지 기다리는 시간 (0 이상)
 * @param drainTimeoutMs in-flight 작업 종료 대기 시간 (0 이상)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LifecycleConfig(long propagationDelayMs, long drainTimeoutMs) {

    public static final long DEFAULT_PROPAGATION_DELAY_MS = 5_000L;
    public static final long DEFAULT_DRAIN_TIMEOUT_MS = 30_000L;

    public LifecycleConfig {
        if (propagationDelayMs < 0) {
            throw new IllegalArgumentException("propagationDelayMs cannot be negative");
        }
        if (drainTimeoutMs < 0) {
            throw new IllegalArgumentException("drainTimeoutMs cannot be negative");
        }
    }

    /**
     * 기본 설정: 전파 지연 5초, drain 30초.
     */
    public LifecycleConfig() {
        this(DEFAULT_PROPAGATION_DELAY_MS, DEFAULT_DRAIN_TIMEOUT_MS);
    }

    public LifecycleConfig withPropagationDelayMs(long value) {
        return new LifecycleConfig(value, drainTimeoutMs);
    }

    public LifecycleConfig withDrainTimeoutMs(long value) {
        return new LifecycleConfig(propagationDelayMs, value);
    }
}
