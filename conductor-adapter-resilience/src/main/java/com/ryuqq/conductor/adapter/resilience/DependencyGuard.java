package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.protection.Bulkhead;
import com.ryuqq.conductor.core.protection.CircuitBreaker;
import com.ryuqq.conductor.core.protection.TimeoutPolicy;

/**
 * 의존성 하나에 대한 보호 계층 묶음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DependencyGuard {

    private final DependencyConfig config;
    private final CircuitBreaker breaker;
    private final Bulkhead bulkhead;
    private final TimeoutPolicy timeout;
    private final BackoffCalculator backoff;
    private final TransientErrorClassifier classifier;

    DependencyGuard(DependencyConfig config, CircuitBreaker breaker, Bulkhead bulkhead, TimeoutPolicy timeout) {
        this.config = config;
        this.breaker = breaker;
        this.bulkhead = bulkhead;
        this.timeout = timeout;
        this.backoff = new BackoffCalculator(config.retry());
        this.classifier = new TransientErrorClassifier(config.retry().transientErrors());
    }

    public String name() {
        return config.name();
    }

    public DependencyConfig config() {
        return config;
    }

    public CircuitBreaker breaker() {
        return breaker;
    }

    public Bulkhead bulkhead() {
        return bulkhead;
    }

    public TimeoutPolicy timeout() {
        return timeout;
    }

    BackoffCalculator backoff() {
        return backoff;
    }

    TransientErrorClassifier classifier() {
        return classifier;
    }
}
