package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.protection.TimeoutPolicy;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 고정 시도당 타임아웃.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FixedTimeoutPolicy implements TimeoutPolicy {

    private final long attemptTimeoutMs;
    private final AtomicLong timeouts = new AtomicLong();

    public FixedTimeoutPolicy(long attemptTimeoutMs) {
        if (attemptTimeoutMs < 0) {
            throw new IllegalArgumentException("attemptTimeoutMs cannot be negative");
        }
        this.attemptTimeoutMs = attemptTimeoutMs;
    }

    @Override
    public long getAttemptTimeoutMs() {
        return attemptTimeoutMs;
    }

    @Override
    public void recordTimeout(long elapsedMs) {
        timeouts.incrementAndGet();
    }

    @Override
    public long getTimeoutCount() {
        return timeouts.get();
    }
}
