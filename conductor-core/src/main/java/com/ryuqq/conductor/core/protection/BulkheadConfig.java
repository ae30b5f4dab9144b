package com.ryuqq.conductor.core.protection;

/**
 * Bulkhead 설정.
 *
 * @param capacity 최대 동시 호출 수
 * @param maxWaitMs 슬롯 대기 최대 시간 (밀리초, 0이면 대기하지 않음)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BulkheadConfig(int capacity, long maxWaitMs) {

    public static final int DEFAULT_CAPACITY = 10;
    public static final long DEFAULT_MAX_WAIT_MS = 30_000L;

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException capacity가 양수가 아니거나 maxWaitMs가 음수인 경우
     */
    public BulkheadConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (maxWaitMs < 0) {
            throw new IllegalArgumentException("maxWaitMs cannot be negative");
        }
    }

    public BulkheadConfig() {
        this(DEFAULT_CAPACITY, DEFAULT_MAX_WAIT_MS);
    }
}
