package com.ryuqq.conductor.adapter.runner;

/**
 * QueueWorkerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: 큐 폴링 간격 (기본 100ms)</li>
 *   <li>batchSize: 한 번에 dequeue할 항목 수 (기본 10)</li>
 *   <li>redeliveryDelayMs: 종료로 처리하지 못한 항목의 재게시 지연 (기본 1000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝:</strong> 낮은 지연이 필요하면 pollingIntervalMs와 batchSize를 줄입니다.
 * 처리량은 batchSize보다 handler용 {@code WorkerPools} 크기에 좌우됩니다.</p>
 *
 * @param pollingIntervalMs 큐 폴링 간격 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 * @param redeliveryDelayMs 재게시 지연 (밀리초, 0 이상)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueueWorkerConfig(
    long pollingIntervalMs,
    int batchSize,
    long redeliveryDelayMs
) {

    /**
     * 기본 설정: 100ms 폴링, 배치 10, 재게시 지연 1초.
     */
    public QueueWorkerConfig() {
        this(100, 10, 1_000);
    }

    public QueueWorkerConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (redeliveryDelayMs < 0) {
            throw new IllegalArgumentException(
                "redeliveryDelayMs cannot be negative (current: " + redeliveryDelayMs + ")"
            );
        }
    }

    public QueueWorkerConfig withBatchSize(int value) {
        return new QueueWorkerConfig(pollingIntervalMs, value, redeliveryDelayMs);
    }

    public QueueWorkerConfig withPollingIntervalMs(long value) {
        return new QueueWorkerConfig(value, batchSize, redeliveryDelayMs);
    }

    public QueueWorkerConfig withRedeliveryDelayMs(long value) {
        return new QueueWorkerConfig(pollingIntervalMs, batchSize, value);
    }
}
