package com.ryuqq.conductor.core.protection;

/**
 * Bulkhead SPI.
 *
 * <p>의존성 하나에 대한 동시 호출 수를 제한합니다. 가득 찬 경우 호출자는 설정된 시간만큼 대기하고,
 * 그 안에 슬롯을 얻지 못하면 operation을 호출하지 않고 실패합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!bulkhead.tryAcquire(config.maxWaitMs())) {
 *     throw new BulkheadTimeoutException(name, config.maxWaitMs());
 * }
 * try {
 *     return op.call();
 * } finally {
 *     bulkhead.release();
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Bulkhead {

    /**
     * 대기 없이 슬롯 획득 시도.
     *
     * @return true: 획득, false: 가득 참
     */
    boolean tryAcquire();

    /**
     * 최대 timeoutMs 동안 대기하며 슬롯 획득 시도.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return true: 획득, false: 대기 시간 초과
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean tryAcquire(long timeoutMs) throws InterruptedException;

    /**
     * 슬롯 반환. 반드시 finally 블록에서 호출해야 합니다.
     */
    void release();

    /**
     * 현재 사용 중인 슬롯 수.
     *
     * @return 동시 실행 수
     */
    int getCurrentConcurrency();

    BulkheadConfig getConfig();
}
