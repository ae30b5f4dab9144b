package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.error.WorkError;
import com.ryuqq.conductor.core.model.QueuedWork;

import java.util.List;

/**
 * 큐 기반 작업 접수 SPI.
 *
 * <p>큐 경계를 넘으면 상관관계 컨텍스트가 자동 전파되지 않으므로 {@link QueuedWork#context()}에
 * 직렬화된 전파 토큰을 담아야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkQueue {

    /**
     * 작업 발행.
     *
     * @param work 큐에 넣을 작업
     * @param delayMs 지연 시간 (0이면 즉시)
     */
    void publish(QueuedWork work, long delayMs);

    /**
     * 처리 가능한 작업을 최대 batchSize개 꺼냄. 꺼낸 작업은 ack/nack 전까지 in-flight입니다.
     *
     * @param batchSize 최대 개수
     * @return 작업 목록 (없으면 빈 리스트)
     */
    List<QueuedWork> dequeue(int batchSize);

    void ack(QueuedWork work);

    /**
     * 처리 실패. 작업은 다시 큐에 들어갑니다.
     *
     * @param work 실패한 작업
     */
    void nack(QueuedWork work);

    void deadLetter(QueuedWork work, WorkError error);
}
