package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.context.ContextPropagator;
import com.ryuqq.conductor.application.coordinator.Coordinator;
import com.ryuqq.conductor.application.gate.EngineGate;
import com.ryuqq.conductor.core.error.ErrorCode;
import com.ryuqq.conductor.core.error.WorkError;
import com.ryuqq.conductor.core.model.QueuedWork;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.spi.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Queue Worker Runner 구현체.
 *
 * <p>작업 큐에서 {@link QueuedWork}를 가져와 Coordinator로 실행하고, 종료 상태에 따라 큐에 응답합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * dequeue(batchSize) → [work1, work2, ...]
 *   ↓
 * For each QueuedWork:
 *   1. 직렬화된 전파 토큰 복원 (로깅/위임 전에)
 *   2. 루트 WorkUnit 구성 → coordinator.handle()
 *   3. 종료 상태 분기:
 *      - 재실행(저장된 기록 반환), COMPLETED, CANCELLED → ack
 *      - FAILED(SHUTDOWN_INTERRUPTED) → 지연 후 재게시 (다른 인스턴스가 처리)
 *      - 그 외 FAILED → dead-letter
 *   4. 처리 중 예외 → nack
 * </pre>
 *
 * <p>엔진이 새 작업을 받지 않는 동안(종료 중)에는 dequeue하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QueueWorkerRunner implements com.ryuqq.conductor.application.runtime.Runtime {

    private static final Logger log = LoggerFactory.getLogger(QueueWorkerRunner.class);

    private final WorkQueue queue;
    private final Coordinator coordinator;
    private final ContextPropagator propagator;
    private final EngineGate gate;
    private final QueueWorkerConfig config;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile boolean stopped;

    /**
     * 생성자.
     *
     * @param queue 작업 큐
     * @param coordinator Coordinator
     * @param propagator 컨텍스트 전파기
     * @param gate 엔진 게이트
     * @param config 설정
     * @param clock WorkUnit 생성 시각용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueWorkerRunner(WorkQueue queue, Coordinator coordinator, ContextPropagator propagator,
                             EngineGate gate, QueueWorkerConfig config, Clock clock) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (propagator == null) {
            throw new IllegalArgumentException("propagator cannot be null");
        }
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.queue = queue;
        this.coordinator = coordinator;
        this.propagator = propagator;
        this.gate = gate;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public int pump() {
        if (stopped) {
            throw new IllegalStateException("QueueWorkerRunner has been stopped");
        }
        if (!gate.isAccepting()) {
            return 0;
        }

        // 1. 배치 dequeue
        List<QueuedWork> batch = queue.dequeue(config.batchSize());

        // 2. 항목별 처리
        for (QueuedWork work : batch) {
            process(work);
        }
        return batch.size();
    }

    /**
     * pollingIntervalMs 간격으로 pump를 반복하는 단일 스레드 스케줄러 시작.
     */
    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("QueueWorkerRunner has been stopped");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "conductor-queue-worker");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::pumpQuietly, 0, config.pollingIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Queue worker started: batchSize={}, pollingIntervalMs={}",
            config.batchSize(), config.pollingIntervalMs());
    }

    /**
     * 스케줄러 중지. 진행 중인 pump는 끝까지 실행됩니다.
     *
     * @param timeoutMs 진행 중인 pump 대기 시간
     * @return 시간 안에 중지되면 true
     */
    public synchronized boolean stop(long timeoutMs) {
        stopped = true;
        if (scheduler == null) {
            return true;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
            return false;
        }
    }

    public boolean isStopped() {
        return stopped;
    }

    private void pumpQuietly() {
        try {
            pump();
        } catch (RuntimeException e) {
            log.error("Queue pump cycle failed", e);
        }
    }

    private void process(QueuedWork work) {
        // 1. 큐 경계를 넘어온 컨텍스트 복원
        try (ContextPropagator.Scope ignored = propagator.restore(propagator.fromMap(work.context()))) {
            WorkUnit unit = WorkUnit.builder()
                .id(work.id())
                .kind(work.kind())
                .conversationId(work.conversationId())
                .input(work.input())
                .targetHint(work.targetHint())
                .clock(clock)
                .build();

            // 2. 실행
            WorkUnit result = coordinator.handle(unit);

            // 3. 종료 상태 분기
            respond(work, unit, result);
        } catch (RuntimeException e) {
            log.error("Failed to process queued work, returning to queue: workUnitId={}", work.id(), e);
            queue.nack(work);
        }
    }

    private void respond(QueuedWork work, WorkUnit submitted, WorkUnit result) {
        if (result != submitted) {
            log.info("Duplicate delivery acknowledged: workUnitId={}, status={}", work.id(), result.getStatus());
            queue.ack(work);
            return;
        }
        switch (result.getStatus()) {
            case COMPLETED:
            case CANCELLED:
                queue.ack(work);
                return;
            case FAILED:
                WorkError error = result.getError()
                    .orElseGet(() -> WorkError.of(ErrorCode.HANDLER_FAILED, "Failed without error"));
                if (error.code() == ErrorCode.SHUTDOWN_INTERRUPTED) {
                    log.info("Queued work interrupted by shutdown, redelivering: workUnitId={}", work.id());
                    queue.ack(work);
                    queue.publish(work, config.redeliveryDelayMs());
                } else {
                    queue.deadLetter(work, error);
                }
                return;
            default:
                log.warn("Coordinator returned non-terminal work unit, returning to queue: workUnitId={}, status={}",
                    work.id(), result.getStatus());
                queue.nack(work);
        }
    }
}
