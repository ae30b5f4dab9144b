package com.ryuqq.conductor.adapter.inmemory.queue;

import com.ryuqq.conductor.core.error.WorkError;
import com.ryuqq.conductor.core.model.QueuedWork;
import com.ryuqq.conductor.core.model.WorkUnitId;
import com.ryuqq.conductor.core.spi.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * In-Memory WorkQueue 구현체.
 *
 * <p>테스트 및 단일 프로세스 실행용 메모리 기반 큐입니다.</p>
 *
 * <p><strong>주요 기능:</strong></p>
 * <ul>
 *   <li>지연 발행: DelayQueue 기반</li>
 *   <li>Visibility Timeout: dequeue 후 ack/nack 전까지 in-flight로 유지, 만료 시 재발행</li>
 *   <li>Dead Letter: 재시도하지 않을 작업을 실패 사유와 함께 보관</li>
 * </ul>
 *
 * <p><strong>경계:</strong> 큐를 건너는 작업은 메모리를 공유하지 않는 것으로 취급합니다. 호출자는
 * 전파 컨텍스트를 {@link QueuedWork#context()}에 명시적으로 담아야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryWorkQueue implements WorkQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkQueue.class);

    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    private final DelayQueue<DelayedWork> queue = new DelayQueue<>();
    private final Map<WorkUnitId, InFlightWork> inFlight = new ConcurrentHashMap<>();
    private final List<DeadLetter> deadLetters = new CopyOnWriteArrayList<>();
    private final long visibilityTimeoutMs;

    public InMemoryWorkQueue() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    public InMemoryWorkQueue(long visibilityTimeoutMs) {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutMs must be positive, but was: " + visibilityTimeoutMs);
        }
        this.visibilityTimeoutMs = visibilityTimeoutMs;
    }

    @Override
    public void publish(QueuedWork work, long delayMs) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        queue.put(new DelayedWork(work, delayMs));
    }

    @Override
    public List<QueuedWork> dequeue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }
        List<QueuedWork> result = new ArrayList<>();
        long now = System.currentTimeMillis();
        for (int i = 0; i < batchSize; i++) {
            DelayedWork delayed = queue.poll();
            if (delayed == null) {
                break;
            }
            inFlight.put(delayed.work.id(), new InFlightWork(delayed.work, now + visibilityTimeoutMs));
            result.add(delayed.work);
        }
        return result;
    }

    @Override
    public void ack(QueuedWork work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        inFlight.remove(work.id());
    }

    @Override
    public void nack(QueuedWork work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        inFlight.remove(work.id());
        publish(work, 0);
    }

    @Override
    public void deadLetter(QueuedWork work, WorkError error) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        inFlight.remove(work.id());
        deadLetters.add(new DeadLetter(work, error, System.currentTimeMillis()));
        log.warn("Work dead-lettered: workUnitId={}, code={}", work.id(), error.code().code());
    }

    /**
     * Visibility Timeout이 지난 in-flight 작업을 재발행.
     *
     * @return 재발행된 작업 수
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        List<WorkUnitId> expired = new ArrayList<>();
        for (Map.Entry<WorkUnitId, InFlightWork> entry : inFlight.entrySet()) {
            if (entry.getValue().visibleAt <= now) {
                expired.add(entry.getKey());
            }
        }
        int count = 0;
        for (WorkUnitId id : expired) {
            InFlightWork removed = inFlight.remove(id);
            if (removed != null) {
                publish(removed.work, 0);
                count++;
            }
        }
        return count;
    }

    public int queueSize() {
        return queue.size();
    }

    public int inFlightSize() {
        return inFlight.size();
    }

    public List<DeadLetter> deadLetters() {
        return new ArrayList<>(deadLetters);
    }

    public void clear() {
        queue.clear();
        inFlight.clear();
        deadLetters.clear();
    }

    /**
     * Dead letter 항목.
     *
     * @param work 원본 작업
     * @param error 실패 사유
     * @param timestamp 기록 시각 (epoch millis)
     */
    public record DeadLetter(QueuedWork work, WorkError error, long timestamp) {
    }

    private static final class DelayedWork implements Delayed {

        private final QueuedWork work;
        private final long availableAt;

        private DelayedWork(QueuedWork work, long delayMs) {
            this.work = work;
            this.availableAt = System.currentTimeMillis() + delayMs;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(availableAt - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    private static final class InFlightWork {

        private final QueuedWork work;
        private final long visibleAt;

        private InFlightWork(QueuedWork work, long visibleAt) {
            this.work = work;
            this.visibleAt = visibleAt;
        }
    }
}
