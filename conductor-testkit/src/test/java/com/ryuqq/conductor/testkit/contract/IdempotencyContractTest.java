package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.adapter.inmemory.queue.InMemoryWorkQueue;
import com.ryuqq.conductor.core.error.ErrorCode;
import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.model.ConversationId;
import com.ryuqq.conductor.core.model.Payload;
import com.ryuqq.conductor.core.model.QueuedWork;
import com.ryuqq.conductor.core.model.WorkKind;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.model.WorkUnitId;
import com.ryuqq.conductor.core.statemachine.WorkStatus;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Contract Test: Idempotent Replay.
 *
 * <p>Re-running a work unit id that already reached a terminal state returns the stored record
 * without invoking the handler again, whether the repeat comes from a caller or from queue redelivery.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class IdempotencyContractTest extends AbstractEngineTest {

    private final AtomicInteger invocations = new AtomicInteger();

    private void registerCounting() {
        register("counter", (unit, ctx) -> HandlerResult.of("run #" + invocations.incrementAndGet()), "count");
    }

    private WorkUnit withId(WorkUnitId id) {
        return WorkUnit.builder()
                .id(id)
                .kind(WorkKind.USER_REQUEST)
                .conversationId(ConversationId.of("conv-idem"))
                .input(Payload.of("count me"))
                .clock(clock)
                .build();
    }

    @Test
    void testReplay_SameInstanceReturnsStoredRecord() {
        // Given
        registerCounting();
        startEngine();
        WorkUnit unit = rootUnit("count me");

        // When
        WorkUnit first = engine.coordinator().handle(unit);
        WorkUnit second = engine.coordinator().handle(unit);

        // Then
        assertSame(first, second);
        assertEquals(1, invocations.get(), "Handler must run once per work unit id");
        assertEquals(1, events.named("coordinator.replay").size());
    }

    @Test
    void testReplay_NewInstanceWithSameIdReturnsStoredRecord() {
        // Given
        registerCounting();
        startEngine();
        WorkUnitId id = WorkUnitId.generate();
        WorkUnit original = engine.coordinator().handle(withId(id));

        // When
        WorkUnit replayed = engine.coordinator().handle(withId(id));

        // Then
        assertStatus(replayed, WorkStatus.COMPLETED);
        assertOutput(replayed, "run #1");
        assertSame(original, replayed);
        assertEquals(1, invocations.get());
    }

    @Test
    void testReplay_FailedRecordIsNotRetried() {
        // Given
        register("fragile", (unit, ctx) -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("boom");
        }, "count");
        startEngine();
        WorkUnitId id = WorkUnitId.generate();
        engine.coordinator().handle(withId(id));

        // When
        WorkUnit replayed = engine.coordinator().handle(withId(id));

        // Then
        assertFailedWith(replayed, ErrorCode.HANDLER_FAILED);
        assertEquals(1, invocations.get());
    }

    // ===================================================================
    // QUEUED INTAKE
    // ===================================================================

    @Test
    void testQueue_DuplicateDeliveryRunsHandlerOnce() {
        // Given
        registerCounting();
        InMemoryWorkQueue queue = useQueue();
        startEngine();
        QueuedWork work = new QueuedWork(WorkUnitId.generate(), WorkKind.SCHEDULED_JOB,
                ConversationId.of("conv-queue"), Payload.of("count me"), null, Map.of("correlationId", "corr-q"));

        // When: the same message is delivered twice
        queue.publish(work, 0);
        queue.publish(work, 0);
        awaitCondition(() -> queue.queueSize() == 0 && queue.inFlightSize() == 0
                && workUnitStore.find(work.id()).isPresent(), 5_000, "both deliveries to be acked");

        // Then
        assertEquals(1, invocations.get());
        assertStatus(workUnitStore.find(work.id()).orElseThrow(), WorkStatus.COMPLETED);
        assertEquals(0, queue.deadLetters().size());
    }

    @Test
    void testQueue_FailedWorkIsDeadLettered() {
        // Given
        register("fragile", (unit, ctx) -> {
            throw new IllegalStateException("boom");
        }, "count");
        InMemoryWorkQueue queue = useQueue();
        startEngine();
        QueuedWork work = new QueuedWork(WorkUnitId.generate(), WorkKind.SCHEDULED_JOB,
                ConversationId.of("conv-queue"), Payload.of("count me"), null, Map.of());

        // When
        queue.publish(work, 0);
        awaitCondition(() -> queue.deadLetters().size() == 1, 5_000, "work to be dead-lettered");

        // Then
        assertEquals(ErrorCode.HANDLER_FAILED, queue.deadLetters().get(0).error().code());
        assertFailedWith(workUnitStore.find(work.id()).orElseThrow(), ErrorCode.HANDLER_FAILED);
    }
}
