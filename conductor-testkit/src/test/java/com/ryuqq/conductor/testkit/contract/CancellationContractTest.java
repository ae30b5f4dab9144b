package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.core.handler.DelegationRequest;
import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.statemachine.WorkStatus;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test: Cooperative Cancellation.
 *
 * <p>A root handler fans out two delegations on the I/O pool. Cancelling the root must reach both
 * in-flight children and suppress any delegation issued afterwards.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractEngineTest {

    @Test
    void testCancel_ReachesConcurrentChildrenAndSuppressesNewDelegations() throws Exception {
        // Given
        CountDownLatch childrenStarted = new CountDownLatch(2);
        AtomicInteger slowInvocations = new AtomicInteger();
        AtomicReference<WorkStatus> lateDelegation = new AtomicReference<>();
        register("slow", (unit, ctx) -> {
            slowInvocations.incrementAndGet();
            childrenStarted.countDown();
            long giveUp = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!ctx.isCancelled() && System.nanoTime() < giveUp) {
                Thread.sleep(5);
            }
            return HandlerResult.of("partial " + unit.getInput().asText());
        });
        register("fanout", (unit, ctx) -> {
            Future<WorkUnit> first = engine.workerPools().io().submit(
                    () -> engine.coordinator().delegate(unit, ctx, DelegationRequest.to("slow", "one")));
            Future<WorkUnit> second = engine.workerPools().io().submit(
                    () -> engine.coordinator().delegate(unit, ctx, DelegationRequest.to("slow", "two")));
            first.get(10, TimeUnit.SECONDS);
            second.get(10, TimeUnit.SECONDS);
            WorkUnit late = engine.coordinator().delegate(unit, ctx, DelegationRequest.to("slow", "three"));
            lateDelegation.set(late.getStatus());
            return HandlerResult.of("fanout done");
        }, "fanout");
        startEngine();
        WorkUnit root = rootUnit("fanout please");

        // When
        CompletableFuture<WorkUnit> running = CompletableFuture.supplyAsync(() -> engine.coordinator().handle(root));
        assertTrue(childrenStarted.await(5, TimeUnit.SECONDS), "Both children should be in flight");
        boolean accepted = engine.coordinator().cancel(root.getId(), "user abort");
        WorkUnit result = running.get(10, TimeUnit.SECONDS);

        // Then
        assertTrue(accepted, "Cancel of an in-flight root should be accepted");
        assertStatus(result, WorkStatus.CANCELLED);
        assertEquals(2, result.getChildren().size());
        result.getChildren().forEach(child -> assertStatus(child, WorkStatus.CANCELLED));
        assertEquals(WorkStatus.CANCELLED, lateDelegation.get(), "Delegation after cancel must not run");
        assertEquals(2, slowInvocations.get());
        assertEquals(1, events.named("coordinator.cancel").size());
    }

    @Test
    void testCancel_UnknownOrFinishedRootIsNotAccepted() {
        // Given
        startEngine();
        WorkUnit root = rootUnit("hello");
        engine.coordinator().handle(root);

        // When & Then
        assertFalse(engine.coordinator().cancel(root.getId(), "too late"),
                "Completed root is no longer in flight");
        assertStatus(root, WorkStatus.COMPLETED);
    }

    @Test
    void testCancel_SecondCancelDoesNotEmitAgain() throws Exception {
        // Given
        CountDownLatch started = new CountDownLatch(1);
        register("waiter", (unit, ctx) -> {
            started.countDown();
            long giveUp = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!ctx.isCancelled() && System.nanoTime() < giveUp) {
                Thread.sleep(5);
            }
            return HandlerResult.of("stopped");
        }, "wait");
        startEngine();
        WorkUnit root = rootUnit("wait for me");
        CompletableFuture<WorkUnit> running = CompletableFuture.supplyAsync(() -> engine.coordinator().handle(root));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        // When
        engine.coordinator().cancel(root.getId(), "first");
        engine.coordinator().cancel(root.getId(), "second");
        WorkUnit result = running.get(10, TimeUnit.SECONDS);

        // Then
        assertStatus(result, WorkStatus.CANCELLED);
        assertEquals(1, events.named("coordinator.cancel").size());
    }
}
