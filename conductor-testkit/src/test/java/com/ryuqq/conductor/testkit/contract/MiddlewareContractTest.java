package com.ryuqq.conductor.testkit.contract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.application.middleware.JsonObjectContract;
import com.ryuqq.conductor.application.routing.HandlerRegistration;
import com.ryuqq.conductor.core.error.ErrorCode;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.handler.DelegationRequest;
import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.handler.Usage;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.statemachine.WorkStatus;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test: Middleware Chain.
 *
 * <p>Every handler runs behind the same stages: safety check, state load, the handler itself,
 * cost accounting, output normalization and state save.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MiddlewareContractTest extends AbstractEngineTest {

    @Test
    void testSafety_BlockedInputNeverReachesHandler() {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        register(DEFAULT_HANDLER, (unit, ctx) -> {
            invocations.incrementAndGet();
            return HandlerResult.of("should not happen");
        });
        startEngine();

        // When
        WorkUnit result = engine.coordinator().handle(rootUnit("my password: hunter2"));

        // Then
        assertFailedWith(result, ErrorCode.BLOCKED_INPUT);
        assertEquals(0, invocations.get());
    }

    @Test
    void testState_ConversationHistoryIsLoadedOnNextTurn() {
        // Given
        AtomicReference<String> seenState = new AtomicReference<>();
        register(DEFAULT_HANDLER, (unit, ctx) -> {
            seenState.set(unit.getConversationState().asText());
            return HandlerResult.of("answer to " + unit.getInput().asText());
        });
        startEngine();
        engine.coordinator().handle(rootUnit("conv-memory", "first question"));

        // When
        WorkUnit second = engine.coordinator().handle(rootUnit("conv-memory", "second question"));

        // Then
        assertStatus(second, WorkStatus.COMPLETED);
        assertTrue(seenState.get().contains("first question"),
                "Second turn should see the first turn: " + seenState.get());
        assertTrue(stateStore.get("conversation:conv-memory").orElseThrow().contains("second question"));
    }

    @Test
    void testState_LoadFailureDoesNotOverwriteHistory() {
        // Given
        startEngine();
        engine.coordinator().handle(rootUnit("conv-flaky", "first question"));

        // When: state load fails for the second turn only
        stateStore.failNextReads(1);
        WorkUnit second = engine.coordinator().handle(rootUnit("conv-flaky", "second question"));

        // Then: handler still ran and the save appended to the stored history
        assertStatus(second, WorkStatus.COMPLETED);
        assertEquals(1, events.count("stage.state-load", EventOutcome.FAILURE));
        String stored = stateStore.get("conversation:conv-flaky").orElseThrow();
        assertTrue(stored.contains("first question"), "History lost after load failure: " + stored);
        assertTrue(stored.contains("second question"), stored);
    }

    @Test
    void testState_DelegatedTurnsAreKeptByParentSave() {
        // Given: the parent handler delegates within the same conversation
        register("worker", (unit, ctx) -> HandlerResult.of("worked"), "work");
        register(DEFAULT_HANDLER, (unit, ctx) -> {
            engine.coordinator().delegate(unit, ctx, DelegationRequest.to("worker", "work item"));
            return HandlerResult.of("parent done");
        });
        startEngine();

        // When
        WorkUnit result = engine.coordinator().handle(rootUnit("conv-tree", "plan"));

        // Then
        assertStatus(result, WorkStatus.COMPLETED);
        String stored = stateStore.get("conversation:conv-tree").orElseThrow();
        assertTrue(stored.contains("work item"), "Child turn lost: " + stored);
        assertTrue(stored.contains("plan"), stored);
    }

    @Test
    void testCost_RecordedForEveryWorkUnit() {
        // Given
        register(DEFAULT_HANDLER, (unit, ctx) -> HandlerResult.of("priced", Usage.ofCost(3)));
        startEngine();

        // When
        WorkUnit result = engine.coordinator().handle(rootUnit("how much?"));

        // Then
        String record = costStore.get("cost:" + result.getId().getValue()).orElseThrow();
        assertTrue(record.contains("\"handler\":\"" + DEFAULT_HANDLER + "\""), record);
        assertEquals(0, result.getCost().compareTo(java.math.BigDecimal.valueOf(3)));
    }

    @Test
    void testOutputNormalization_ContractViolationKeepsRawOutput() {
        // Given
        handlers.register(HandlerRegistration.of("structured", (unit, ctx) -> HandlerResult.of("not json"), "report")
                .withContract(new JsonObjectContract(new ObjectMapper(), Set.of("summary"))));
        startEngine();

        // When
        WorkUnit result = engine.coordinator().handle(rootUnit("report please"));

        // Then: non-conformance is recorded, not fatal
        assertStatus(result, WorkStatus.COMPLETED);
        assertOutput(result, "not json");
        assertEquals(1, events.count("stage.output-normalization", EventOutcome.FAILURE));
    }

    @Test
    void testOutputNormalization_ValidJsonIsNormalized() {
        // Given
        handlers.register(HandlerRegistration.of("structured",
                        (unit, ctx) -> HandlerResult.of("  {\"summary\": \"ok\"}  "), "report")
                .withContract(new JsonObjectContract(new ObjectMapper(), Set.of("summary"))));
        startEngine();

        // When
        WorkUnit result = engine.coordinator().handle(rootUnit("report please"));

        // Then
        assertStatus(result, WorkStatus.COMPLETED);
        assertOutput(result, "{\"summary\":\"ok\"}");
    }
}
