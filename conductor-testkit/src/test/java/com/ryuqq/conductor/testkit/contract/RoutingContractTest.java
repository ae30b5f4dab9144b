package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.model.ConversationId;
import com.ryuqq.conductor.core.model.Payload;
import com.ryuqq.conductor.core.model.WorkKind;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.statemachine.WorkStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Contract Test: Handler Routing.
 *
 * <p>Deterministic rules are tried in order: target hint, keyword, then the configured
 * handler for the work kind. Unmatched work falls back to the default handler.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RoutingContractTest extends AbstractEngineTest {

    private WorkUnit scheduledJob(String input) {
        return WorkUnit.root(WorkKind.SCHEDULED_JOB, ConversationId.of("conv-routing"), Payload.of(input), clock);
    }

    @Test
    void testRouting_WorkKindMappingSelectsHandler() {
        // Given
        properties.getRouting().getKinds().put(WorkKind.SCHEDULED_JOB.name(), "scheduler");
        register("scheduler", (unit, ctx) -> HandlerResult.of("scheduled"));
        startEngine();

        // When
        WorkUnit result = engine.coordinator().handle(scheduledJob("nightly cleanup"));

        // Then
        assertStatus(result, WorkStatus.COMPLETED);
        assertEquals("scheduler", result.getHandlerName().orElseThrow());
        assertEquals("kind", events.named("coordinator.route").get(0).attribute("source"));
    }

    @Test
    void testRouting_KeywordMatchTakesPrecedenceOverWorkKind() {
        // Given
        properties.getRouting().getKinds().put(WorkKind.SCHEDULED_JOB.name(), "scheduler");
        register("scheduler", (unit, ctx) -> HandlerResult.of("scheduled"));
        register("billing", (unit, ctx) -> HandlerResult.of("billed"), "invoice");
        startEngine();

        // When
        WorkUnit result = engine.coordinator().handle(scheduledJob("monthly invoice run"));

        // Then
        assertEquals("billing", result.getHandlerName().orElseThrow());
    }

    @Test
    void testRouting_UnmappedKindFallsBackToDefaultHandler() {
        // Given
        properties.getRouting().getKinds().put(WorkKind.SCHEDULED_JOB.name(), "scheduler");
        register("scheduler", (unit, ctx) -> HandlerResult.of("scheduled"));
        startEngine();

        // When
        WorkUnit result = engine.coordinator().handle(rootUnit("hello there"));

        // Then
        assertEquals(DEFAULT_HANDLER, result.getHandlerName().orElseThrow());
    }
}
