package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.core.error.ErrorCode;
import com.ryuqq.conductor.core.handler.DelegationRequest;
import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.handler.Usage;
import com.ryuqq.conductor.core.model.ConversationId;
import com.ryuqq.conductor.core.model.Payload;
import com.ryuqq.conductor.core.model.WorkKind;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.model.WorkUnitId;
import com.ryuqq.conductor.core.statemachine.WorkStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test: Recursive Delegation Boundaries.
 *
 * <p>Validates that depth, cycle and budget limits reject only the offending delegation,
 * leaving the work already done by ancestors intact.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Depth: with maxDepth 3, A → B → C → D rejects D</li>
 *   <li>Cycle: A → B → A rejects the second A</li>
 *   <li>Budget: limit 10, costs 4 and 7 fail the second unit</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DelegationContractTest extends AbstractEngineTest {

    private WorkUnit rootFor(String handler) {
        return WorkUnit.builder()
                .id(WorkUnitId.generate())
                .kind(WorkKind.USER_REQUEST)
                .conversationId(ConversationId.of("conv-delegation"))
                .input(Payload.of("start"))
                .targetHint(handler)
                .clock(clock)
                .build();
    }

    private static WorkUnit onlyChild(WorkUnit parent) {
        assertEquals(1, parent.getChildren().size(), "Expected exactly one child of " + parent);
        return parent.getChildren().get(0);
    }

    private static HandlerResult delegateTo(String output, String target) {
        return HandlerResult.delegating(output, Usage.none(), DelegationRequest.to(target, "from " + output));
    }

    // ===================================================================
    // DEPTH
    // ===================================================================

    @Test
    void testDepth_FourthLevelIsRejectedAndAncestorsKeepOutputs() {
        // Given: maxDepth 3
        AtomicInteger dInvocations = new AtomicInteger();
        register("a", (unit, ctx) -> delegateTo("out-a", "b"));
        register("b", (unit, ctx) -> delegateTo("out-b", "c"));
        register("c", (unit, ctx) -> delegateTo("out-c", "d"));
        register("d", (unit, ctx) -> {
            dInvocations.incrementAndGet();
            return HandlerResult.of("out-d");
        });
        startEngine();

        // When
        WorkUnit a = engine.coordinator().handle(rootFor("a"));

        // Then
        WorkUnit b = onlyChild(a);
        WorkUnit c = onlyChild(b);
        WorkUnit d = onlyChild(c);
        assertStatus(a, WorkStatus.COMPLETED);
        assertStatus(b, WorkStatus.COMPLETED);
        assertStatus(c, WorkStatus.COMPLETED);
        assertOutput(a, "out-a");
        assertOutput(b, "out-b");
        assertOutput(c, "out-c");
        assertFailedWith(d, ErrorCode.DELEGATION_DEPTH_EXCEEDED);
        assertEquals(0, dInvocations.get(), "Rejected unit must not run its handler");
        assertTrue(d.getHandlerName().isEmpty(), "Depth is checked before routing");
    }

    @Test
    void testDepth_DepthLimitAppliesPerConfiguration() {
        // Given: maxDepth 1 permits only the root handler
        properties.getEngine().setMaxDepth(1);
        register("a", (unit, ctx) -> delegateTo("out-a", "b"));
        register("b", (unit, ctx) -> HandlerResult.of("out-b"));
        startEngine();

        // When
        WorkUnit a = engine.coordinator().handle(rootFor("a"));

        // Then
        assertStatus(a, WorkStatus.COMPLETED);
        assertFailedWith(onlyChild(a), ErrorCode.DELEGATION_DEPTH_EXCEEDED);
    }

    // ===================================================================
    // CYCLE
    // ===================================================================

    @Test
    void testCycle_RevisitingHandlerOnPathIsRejected() {
        // Given
        AtomicInteger aInvocations = new AtomicInteger();
        register("a", (unit, ctx) -> {
            aInvocations.incrementAndGet();
            return delegateTo("out-a", "b");
        });
        register("b", (unit, ctx) -> delegateTo("out-b", "a"));
        startEngine();

        // When
        WorkUnit a = engine.coordinator().handle(rootFor("a"));

        // Then
        WorkUnit b = onlyChild(a);
        WorkUnit secondA = onlyChild(b);
        assertStatus(a, WorkStatus.COMPLETED);
        assertStatus(b, WorkStatus.COMPLETED);
        assertFailedWith(secondA, ErrorCode.DELEGATION_CYCLE_DETECTED);
        assertEquals(1, aInvocations.get());
        assertEquals(1, events.named("coordinator.rejected").size());
    }

    @Test
    void testCycle_SameHandlerOnSiblingBranchesIsAllowed() {
        // Given: a delegates to b, b to c; c is not on a's path twice
        register("a", (unit, ctx) -> delegateTo("out-a", "b"));
        register("b", (unit, ctx) -> delegateTo("out-b", "c"));
        register("c", (unit, ctx) -> HandlerResult.of("out-c"));
        startEngine();

        // When
        WorkUnit first = engine.coordinator().handle(rootFor("a"));
        WorkUnit second = engine.coordinator().handle(rootFor("a"));

        // Then: each root has its own path
        assertStatus(first, WorkStatus.COMPLETED);
        assertStatus(second, WorkStatus.COMPLETED);
        assertStatus(onlyChild(onlyChild(second)), WorkStatus.COMPLETED);
    }

    // ===================================================================
    // BUDGET
    // ===================================================================

    @Test
    void testBudget_SecondUnitExceedingLimitFails() {
        // Given: budget 10, costs 4 and 7
        properties.getEngine().setDefaultBudget(10.0);
        register("a", (unit, ctx) -> HandlerResult.delegating("out-a", Usage.ofCost(4), DelegationRequest.to("b", "go")));
        register("b", (unit, ctx) -> HandlerResult.of("out-b", Usage.ofCost(7)));
        startEngine();

        // When
        WorkUnit a = engine.coordinator().handle(rootFor("a"));

        // Then
        WorkUnit b = onlyChild(a);
        assertStatus(a, WorkStatus.COMPLETED);
        assertFailedWith(b, ErrorCode.BUDGET_EXCEEDED);
        assertEquals(0, new BigDecimal("11").compareTo(a.getSubtreeCost()),
                "Both units' costs are recorded: " + a.getSubtreeCost());
        assertTrue(costStore.get("cost:" + b.getId().getValue()).isPresent(),
                "Cost of the rejected unit is still accounted");
    }

    @Test
    void testBudget_CancelSiblingsPolicyCancelsTree() {
        // Given
        properties.getEngine().setDefaultBudget(10.0);
        properties.getEngine().setBudgetExceededPolicy("CANCEL_SIBLINGS");
        register("a", (unit, ctx) -> HandlerResult.delegating("out-a", Usage.ofCost(4), DelegationRequest.to("b", "go")));
        register("b", (unit, ctx) -> HandlerResult.of("out-b", Usage.ofCost(7)));
        startEngine();

        // When
        WorkUnit a = engine.coordinator().handle(rootFor("a"));

        // Then
        assertFailedWith(onlyChild(a), ErrorCode.BUDGET_EXCEEDED);
        assertStatus(a, WorkStatus.CANCELLED);
    }

    @Test
    void testBudget_WithinLimitCompletesWholeTree() {
        // Given
        properties.getEngine().setDefaultBudget(10.0);
        register("a", (unit, ctx) -> HandlerResult.delegating("out-a", Usage.ofCost(4), DelegationRequest.to("b", "go")));
        register("b", (unit, ctx) -> HandlerResult.of("out-b", Usage.ofCost(6)));
        startEngine();

        // When
        WorkUnit a = engine.coordinator().handle(rootFor("a"));

        // Then: reaching the limit exactly is allowed
        assertStatus(a, WorkStatus.COMPLETED);
        assertStatus(onlyChild(a), WorkStatus.COMPLETED);
    }
}
