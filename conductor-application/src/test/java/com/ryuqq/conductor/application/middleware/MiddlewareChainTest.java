package com.ryuqq.conductor.application.middleware;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.application.support.DirectCaller;
import com.ryuqq.conductor.application.support.RecordingSink;
import com.ryuqq.conductor.application.support.Units;
import com.ryuqq.conductor.core.delegation.DelegationContext;
import com.ryuqq.conductor.core.error.BlockedInputException;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.handler.Usage;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.spi.KeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MiddlewareChain 단위 테스트.
 */
@ExtendWith(MockitoExtension.class)
class MiddlewareChainTest {

    @Mock
    private KeyValueStore stateStore;

    @Mock
    private KeyValueStore costStore;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DirectCaller caller = new DirectCaller();
    private final RecordingSink sink = new RecordingSink();
    private MiddlewareChain chain;

    @BeforeEach
    void setUp() {
        chain = new MiddlewareChain(
            new SafetyCheckStage(List.of(SafetyRule.of("secrets", "password"))),
            new StateLoadStage(stateStore, caller, objectMapper),
            new CostAccountingStage(costStore, caller, objectMapper),
            new OutputNormalizationStage(name -> name.equals("json")
                ? new JsonObjectContract(objectMapper, Set.of("answer"))
                : null),
            new StateSaveStage(stateStore, caller, objectMapper, Units.CLOCK, 10),
            sink
        );
    }

    private static List<String> stageNames(Invocation invocation) {
        return invocation.outcomes().stream().map(MiddlewareOutcome::stageName).collect(Collectors.toList());
    }

    // ==================== 순서 ====================

    @Test
    void stageNames_고정_순서() {
        assertThat(chain.stageNames()).containsExactly(
            "safety-check", "state-load", "handler", "cost-accounting", "output-normalization", "state-save");
    }

    @Test
    void invoke_정상_실행_시_모든_단계가_한_번씩_순서대로_실행된다() throws Exception {
        // given
        WorkUnit unit = Units.running("hello");
        DelegationContext context = Units.context(unit, 100);
        when(stateStore.get("conversation:conv-1")).thenReturn(Optional.empty());

        // when
        Invocation invocation = chain.compose("echo", (u, c) -> HandlerResult.of("hi", Usage.ofCost(3)))
            .invoke(unit, context);

        // then
        assertThat(stageNames(invocation)).containsExactly(
            "safety-check", "state-load", "handler", "cost-accounting", "output-normalization", "state-save");
        assertThat(invocation.outcomes()).allMatch(MiddlewareOutcome::success);
        assertThat(invocation.result().output().asText()).isEqualTo("hi");
        assertThat(caller.calls()).containsExactly("state-store", "cost-store", "state-store");
        verify(stateStore).put(eq("conversation:conv-1"), anyString());
        verify(costStore).put(eq("cost:" + unit.getId().getValue()), anyString());
        assertThat(sink.named("stage.state-save")).hasSize(1);
    }

    // ==================== safety-check ====================

    @Test
    void invoke_차단_입력_시_핸들러_실행_없이_BlockedInput_전파() {
        // given
        WorkUnit unit = Units.running("my PASSWORD is 1234");
        AtomicInteger handlerCalls = new AtomicInteger();
        ComposedHandler composed = chain.compose("echo", (u, c) -> {
            handlerCalls.incrementAndGet();
            return HandlerResult.of("never");
        });

        // when & then
        assertThatThrownBy(() -> composed.invoke(unit, Units.context(unit, 100)))
            .isInstanceOf(BlockedInputException.class);
        assertThat(handlerCalls).hasValue(0);
        assertThat(caller.calls()).isEmpty();
        assertThat(sink.named("stage.safety-check").get(0).outcome()).isEqualTo(EventOutcome.REJECTED);
        assertThat(sink.named("stage.state-save").get(0).outcome()).isEqualTo(EventOutcome.SKIPPED);
    }

    // ==================== 비중단 단계 ====================

    @Test
    void invoke_state_load_실패_시_빈_컨텍스트로_계속_진행() throws Exception {
        // given
        WorkUnit unit = Units.running("hello");
        when(stateStore.get(anyString())).thenThrow(new IllegalStateException("store down"));

        // when
        Invocation invocation = chain.compose("echo", (u, c) -> HandlerResult.of("ok"))
            .invoke(unit, Units.context(unit, 100));

        // then
        assertThat(invocation.outcomes().get(1).success()).isFalse();
        assertThat(invocation.outcomes().get(2).stageName()).isEqualTo("handler");
        assertThat(invocation.result().output().asText()).isEqualTo("ok");
        assertThat(sink.named("stage.state-load").get(0).outcome()).isEqualTo(EventOutcome.FAILURE);
    }

    @Test
    void invoke_state_save_실패해도_결과는_유지된다() throws Exception {
        // given
        WorkUnit unit = Units.running("hello");
        when(stateStore.get(anyString())).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("write failed")).when(stateStore).put(anyString(), anyString());

        // when
        Invocation invocation = chain.compose("echo", (u, c) -> HandlerResult.of("kept"))
            .invoke(unit, Units.context(unit, 100));

        // then
        assertThat(invocation.result().output().asText()).isEqualTo("kept");
        MiddlewareOutcome last = invocation.outcomes().get(invocation.outcomes().size() - 1);
        assertThat(last.stageName()).isEqualTo("state-save");
        assertThat(last.success()).isFalse();
    }

    @Test
    void invoke_출력_계약_위반_시_원본_출력을_유지한다() throws Exception {
        // given
        WorkUnit unit = Units.running("hello");
        when(stateStore.get(anyString())).thenReturn(Optional.empty());

        // when
        Invocation invocation = chain.compose("json", (u, c) -> HandlerResult.of("{\"other\":1}"))
            .invoke(unit, Units.context(unit, 100));

        // then
        assertThat(invocation.result().output().asText()).isEqualTo("{\"other\":1}");
        assertThat(sink.named("stage.output-normalization").get(0).outcome()).isEqualTo(EventOutcome.FAILURE);
    }

    @Test
    void invoke_출력_계약_만족_시_정규화된_출력으로_교체() throws Exception {
        // given
        WorkUnit unit = Units.running("hello");
        when(stateStore.get(anyString())).thenReturn(Optional.empty());

        // when
        Invocation invocation = chain.compose("json", (u, c) -> HandlerResult.of("{ \"answer\" : 42 }"))
            .invoke(unit, Units.context(unit, 100));

        // then
        assertThat(invocation.result().output().asText()).isEqualTo("{\"answer\":42}");
    }

    // ==================== 핸들러 실패 ====================

    @Test
    void invoke_핸들러_예외_시_after_단계는_SKIPPED로_기록되고_예외_전파() {
        // given
        WorkUnit unit = Units.running("hello");
        when(stateStore.get(anyString())).thenReturn(Optional.empty());
        ComposedHandler composed = chain.compose("broken", (u, c) -> {
            throw new IllegalStateException("boom");
        });

        // when & then
        assertThatThrownBy(() -> composed.invoke(unit, Units.context(unit, 100)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");
        verify(costStore, never()).put(anyString(), anyString());
        assertThat(sink.named("stage.cost-accounting").get(0).outcome()).isEqualTo(EventOutcome.SKIPPED);
        assertThat(sink.named("handler.execute").get(0).outcome()).isEqualTo(EventOutcome.FAILURE);
    }

    // ==================== 예산 ====================

    @Test
    void invoke_비용이_예산을_넘으면_budgetExceeded_표시() throws Exception {
        // given
        WorkUnit unit = Units.running("hello");
        DelegationContext context = Units.context(unit, 10);
        when(stateStore.get(anyString())).thenReturn(Optional.empty());

        // when
        Invocation invocation = chain.compose("costly", (u, c) -> HandlerResult.of("x", Usage.ofCost(11)))
            .invoke(unit, context);

        // then
        assertThat(invocation.isBudgetExceeded()).isTrue();
        assertThat(unit.getCost()).isEqualByComparingTo(BigDecimal.valueOf(11));
        assertThat(context.budgetRemaining()).isEqualByComparingTo(BigDecimal.valueOf(-1));
    }

    // ==================== 생성 검증 ====================

    @Test
    void 생성자_단계_phase가_맞지_않으면_예외() {
        Stage save = new StateSaveStage(stateStore, caller, objectMapper, Units.CLOCK, 10);

        assertThatThrownBy(() -> new MiddlewareChain(save, save, save, save, save, sink))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must run BEFORE");
    }
}
