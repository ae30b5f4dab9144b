package com.ryuqq.conductor.application.routing;

import com.ryuqq.conductor.application.support.DirectCaller;
import com.ryuqq.conductor.application.support.RecordingSink;
import com.ryuqq.conductor.application.support.Units;
import com.ryuqq.conductor.core.handler.Handler;
import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.model.ConversationId;
import com.ryuqq.conductor.core.model.Payload;
import com.ryuqq.conductor.core.model.WorkKind;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.spi.Classifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Router 단위 테스트.
 */
@ExtendWith(MockitoExtension.class)
class RouterTest {

    private static final Handler NOOP = (u, c) -> HandlerResult.of("");

    @Mock
    private Classifier classifier;

    private final DirectCaller caller = new DirectCaller();
    private final RecordingSink sink = new RecordingSink();
    private HandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new HandlerRegistry()
            .register(HandlerRegistration.of("billing", NOOP, "invoice", "refund"))
            .register(HandlerRegistration.of("search", NOOP, "find", "invoice"))
            .register(HandlerRegistration.of("general", NOOP))
            .register(HandlerRegistration.of("scheduler", NOOP));
    }

    private Router router(Classifier c) {
        return Router.standard(registry, Map.of(WorkKind.SCHEDULED_JOB, "scheduler"), c, caller, "general", sink);
    }

    private static WorkUnit unit(String input) {
        return WorkUnit.root(WorkKind.USER_REQUEST, ConversationId.of("conv-1"), Payload.of(input), Units.CLOCK);
    }

    // ==================== 결정적 규칙 ====================

    @Test
    void route_키워드_일치_시_등록_순서상_첫_핸들러() {
        RoutingDecision decision = router(classifier).route(unit("Please send my INVOICE"));

        assertThat(decision.handlerName()).isEqualTo("billing");
        assertThat(decision.source()).isEqualTo(KeywordRule.NAME);
        verifyNoInteractions(classifier);
    }

    @Test
    void route_target_hint가_키워드보다_우선() {
        // given
        WorkUnit parent = unit("invoice");
        parent.start();
        WorkUnit child = parent.newChild(Payload.of("invoice again"), "search");

        // when
        RoutingDecision decision = router(classifier).route(child);

        // then
        assertThat(decision.handlerName()).isEqualTo("search");
        assertThat(decision.source()).isEqualTo(TargetHintRule.NAME);
    }

    @Test
    void route_미등록_target_hint는_무시된다() {
        WorkUnit parent = unit("x");
        parent.start();
        WorkUnit child = parent.newChild(Payload.of("refund please"), "unknown");

        RoutingDecision decision = router(null).route(child);

        assertThat(decision.handlerName()).isEqualTo("billing");
    }

    @Test
    void route_KindRule_매핑() {
        Router router = new Router(
            List.of(new KindRule(Map.of(WorkKind.SCHEDULED_JOB, "scheduler")), new KeywordRule()),
            registry, null, caller, "general", sink);
        WorkUnit job = WorkUnit.root(WorkKind.SCHEDULED_JOB, ConversationId.of("c"), Payload.of("invoice"),
            Units.CLOCK);

        assertThat(router.route(job).handlerName()).isEqualTo("scheduler");
    }

    @Test
    void route_standard_키워드_불일치_시_kind_매핑_사용() {
        WorkUnit job = WorkUnit.root(WorkKind.SCHEDULED_JOB, ConversationId.of("c"), Payload.of("nightly run"),
            Units.CLOCK);

        RoutingDecision decision = router(classifier).route(job);

        assertThat(decision.handlerName()).isEqualTo("scheduler");
        assertThat(decision.source()).isEqualTo(KindRule.NAME);
        verifyNoInteractions(classifier);
    }

    @Test
    void route_standard_키워드가_kind보다_우선() {
        WorkUnit job = WorkUnit.root(WorkKind.SCHEDULED_JOB, ConversationId.of("c"), Payload.of("refund batch"),
            Units.CLOCK);

        RoutingDecision decision = router(null).route(job);

        assertThat(decision.handlerName()).isEqualTo("billing");
        assertThat(decision.source()).isEqualTo(KeywordRule.NAME);
    }

    // ==================== 분류기 폴백 ====================

    @Test
    void route_규칙_불일치_시_classifier_의존성으로_분류() throws Exception {
        // given
        when(classifier.classify(any(), anySet())).thenReturn("search");

        // when
        RoutingDecision decision = router(classifier).route(unit("what is the weather"));

        // then
        assertThat(decision.handlerName()).isEqualTo("search");
        assertThat(decision.source()).isEqualTo(RoutingDecision.CLASSIFIER);
        assertThat(caller.calls()).containsExactly(Router.CLASSIFIER_DEPENDENCY);
    }

    @Test
    void route_분류기_실패_시_기본_핸들러() throws Exception {
        when(classifier.classify(any(), anySet())).thenThrow(new IllegalStateException("model down"));

        RoutingDecision decision = router(classifier).route(unit("what is the weather"));

        assertThat(decision.handlerName()).isEqualTo("general");
        assertThat(decision.source()).isEqualTo(RoutingDecision.DEFAULT);
    }

    @Test
    void route_분류기가_미등록_이름_반환_시_기본_핸들러() throws Exception {
        when(classifier.classify(any(), anySet())).thenReturn("nonexistent");

        RoutingDecision decision = router(classifier).route(unit("what is the weather"));

        assertThat(decision.handlerName()).isEqualTo("general");
    }

    @Test
    void route_기본_핸들러_미등록이면_예외() {
        Router router = Router.standard(new HandlerRegistry(), Map.of(), null, caller, "general", sink);

        assertThatThrownBy(() -> router.route(unit("anything")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("general");
    }

    @Test
    void route_결정마다_coordinator_route_이벤트_발행() {
        router(null).route(unit("refund"));

        assertThat(sink.named("coordinator.route")).hasSize(1);
        assertThat(sink.named("coordinator.route").get(0).attribute("handler")).isEqualTo("billing");
    }

    // ==================== 레지스트리 ====================

    @Test
    void registry_중복_등록_거부() {
        assertThatThrownBy(() -> registry.register(HandlerRegistration.of("billing", NOOP)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void registry_list는_등록_순서의_카탈로그() {
        assertThat(registry.list()).extracting(HandlerRegistration::name)
            .containsExactly("billing", "search", "general", "scheduler");
        assertThat(registry.find("billing").get().keywords()).containsExactly("invoice", "refund");
    }
}
