package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.inmemory.store.InMemoryKeyValueStore;
import com.ryuqq.conductor.adapter.inmemory.store.InMemoryWorkUnitStore;
import com.ryuqq.conductor.adapter.runner.config.EngineConfigLoader;
import com.ryuqq.conductor.adapter.runner.config.EngineProperties;
import com.ryuqq.conductor.adapter.runner.lifecycle.ShutdownReport;
import com.ryuqq.conductor.adapter.runner.lifecycle.StartupValidationException;
import com.ryuqq.conductor.adapter.runner.support.RecordingSink;
import com.ryuqq.conductor.application.middleware.MiddlewareChain;
import com.ryuqq.conductor.application.routing.HandlerRegistration;
import com.ryuqq.conductor.application.routing.HandlerRegistry;
import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.handler.Usage;
import com.ryuqq.conductor.core.model.ConversationId;
import com.ryuqq.conductor.core.model.Payload;
import com.ryuqq.conductor.core.model.WorkKind;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.statemachine.WorkStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ConductorEngine 조립 테스트.
 */
class ConductorEngineTest {

    private final InMemoryKeyValueStore stateStore = new InMemoryKeyValueStore();
    private final InMemoryKeyValueStore costStore = new InMemoryKeyValueStore();
    private final InMemoryWorkUnitStore workUnitStore = new InMemoryWorkUnitStore();
    private final RecordingSink sink = new RecordingSink();
    private HandlerRegistry handlers;
    private EngineProperties properties;
    private ConductorEngine engine;

    @BeforeEach
    void setUp() {
        handlers = new HandlerRegistry()
            .register(HandlerRegistration.of("general", (u, c) -> HandlerResult.of("hi there", Usage.ofCost(2))));
        properties = new EngineConfigLoader().load();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    private ConductorEngine.Builder builder() {
        return ConductorEngine.builder()
            .properties(properties)
            .handlers(handlers)
            .stateStore(stateStore)
            .costStore(costStore)
            .workUnitStore(workUnitStore)
            .events(sink)
            .sleeper(millis -> { })
            .clock(Clock.systemUTC());
    }

    @Test
    void 설정으로_조립한_엔진이_미들웨어_체인을_거쳐_작업을_처리() {
        // given
        engine = builder().build();
        engine.start();
        WorkUnit unit = WorkUnit.root(WorkKind.USER_REQUEST, ConversationId.of("conv-e"), Payload.of("hello"),
            Clock.systemUTC());

        // when
        WorkUnit result = engine.coordinator().handle(unit);

        // then
        assertThat(result.getStatus()).isEqualTo(WorkStatus.COMPLETED);
        assertThat(result.getCost()).isEqualByComparingTo("2");
        assertThat(stateStore.get("conversation:conv-e")).isPresent();
        assertThat(costStore.get("cost:" + unit.getId().getValue())).isPresent();
        assertThat(workUnitStore.find(unit.getId())).isPresent();
        assertThat(engine.chain().stageNames()).containsExactly(
            "safety-check", "state-load", MiddlewareChain.HANDLER_STAGE, "cost-accounting", "output-normalization",
            "state-save");
        assertThat(engine.dependencies().names()).containsExactlyInAnyOrder("state-store", "cost-store");
        assertThat(engine.coordinator().getConfig().maxDepth()).isEqualTo(3);
        assertThat(engine.queueWorker()).isNull();
    }

    @Test
    void 시작_전에는_작업을_수락하지_않음() {
        // given
        engine = builder().build();
        WorkUnit unit = WorkUnit.root(WorkKind.USER_REQUEST, ConversationId.of("conv-e"), Payload.of("hello"),
            Clock.systemUTC());

        // when
        WorkUnit result = engine.coordinator().handle(unit);

        // then
        assertThat(result.getStatus()).isEqualTo(WorkStatus.FAILED);
        assertThat(engine.gate().isHealthy()).isFalse();
    }

    @Test
    void 종료하면_이벤트를_flush하고_의존성을_해제() {
        // given
        engine = builder().build();
        engine.start();

        // when
        ShutdownReport report = engine.shutdown();

        // then
        assertThat(report.isClean()).isTrue();
        assertThat(sink.flushCount()).isEqualTo(1);
        assertThat(engine.dependencies().isClosed()).isTrue();
        assertThat(engine.workerPools().io().isShutdown()).isTrue();
        assertThat(engine.gate().isAccepting()).isFalse();
    }

    @Test
    void 보호_파라미터가_빠진_설정으로는_조립되지_않음() {
        // given
        properties.getDependencies().get(1).setBulkheadCapacity(null);

        // when & then
        assertThatThrownBy(() -> builder().build())
            .isInstanceOf(StartupValidationException.class)
            .hasMessageContaining("bulkheadCapacity is missing");
    }

    @Test
    void 분류기를_켜고_분류기를_주지_않으면_조립_실패() {
        // given
        EngineProperties.DependencySection classifier = new EngineProperties.DependencySection();
        classifier.setName("classifier");
        classifier.setFailureThreshold(5);
        classifier.setOpenDurationMs(1_000L);
        classifier.setBulkheadCapacity(2);
        classifier.setBulkheadMaxWaitMs(100L);
        classifier.setAttemptTimeoutMs(500L);
        properties.getDependencies().add(classifier);
        properties.getEngine().setClassifierEnabled(true);

        // when & then
        assertThatThrownBy(() -> builder().build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("classifier is required");
    }
}
