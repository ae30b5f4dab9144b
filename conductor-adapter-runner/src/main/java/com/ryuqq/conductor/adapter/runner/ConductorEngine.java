package com.ryuqq.conductor.adapter.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.adapter.resilience.DependencyRegistry;
import com.ryuqq.conductor.adapter.resilience.ResiliencePipeline;
import com.ryuqq.conductor.adapter.resilience.Sleeper;
import com.ryuqq.conductor.adapter.runner.config.EngineConfigMapper;
import com.ryuqq.conductor.adapter.runner.config.EngineProperties;
import com.ryuqq.conductor.adapter.runner.config.StartupValidator;
import com.ryuqq.conductor.adapter.runner.lifecycle.LifecycleManager;
import com.ryuqq.conductor.adapter.runner.lifecycle.ShutdownReport;
import com.ryuqq.conductor.application.context.ContextPropagator;
import com.ryuqq.conductor.application.context.WorkerPools;
import com.ryuqq.conductor.application.gate.EngineGate;
import com.ryuqq.conductor.application.middleware.CostAccountingStage;
import com.ryuqq.conductor.application.middleware.MiddlewareChain;
import com.ryuqq.conductor.application.middleware.OutputNormalizationStage;
import com.ryuqq.conductor.application.middleware.SafetyCheckStage;
import com.ryuqq.conductor.application.middleware.StateLoadStage;
import com.ryuqq.conductor.application.middleware.StateSaveStage;
import com.ryuqq.conductor.application.observability.BufferedLogEventSink;
import com.ryuqq.conductor.application.routing.HandlerRegistry;
import com.ryuqq.conductor.application.routing.Router;
import com.ryuqq.conductor.core.spi.Classifier;
import com.ryuqq.conductor.core.spi.EventSink;
import com.ryuqq.conductor.core.spi.KeyValueStore;
import com.ryuqq.conductor.core.spi.WorkQueue;
import com.ryuqq.conductor.core.spi.WorkUnitStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 설정과 어댑터로 엔진 전체를 조립합니다.
 *
 * <p>조립 전에 {@link StartupValidator}를 실행하므로, 잘못된 설정으로는 어떤 컴포넌트도 만들어지지 않습니다.
 * {@link #start()} 전까지는 작업을 수락하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ConductorEngine engine = ConductorEngine.builder()
 *     .properties(new EngineConfigLoader().load())
 *     .handlers(handlers)
 *     .stateStore(stateStore)
 *     .costStore(costStore)
 *     .workUnitStore(workUnitStore)
 *     .build();
 * engine.start();
 * WorkUnit done = engine.coordinator().handle(workUnit);
 * engine.shutdown();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConductorEngine {

    private final DependencyRegistry dependencies;
    private final ResiliencePipeline pipeline;
    private final MiddlewareChain chain;
    private final Router router;
    private final EngineGate gate;
    private final DelegatingCoordinator coordinator;
    private final ContextPropagator propagator;
    private final WorkerPools workerPools;
    private final EventSink events;
    private final QueueWorkerRunner queueWorker;
    private final LifecycleManager lifecycle;

    private ConductorEngine(Builder builder) {
        EngineProperties properties = builder.properties;
        StartupValidator validator = new StartupValidator(properties, builder.handlers);

        // 1. fail-closed 검증
        validator.verify();
        boolean classifierEnabled = properties.getEngine().isClassifierEnabled();
        if (classifierEnabled && builder.classifier == null) {
            throw new IllegalArgumentException("classifier is required when engine.classifierEnabled is true");
        }

        // 2. 이벤트, 의존성 보호
        ObjectMapper objectMapper = builder.objectMapper;
        this.events = builder.events != null ? builder.events : new BufferedLogEventSink(objectMapper);
        this.dependencies = new DependencyRegistry(EngineConfigMapper.dependencies(properties), events, builder.clock);
        this.pipeline = new ResiliencePipeline(dependencies, events, builder.sleeper);

        // 3. 미들웨어 체인
        this.chain = new MiddlewareChain(
            new SafetyCheckStage(EngineConfigMapper.safetyRules(properties)),
            new StateLoadStage(builder.stateStore, pipeline, objectMapper),
            new CostAccountingStage(builder.costStore, pipeline, objectMapper),
            new OutputNormalizationStage(builder.handlers::contract),
            new StateSaveStage(builder.stateStore, pipeline, objectMapper, builder.clock,
                properties.getEngine().getMaxConversationTurns()),
            events
        );

        // 4. 라우팅, Coordinator
        CoordinatorConfig coordinatorConfig = EngineConfigMapper.coordinator(properties);
        this.router = Router.standard(builder.handlers, EngineConfigMapper.handlersByKind(properties),
            classifierEnabled ? builder.classifier : null, pipeline, coordinatorConfig.defaultHandler(), events);
        this.gate = new EngineGate();
        this.coordinator = new DelegatingCoordinator(router, chain, builder.workUnitStore, gate, events,
            coordinatorConfig, builder.clock);

        // 5. 컨텍스트 전파, 워커 풀, 큐 intake
        this.propagator = new ContextPropagator(objectMapper);
        EngineProperties.WorkersSection workers = properties.getWorkers();
        this.workerPools = new WorkerPools(workers.getIoThreads(), workers.getCpuThreads(),
            workers.getCpuQueueCapacity(), propagator);
        this.queueWorker = builder.workQueue == null
            ? null
            : new QueueWorkerRunner(builder.workQueue, coordinator, propagator, gate,
                EngineConfigMapper.queue(properties), builder.clock);

        // 6. 수명 주기
        long drainTimeoutMs = properties.getLifecycle().getDrainTimeoutMs();
        List<AutoCloseable> resources = new ArrayList<>();
        if (queueWorker != null) {
            resources.add(() -> queueWorker.stop(drainTimeoutMs));
        }
        resources.add(dependencies);
        resources.add(() -> {
            if (!workerPools.shutdown(drainTimeoutMs)) {
                throw new IllegalStateException("Worker pools did not terminate within " + drainTimeoutMs + "ms");
            }
        });
        this.lifecycle = new LifecycleManager(EngineConfigMapper.lifecycle(properties), gate, events,
            builder.workUnitStore, validator, resources, builder.sleeper, builder.exitAction);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 검증 후 작업 수락 시작. 큐가 있으면 큐 워커도 시작합니다.
     */
    public void start() {
        lifecycle.start();
        if (queueWorker != null) {
            queueWorker.start();
        }
    }

    public ShutdownReport shutdown() {
        return lifecycle.shutdown();
    }

    public DelegatingCoordinator coordinator() {
        return coordinator;
    }

    public ResiliencePipeline pipeline() {
        return pipeline;
    }

    public DependencyRegistry dependencies() {
        return dependencies;
    }

    public MiddlewareChain chain() {
        return chain;
    }

    public Router router() {
        return router;
    }

    public EngineGate gate() {
        return gate;
    }

    public ContextPropagator propagator() {
        return propagator;
    }

    public WorkerPools workerPools() {
        return workerPools;
    }

    public EventSink events() {
        return events;
    }

    /**
     * 큐 워커. 큐가 설정되지 않았으면 null.
     */
    public QueueWorkerRunner queueWorker() {
        return queueWorker;
    }

    public LifecycleManager lifecycle() {
        return lifecycle;
    }

    /**
     * ConductorEngine Builder.
     */
    public static final class Builder {

        private EngineProperties properties;
        private HandlerRegistry handlers;
        private KeyValueStore stateStore;
        private KeyValueStore costStore;
        private WorkUnitStore workUnitStore;
        private WorkQueue workQueue;
        private Classifier classifier;
        private EventSink events;
        private ObjectMapper objectMapper = new ObjectMapper();
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.THREAD;
        private Runnable exitAction;

        private Builder() {
        }

        public Builder properties(EngineProperties properties) {
            this.properties = properties;
            return this;
        }

        public Builder handlers(HandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        public Builder stateStore(KeyValueStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        public Builder costStore(KeyValueStore costStore) {
            this.costStore = costStore;
            return this;
        }

        public Builder workUnitStore(WorkUnitStore workUnitStore) {
            this.workUnitStore = workUnitStore;
            return this;
        }

        public Builder workQueue(WorkQueue workQueue) {
            this.workQueue = workQueue;
            return this;
        }

        public Builder classifier(Classifier classifier) {
            this.classifier = classifier;
            return this;
        }

        /**
         * 이벤트 Sink. 지정하지 않으면 {@link BufferedLogEventSink}.
         */
        public Builder events(EventSink events) {
            this.events = events;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * 재시도 backoff와 종료 전파 지연에 쓰이는 대기.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder exitAction(Runnable exitAction) {
            this.exitAction = exitAction;
            return this;
        }

        /**
         * 엔진 조립.
         *
         * @return 수락 전 상태의 엔진
         * @throws IllegalArgumentException 필수 구성 요소가 없는 경우
         * @throws com.ryuqq.conductor.adapter.runner.lifecycle.StartupValidationException 설정 검증 실패 시
         */
        public ConductorEngine build() {
            if (properties == null) {
                throw new IllegalArgumentException("properties cannot be null");
            }
            if (handlers == null) {
                throw new IllegalArgumentException("handlers cannot be null");
            }
            if (stateStore == null) {
                throw new IllegalArgumentException("stateStore cannot be null");
            }
            if (costStore == null) {
                throw new IllegalArgumentException("costStore cannot be null");
            }
            if (workUnitStore == null) {
                throw new IllegalArgumentException("workUnitStore cannot be null");
            }
            if (objectMapper == null) {
                throw new IllegalArgumentException("objectMapper cannot be null");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            if (sleeper == null) {
                throw new IllegalArgumentException("sleeper cannot be null");
            }
            return new ConductorEngine(this);
        }
    }
}
