package com.ryuqq.conductor.application.middleware;

import com.ryuqq.conductor.application.observability.EngineEvents;
import com.ryuqq.conductor.core.delegation.DelegationContext;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.handler.Handler;
import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.spi.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 모든 핸들러 실행을 감싸는 고정 순서 미들웨어 체인.
 *
 * <p><strong>순서 (예외 없음):</strong></p>
 * <pre>
 * safety-check → state-load → handler → cost-accounting → output-normalization → state-save
 * </pre>
 *
 * <p>단계 목록은 생성 시 한 번 고정되고 {@link #compose(String, Handler)}로 핸들러마다 한 번 조립됩니다.
 * 핸들러별로 단계를 생략할 수 없습니다.</p>
 *
 * <p><strong>실패 정책:</strong></p>
 * <ul>
 *   <li>중단 단계(safety-check) 실패: 이후 단계와 핸들러는 SKIPPED로 기록되고 예외 전파</li>
 *   <li>그 외 단계 실패: warn 로그 후 다음 단계 진행</li>
 *   <li>핸들러 실패: after 단계는 SKIPPED로 기록되고 예외 전파</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MiddlewareChain {

    private static final Logger log = LoggerFactory.getLogger(MiddlewareChain.class);

    public static final String HANDLER_STAGE = "handler";

    private final List<Stage> before;
    private final List<Stage> after;
    private final EventSink events;

    public MiddlewareChain(Stage safetyCheck, Stage stateLoad, Stage costAccounting, Stage outputNormalization,
                           Stage stateSave, EventSink events) {
        this.before = List.of(
            requirePhase(safetyCheck, StagePhase.BEFORE),
            requirePhase(stateLoad, StagePhase.BEFORE));
        this.after = List.of(
            requirePhase(costAccounting, StagePhase.AFTER),
            requirePhase(outputNormalization, StagePhase.AFTER),
            requirePhase(stateSave, StagePhase.AFTER));
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        this.events = events;
    }

    private static Stage requirePhase(Stage stage, StagePhase phase) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (stage.phase() != phase) {
            throw new IllegalArgumentException("Stage " + stage.name() + " must run " + phase);
        }
        return stage;
    }

    /**
     * 실행 순서대로의 단계 이름 (핸들러 포함).
     *
     * @return 단계 이름 목록
     */
    public List<String> stageNames() {
        List<String> names = new ArrayList<>();
        before.forEach(s -> names.add(s.name()));
        names.add(HANDLER_STAGE);
        after.forEach(s -> names.add(s.name()));
        return names;
    }

    public ComposedHandler compose(String handlerName, Handler handler) {
        if (handlerName == null || handlerName.isBlank()) {
            throw new IllegalArgumentException("handlerName cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        return new Composed(handlerName, handler);
    }

    private final class Composed implements ComposedHandler {

        private final String handlerName;
        private final Handler handler;

        private Composed(String handlerName, Handler handler) {
            this.handlerName = handlerName;
            this.handler = handler;
        }

        @Override
        public String handlerName() {
            return handlerName;
        }

        @Override
        public Invocation invoke(WorkUnit workUnit, DelegationContext context) throws Exception {
            Invocation invocation = new Invocation(workUnit, context, handlerName);

            // 1. before 단계
            for (int i = 0; i < before.size(); i++) {
                Stage stage = before.get(i);
                try {
                    runStage(stage, invocation);
                } catch (Exception e) {
                    skip(invocation, before.subList(i + 1, before.size()), true);
                    throw e;
                }
            }

            // 2. 핸들러
            long start = System.nanoTime();
            HandlerResult result;
            try {
                result = handler.handle(workUnit, context);
            } catch (Exception e) {
                long elapsed = elapsedMs(start);
                invocation.record(MiddlewareOutcome.failed(HANDLER_STAGE, elapsed, e));
                events.emit(EngineEvents.of(workUnit, "handler.execute", EventOutcome.FAILURE, elapsed,
                    Map.of("handler", handlerName, "error", e.getClass().getSimpleName())));
                skip(invocation, after, false);
                throw e;
            }
            if (result == null) {
                throw new IllegalStateException("Handler " + handlerName + " returned null result");
            }
            long elapsed = elapsedMs(start);
            invocation.result(result);
            invocation.record(MiddlewareOutcome.succeeded(HANDLER_STAGE, elapsed));
            events.emit(EngineEvents.of(workUnit, "handler.execute", EventOutcome.SUCCESS, elapsed,
                Map.of("handler", handlerName)));

            // 3. after 단계 (모두 비중단)
            for (Stage stage : after) {
                runStage(stage, invocation);
            }
            return invocation;
        }

        private void runStage(Stage stage, Invocation invocation) throws Exception {
            WorkUnit unit = invocation.workUnit();
            long start = System.nanoTime();
            try {
                stage.apply(invocation);
                long elapsed = elapsedMs(start);
                invocation.record(MiddlewareOutcome.succeeded(stage.name(), elapsed));
                log.debug("Stage completed: stage={}, handler={}, durationMs={}", stage.name(), handlerName, elapsed);
                events.emit(EngineEvents.of(unit, "stage." + stage.name(), EventOutcome.SUCCESS, elapsed,
                    Map.of("handler", handlerName)));
            } catch (Exception e) {
                long elapsed = elapsedMs(start);
                invocation.record(MiddlewareOutcome.failed(stage.name(), elapsed, e));
                if (stage.abortsOnFailure()) {
                    log.info("Stage aborted work unit: stage={}, handler={}, reason={}",
                        stage.name(), handlerName, e.getMessage());
                    events.emit(EngineEvents.of(unit, "stage." + stage.name(), EventOutcome.REJECTED, elapsed,
                        Map.of("handler", handlerName, "error", e.getClass().getSimpleName())));
                    throw e;
                }
                log.warn("Stage failed, continuing: stage={}, handler={}, error={}",
                    stage.name(), handlerName, e.toString());
                events.emit(EngineEvents.of(unit, "stage." + stage.name(), EventOutcome.FAILURE, elapsed,
                    Map.of("handler", handlerName, "error", e.getClass().getSimpleName())));
            }
        }

        private void skip(Invocation invocation, List<Stage> stages, boolean includeHandlerAndAfter) {
            List<String> names = new ArrayList<>();
            stages.forEach(s -> names.add(s.name()));
            if (includeHandlerAndAfter) {
                names.add(HANDLER_STAGE);
                after.forEach(s -> names.add(s.name()));
            }
            for (String name : names) {
                invocation.record(MiddlewareOutcome.skippedStage(name));
                events.emit(EngineEvents.of(invocation.workUnit(), "stage." + name, EventOutcome.SKIPPED, 0,
                    Map.of("handler", handlerName)));
            }
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
