package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.coordinator.Coordinator;
import com.ryuqq.conductor.application.gate.EngineGate;
import com.ryuqq.conductor.application.middleware.ComposedHandler;
import com.ryuqq.conductor.application.middleware.Invocation;
import com.ryuqq.conductor.application.middleware.MiddlewareChain;
import com.ryuqq.conductor.application.observability.EngineEvents;
import com.ryuqq.conductor.application.routing.HandlerRegistration;
import com.ryuqq.conductor.application.routing.Router;
import com.ryuqq.conductor.application.routing.RoutingDecision;
import com.ryuqq.conductor.core.context.ContextKeys;
import com.ryuqq.conductor.core.delegation.BudgetLedger;
import com.ryuqq.conductor.core.delegation.DelegationContext;
import com.ryuqq.conductor.core.error.BudgetExceededException;
import com.ryuqq.conductor.core.error.ConductorException;
import com.ryuqq.conductor.core.error.DeadlineExceededException;
import com.ryuqq.conductor.core.error.DelegationCycleDetectedException;
import com.ryuqq.conductor.core.error.DelegationDepthExceededException;
import com.ryuqq.conductor.core.error.ErrorCode;
import com.ryuqq.conductor.core.error.ShutdownInterruptedException;
import com.ryuqq.conductor.core.error.WorkError;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.handler.DelegationRequest;
import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.model.WorkUnitId;
import com.ryuqq.conductor.core.spi.EventSink;
import com.ryuqq.conductor.core.spi.WorkUnitStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 재귀 위임 Coordinator 구현체.
 *
 * <p>WorkUnit을 핸들러로 라우팅하고 미들웨어 체인으로 실행합니다. 핸들러 결과가 위임을 요청하면
 * 자식 WorkUnit을 만들어 같은 검사를 거쳐 재귀 실행합니다.</p>
 *
 * <p><strong>실행 전 검사 (핸들러 실행 없이 거부):</strong></p>
 * <ol>
 *   <li>취소 신호 → CANCELLED</li>
 *   <li>마감 경과 → FAILED(DEADLINE_EXCEEDED)</li>
 *   <li>depth + 1 &gt; maxDepth → FAILED(DELEGATION_DEPTH_EXCEEDED)</li>
 *   <li>라우팅 후 경로상 이미 방문한 핸들러 → FAILED(DELEGATION_CYCLE_DETECTED)</li>
 * </ol>
 *
 * <p><strong>위임 실패 범위:</strong> 깊이/순환/예산 거부는 해당 위임만 실패시킵니다. 부모는 자기 출력을 유지한 채
 * COMPLETED가 되고, 거부된 자식은 실패 코드와 함께 부모에 연결됩니다.</p>
 *
 * <p><strong>경계:</strong> 모든 public handle 계열 메서드는 예외를 던지지 않고 종료 상태의 WorkUnit을 반환합니다.
 * 종료된 WorkUnit은 {@link WorkUnitStore}에 저장되며, 같은 id 재실행은 저장된 기록을 그대로 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DelegatingCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(DelegatingCoordinator.class);

    private final Router router;
    private final MiddlewareChain chain;
    private final WorkUnitStore store;
    private final EngineGate gate;
    private final EventSink events;
    private final CoordinatorConfig config;
    private final Clock clock;
    private final Map<String, ComposedHandler> composed = new ConcurrentHashMap<>();
    private final Map<WorkUnitId, ApprovalWait> approvals = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param router 라우터 (핸들러 레지스트리 포함)
     * @param chain 미들웨어 체인
     * @param store 종료 WorkUnit 저장소
     * @param gate 엔진 게이트
     * @param events 이벤트 Sink
     * @param config 설정
     * @param clock 마감 계산용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DelegatingCoordinator(Router router, MiddlewareChain chain, WorkUnitStore store, EngineGate gate,
                                 EventSink events, CoordinatorConfig config, Clock clock) {
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        if (chain == null) {
            throw new IllegalArgumentException("chain cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.router = router;
        this.chain = chain;
        this.store = store;
        this.gate = gate;
        this.events = events;
        this.config = config;
        this.clock = clock;
    }

    public CoordinatorConfig getConfig() {
        return config;
    }

    /**
     * 기본 예산과 마감으로 루트 위임 컨텍스트 생성.
     *
     * @param workUnit 루트 WorkUnit
     * @return depth 0 위임 컨텍스트
     */
    public DelegationContext rootContext(WorkUnit workUnit) {
        String correlationId = MDC.get(ContextKeys.CORRELATION_ID);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        BudgetLedger ledger = config.defaultBudget() == null
            ? BudgetLedger.unlimited()
            : BudgetLedger.of(config.defaultBudget());
        Instant deadline = config.defaultDeadlineMs() > 0
            ? clock.instant().plusMillis(config.defaultDeadlineMs())
            : null;
        return DelegationContext.root(workUnit.getId(), correlationId, ledger, deadline);
    }

    @Override
    public WorkUnit handle(WorkUnit workUnit) {
        if (workUnit == null) {
            throw new IllegalArgumentException("workUnit cannot be null");
        }
        return dispatch(workUnit, rootContext(workUnit), null);
    }

    @Override
    public WorkUnit handle(WorkUnit workUnit, DelegationContext context) {
        return dispatch(workUnit, context, null);
    }

    @Override
    public WorkUnit handleDirect(String handlerName, WorkUnit workUnit, DelegationContext context) {
        if (handlerName == null || handlerName.isBlank()) {
            throw new IllegalArgumentException("handlerName cannot be null or blank");
        }
        return dispatch(workUnit, context, handlerName);
    }

    private WorkUnit dispatch(WorkUnit workUnit, DelegationContext context, String forcedHandler) {
        if (workUnit == null) {
            throw new IllegalArgumentException("workUnit cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        boolean root = context.getDepth() == 0 && context.getRootId().equals(workUnit.getId());
        if (!root) {
            return execute(workUnit, context, forcedHandler);
        }
        Optional<WorkUnit> replayed = replay(workUnit);
        if (replayed.isPresent()) {
            return replayed.get();
        }
        return executeRoot(workUnit, context, forcedHandler);
    }

    /**
     * 종료된 id 재실행 시 저장된 기록 반환 (변경 없음).
     *
     * <p>종료 시퀀스가 SHUTDOWN_INTERRUPTED로 끝낸 기록은 예외입니다. 재전달된 새 인스턴스는 처음부터
     * 다시 실행됩니다.</p>
     */
    private Optional<WorkUnit> replay(WorkUnit workUnit) {
        Optional<WorkUnit> stored = store.find(workUnit.getId());
        if (stored.isPresent() && stored.get().isInterruptedByShutdown() && !workUnit.isTerminal()) {
            log.info("Re-running work unit interrupted by shutdown: workUnitId={}", workUnit.getId());
            return Optional.empty();
        }
        if (stored.isPresent() && stored.get().isTerminal()) {
            log.info("Replay of terminal work unit ignored: workUnitId={}, status={}",
                workUnit.getId(), stored.get().getStatus());
            events.emit(EngineEvents.of(stored.get(), "coordinator.replay", EventOutcome.SKIPPED, 0,
                Map.of("status", stored.get().getStatus().name())));
            return stored;
        }
        if (workUnit.isTerminal()) {
            return Optional.of(workUnit);
        }
        return Optional.empty();
    }

    private WorkUnit executeRoot(WorkUnit workUnit, DelegationContext context, String forcedHandler) {
        if (!gate.tryEnter(workUnit, context)) {
            return rejectAtGate(workUnit);
        }
        try {
            return execute(workUnit, context, forcedHandler);
        } finally {
            gate.exit(workUnit.getId());
        }
    }

    private WorkUnit rejectAtGate(WorkUnit workUnit) {
        Optional<EngineGate.InFlight> running = gate.find(workUnit.getId());
        if (running.isPresent() && running.get().workUnit() == workUnit) {
            log.warn("Work unit is already in flight: workUnitId={}", workUnit.getId());
            return workUnit;
        }
        if (!gate.isAccepting()) {
            log.warn("Engine is not accepting work, rejecting: workUnitId={}", workUnit.getId());
            terminateFailed(workUnit, new ShutdownInterruptedException("Engine is not accepting new work").toWorkError(),
                "coordinator.intake");
        } else {
            terminateFailed(workUnit,
                WorkError.of(ErrorCode.VALIDATION_FAILURE, "Work unit id is already in flight: " + workUnit.getId()),
                "coordinator.intake");
        }
        return workUnit;
    }

    /**
     * 한 WorkUnit 실행 (검사 → 라우팅 → 체인 → 위임). 예외를 던지지 않습니다.
     */
    private WorkUnit execute(WorkUnit workUnit, DelegationContext context, String forcedHandler) {
        if (workUnit.isTerminal()) {
            return workUnit;
        }
        Map<String, String> previousMdc = MDC.getCopyOfContextMap();
        MDC.put(ContextKeys.WORK_UNIT_ID, workUnit.getId().getValue());
        MDC.put(ContextKeys.CONVERSATION_ID, workUnit.getConversationId().getValue());
        MDC.put(ContextKeys.CORRELATION_ID, context.getCorrelationId());
        try {
            // 1. 취소
            if (context.isCancelled()) {
                terminateCancelled(workUnit, context.getCancellation().getReason());
                return workUnit;
            }

            // 2. 마감
            if (context.isExpired(clock.instant())) {
                reject(workUnit, new DeadlineExceededException(context.getDeadline().orElse(clock.instant())));
                return workUnit;
            }

            // 3. 깊이
            int attemptedDepth = context.getDepth() + 1;
            if (attemptedDepth > config.maxDepth()) {
                reject(workUnit, new DelegationDepthExceededException(attemptedDepth, config.maxDepth()));
                return workUnit;
            }

            // 4. 라우팅
            RoutingDecision decision = forcedHandler != null
                ? RoutingDecision.direct(forcedHandler)
                : router.route(workUnit);
            Optional<HandlerRegistration> registration = router.registry().find(decision.handlerName());
            if (registration.isEmpty()) {
                terminateFailed(workUnit,
                    WorkError.of(ErrorCode.HANDLER_FAILED, "Unknown handler: " + decision.handlerName()),
                    "coordinator.route");
                return workUnit;
            }
            String handlerName = decision.handlerName();

            // 5. 순환
            if (context.hasVisited(handlerName)) {
                reject(workUnit, new DelegationCycleDetectedException(handlerName, context.getVisitedHandlers()));
                return workUnit;
            }

            // 6. 진입 및 실행
            DelegationContext entered = context.enter(handlerName);
            workUnit.assignHandler(handlerName);
            workUnit.start();
            workUnit.appendTrace("handler", handlerName + " (depth " + entered.getDepth() + ", " + decision.source() + ")");
            log.debug("Running handler: workUnitId={}, handler={}, depth={}",
                workUnit.getId(), handlerName, entered.getDepth());
            ComposedHandler handler = composed.computeIfAbsent(handlerName,
                name -> chain.compose(name, registration.get().handler()));
            run(workUnit, entered, handler);
        } catch (RuntimeException e) {
            log.error("Unexpected coordinator failure: workUnitId={}", workUnit.getId(), e);
            terminateFailed(workUnit, WorkError.from(e), "coordinator.execute");
        } finally {
            if (workUnit.isTerminal()) {
                saveQuietly(workUnit);
            }
            if (previousMdc == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previousMdc);
            }
        }
        return workUnit;
    }

    private void run(WorkUnit workUnit, DelegationContext entered, ComposedHandler handler) {
        while (true) {
            // 1. 체인 실행
            Invocation invocation;
            try {
                invocation = handler.invoke(workUnit, entered);
            } catch (Exception e) {
                if (entered.isCancelled()) {
                    terminateCancelled(workUnit, entered.getCancellation().getReason());
                } else {
                    log.warn("Handler failed: workUnitId={}, handler={}, error={}",
                        workUnit.getId(), handler.handlerName(), e.toString());
                    terminateFailed(workUnit, WorkError.from(e), "coordinator.handler");
                }
                return;
            }
            HandlerResult result = invocation.result();
            workUnit.recordOutput(result.output());

            // 2. 실행 중 취소/마감/예산
            if (entered.isCancelled()) {
                terminateCancelled(workUnit, entered.getCancellation().getReason());
                return;
            }
            if (entered.isExpired(clock.instant())) {
                reject(workUnit, new DeadlineExceededException(entered.getDeadline().orElse(clock.instant())));
                return;
            }
            if (invocation.isBudgetExceeded()) {
                budgetExceeded(workUnit, entered);
                return;
            }

            // 3. 승인 대기
            if (result.approvalRequired() && !workUnit.isApproved()) {
                if (!awaitApproval(workUnit, entered)) {
                    return;
                }
                continue;
            }

            // 4. 위임
            Optional<DelegationRequest> delegation = result.getDelegation();
            if (delegation.isPresent()) {
                delegate(workUnit, entered, delegation.get());
                if (entered.isCancelled()) {
                    terminateCancelled(workUnit, entered.getCancellation().getReason());
                    return;
                }
                if (entered.isExpired(clock.instant())) {
                    reject(workUnit, new DeadlineExceededException(entered.getDeadline().orElse(clock.instant())));
                    return;
                }
            }

            // 5. 완료
            if (workUnit.complete()) {
                log.info("Work unit completed: workUnitId={}, handler={}, cost={}",
                    workUnit.getId(), handler.handlerName(), workUnit.getCost());
                emitTerminal(workUnit, "work.completed", EventOutcome.SUCCESS, Map.of());
            }
            return;
        }
    }

    @Override
    public WorkUnit delegate(WorkUnit parent, DelegationContext context, DelegationRequest request) {
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        WorkUnit child = parent.newChild(request.input(), request.targetHint());

        // 1. 취소된 루트 아래에서는 새 위임을 내보내지 않음
        if (context.isCancelled()) {
            log.info("Delegation suppressed by cancellation: parentId={}", parent.getId());
            child.cancel(context.getCancellation().getReason());
            events.emit(EngineEvents.of(parent, "coordinator.delegate", EventOutcome.SKIPPED, 0,
                Map.of("reason", "cancelled")));
            return child;
        }
        if (!parent.attachChild(child)) {
            child.cancel("parent already terminal");
            return child;
        }
        events.emit(EngineEvents.of(parent, "coordinator.delegate", EventOutcome.SUCCESS, 0,
            Map.of("childId", child.getId().getValue(), "depth", String.valueOf(context.getDepth()),
                "targetHint", request.targetHint() == null ? "" : request.targetHint())));

        // 2. 마감/예산 (위임 직전 확인)
        if (context.isExpired(clock.instant())) {
            reject(child, new DeadlineExceededException(context.getDeadline().orElse(clock.instant())));
            saveQuietly(child);
            return child;
        }
        if (context.getLedger().isExhausted()) {
            reject(child, new BudgetExceededException(context.budgetRemaining()));
            saveQuietly(child);
            return child;
        }

        // 3. 재귀 실행
        return execute(child, context, null);
    }

    private void budgetExceeded(WorkUnit workUnit, DelegationContext context) {
        reject(workUnit, new BudgetExceededException(context.budgetRemaining()));
        if (config.budgetPolicy() == BudgetPolicy.CANCEL_SIBLINGS) {
            log.warn("Budget exceeded, cancelling delegation tree: rootId={}", context.getRootId());
            context.getCancellation().cancel("budget exceeded");
        }
    }

    // ===== 승인 =====

    private boolean awaitApproval(WorkUnit workUnit, DelegationContext context) {
        workUnit.awaitApproval();
        ApprovalWait wait = new ApprovalWait();
        approvals.put(workUnit.getId(), wait);
        Runnable onCancel = () -> wait.decide(Decision.CANCELLED, context.getCancellation().getReason());
        context.getCancellation().onCancel(onCancel);
        log.info("Awaiting approval: workUnitId={}", workUnit.getId());
        events.emit(EngineEvents.of(workUnit, "coordinator.approval", EventOutcome.SKIPPED, 0,
            Map.of("state", "requested")));
        try {
            long timeoutMs = context.getDeadline()
                .map(deadline -> Math.max(0, Duration.between(clock.instant(), deadline).toMillis()))
                .orElse(Long.MAX_VALUE);
            if (!wait.latch.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                reject(workUnit, new DeadlineExceededException(context.getDeadline().orElse(clock.instant())));
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminateFailed(workUnit, WorkError.of(ErrorCode.SHUTDOWN_INTERRUPTED, "Interrupted while awaiting approval"),
                "coordinator.approval");
            return false;
        } finally {
            approvals.remove(workUnit.getId());
            context.getCancellation().removeListener(onCancel);
        }

        switch (wait.decision) {
            case APPROVED:
                workUnit.markApproved();
                workUnit.start();
                workUnit.appendTrace("approval", "approved");
                events.emit(EngineEvents.of(workUnit, "coordinator.approval", EventOutcome.SUCCESS, 0,
                    Map.of("state", "approved")));
                return true;
            case REJECTED:
                events.emit(EngineEvents.of(workUnit, "coordinator.approval", EventOutcome.REJECTED, 0,
                    Map.of("state", "rejected")));
                terminateCancelled(workUnit, "rejected: " + wait.reason);
                return false;
            default:
                terminateCancelled(workUnit, wait.reason);
                return false;
        }
    }

    @Override
    public boolean approve(WorkUnitId workUnitId) {
        ApprovalWait wait = approvals.get(workUnitId);
        return wait != null && wait.decide(Decision.APPROVED, null);
    }

    @Override
    public boolean reject(WorkUnitId workUnitId, String reason) {
        ApprovalWait wait = approvals.get(workUnitId);
        return wait != null && wait.decide(Decision.REJECTED, reason == null ? "rejected" : reason);
    }

    public boolean isAwaitingApproval(WorkUnitId workUnitId) {
        return approvals.containsKey(workUnitId);
    }

    @Override
    public boolean cancel(WorkUnitId rootId, String reason) {
        Optional<EngineGate.InFlight> running = gate.find(rootId);
        if (running.isEmpty()) {
            return false;
        }
        boolean first = running.get().context().getCancellation().cancel(reason);
        if (first) {
            log.info("Cancellation requested: rootId={}, reason={}", rootId, reason);
            events.emit(EngineEvents.of(running.get().workUnit(), "coordinator.cancel", EventOutcome.SUCCESS, 0,
                Map.of("reason", reason == null ? "cancelled" : reason)));
        }
        return true;
    }

    // ===== 종료 처리 =====

    private void reject(WorkUnit workUnit, ConductorException rejection) {
        log.warn("Work unit rejected: workUnitId={}, code={}, reason={}",
            workUnit.getId(), rejection.getErrorCode().code(), rejection.getMessage());
        if (workUnit.fail(rejection.toWorkError())) {
            emitTerminal(workUnit, "coordinator.rejected", EventOutcome.REJECTED,
                Map.of("code", rejection.getErrorCode().code()));
        }
    }

    private void terminateFailed(WorkUnit workUnit, WorkError error, String eventName) {
        if (workUnit.fail(error)) {
            emitTerminal(workUnit, "work.failed", EventOutcome.FAILURE,
                Map.of("code", error.code().code(), "source", eventName));
        }
    }

    private void terminateCancelled(WorkUnit workUnit, String reason) {
        if (workUnit.cancel(reason)) {
            log.info("Work unit cancelled: workUnitId={}, reason={}", workUnit.getId(), reason);
            emitTerminal(workUnit, "work.cancelled", EventOutcome.SKIPPED,
                Map.of("reason", reason == null ? "cancelled" : reason));
        }
    }

    private void emitTerminal(WorkUnit workUnit, String name, EventOutcome outcome, Map<String, String> extra) {
        Map<String, String> attributes = new HashMap<>(extra);
        attributes.put("status", workUnit.getStatus().name());
        workUnit.getHandlerName().ifPresent(h -> attributes.put("handler", h));
        long duration = workUnit.getCompletedAt()
            .map(done -> Duration.between(workUnit.getCreatedAt(), done).toMillis())
            .orElse(0L);
        events.emit(EngineEvents.of(workUnit, name, outcome, duration, attributes));
    }

    private void saveQuietly(WorkUnit workUnit) {
        try {
            store.save(workUnit);
        } catch (RuntimeException e) {
            log.warn("Failed to save terminal work unit: workUnitId={}, error={}", workUnit.getId(), e.toString());
        }
    }

    private enum Decision {
        APPROVED, REJECTED, CANCELLED
    }

    private static final class ApprovalWait {

        private final CountDownLatch latch = new CountDownLatch(1);
        private volatile Decision decision;
        private volatile String reason;

        private synchronized boolean decide(Decision value, String why) {
            if (decision != null) {
                return false;
            }
            this.decision = value;
            this.reason = why;
            latch.countDown();
            return true;
        }
    }
}
