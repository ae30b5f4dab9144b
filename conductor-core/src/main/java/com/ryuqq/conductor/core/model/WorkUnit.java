package com.ryuqq.conductor.core.model;

import com.ryuqq.conductor.core.error.ErrorCode;
import com.ryuqq.conductor.core.error.WorkError;
import com.ryuqq.conductor.core.statemachine.StateTransition;
import com.ryuqq.conductor.core.statemachine.WorkStatus;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 엔진을 흐르는 단일 작업 단위.
 *
 * <p>Coordinator가 접수 시 생성하고, 실행 중에는 Middleware Chain이 비용/출력/추적 정보를 기록합니다.
 * 종료 상태(COMPLETED, FAILED, CANCELLED)에 도달하면 동결되어 이후 모든 변경 시도는 무시됩니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>상태와 필드 변경은 인스턴스 락으로 직렬화됩니다.</li>
 *   <li>취소 신호와 Lifecycle Manager의 강제 종료가 실행 스레드와 경쟁할 수 있으므로
 *       종료 전이는 {@code boolean}을 반환하고 먼저 도착한 쪽만 반영됩니다.</li>
 *   <li>자식 목록은 형제 위임이 병렬로 붙을 수 있어 {@link CopyOnWriteArrayList}를 사용합니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkUnit {

    private final WorkUnitId id;
    private final WorkKind kind;
    private final Payload input;
    private final WorkUnitId parentId;
    private final ConversationId conversationId;
    private final String targetHint;
    private final Instant createdAt;
    private final Clock clock;
    private final List<WorkUnit> children = new CopyOnWriteArrayList<>();

    private WorkStatus status = WorkStatus.PENDING;
    private Payload output;
    private WorkError error;
    private BigDecimal cost = BigDecimal.ZERO;
    private final List<TraceEntry> trace = new ArrayList<>();
    private Payload conversationState = Payload.empty();
    private String handlerName;
    private boolean approved;
    private Instant updatedAt;
    private Instant completedAt;

    private WorkUnit(Builder builder) {
        if (builder.id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (builder.kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (builder.conversationId == null) {
            throw new IllegalArgumentException("conversationId cannot be null");
        }
        if (builder.clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.id = builder.id;
        this.kind = builder.kind;
        this.input = builder.input == null ? Payload.empty() : builder.input;
        this.parentId = builder.parentId;
        this.conversationId = builder.conversationId;
        this.targetHint = builder.targetHint;
        this.clock = builder.clock;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    /**
     * 루트 WorkUnit 생성.
     *
     * @param kind 요청 유형
     * @param conversationId 대화 식별자
     * @param input 입력
     * @param clock 시각 공급원
     * @return PENDING 상태의 WorkUnit
     */
    public static WorkUnit root(WorkKind kind, ConversationId conversationId, Payload input, Clock clock) {
        return builder()
            .id(WorkUnitId.generate())
            .kind(kind)
            .conversationId(conversationId)
            .input(input)
            .clock(clock)
            .build();
    }

    /**
     * 이 WorkUnit의 위임 하위 작업 생성.
     *
     * <p>자식은 부모의 conversationId와 clock을 물려받고 kind는 DELEGATED_TASK가 됩니다.
     * 부모의 자식 목록에 붙이는 것은 호출자의 책임입니다.</p>
     *
     * @param childInput 하위 작업 입력
     * @param childTargetHint 대상 핸들러 힌트 (null 허용)
     * @return PENDING 상태의 자식 WorkUnit
     */
    public WorkUnit newChild(Payload childInput, String childTargetHint) {
        return builder()
            .id(WorkUnitId.generate())
            .kind(WorkKind.DELEGATED_TASK)
            .parentId(id)
            .conversationId(conversationId)
            .input(childInput)
            .targetHint(childTargetHint)
            .clock(clock)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ===== 상태 전이 =====

    /**
     * PENDING 또는 AWAITING_APPROVAL에서 RUNNING으로 전이.
     *
     * @throws IllegalStateException 허용되지 않는 전이
     */
    public synchronized void start() {
        transition(WorkStatus.RUNNING);
    }

    /**
     * RUNNING에서 AWAITING_APPROVAL로 전이.
     *
     * @throws IllegalStateException 허용되지 않는 전이
     */
    public synchronized void awaitApproval() {
        transition(WorkStatus.AWAITING_APPROVAL);
    }

    /**
     * 승인 신호 기록. 다음 핸들러 실행에서 {@link #isApproved()}가 true가 됩니다.
     */
    public synchronized void markApproved() {
        this.approved = true;
        touch();
    }

    public synchronized boolean complete() {
        return terminate(WorkStatus.COMPLETED, null);
    }

    public synchronized boolean fail(WorkError workError) {
        if (workError == null) {
            throw new IllegalArgumentException("workError cannot be null");
        }
        return terminate(WorkStatus.FAILED, workError);
    }

    public synchronized boolean cancel(String reason) {
        if (status.isTerminal()) {
            return false;
        }
        appendTraceInternal("cancelled", reason);
        return terminate(WorkStatus.CANCELLED, null);
    }

    private boolean terminate(WorkStatus target, WorkError workError) {
        if (status.isTerminal()) {
            return false;
        }
        StateTransition.validate(status, target);
        this.status = target;
        this.error = workError;
        touch();
        this.completedAt = updatedAt;
        return true;
    }

    private void transition(WorkStatus target) {
        StateTransition.validate(status, target);
        this.status = target;
        touch();
    }

    // ===== 실행 중 기록 =====

    /**
     * 핸들러 출력 기록. 종료 상태이면 무시합니다.
     *
     * @param value 출력
     * @return 기록 여부
     */
    public synchronized boolean recordOutput(Payload value) {
        if (status.isTerminal()) {
            return false;
        }
        this.output = value;
        touch();
        return true;
    }

    /**
     * 비용 누적. 종료 상태이면 무시합니다.
     *
     * @param amount 추가 비용 (음수 불가)
     * @return 누적 여부
     */
    public synchronized boolean addCost(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount cannot be null or negative");
        }
        if (status.isTerminal()) {
            return false;
        }
        this.cost = cost.add(amount);
        touch();
        return true;
    }

    public synchronized boolean appendTrace(String step, String detail) {
        if (status.isTerminal()) {
            return false;
        }
        appendTraceInternal(step, detail);
        return true;
    }

    private void appendTraceInternal(String step, String detail) {
        trace.add(new TraceEntry(clock.instant(), step, detail));
        touch();
    }

    /**
     * 위임된 자식 WorkUnit 연결.
     *
     * @param child 자식 (parentId가 이 WorkUnit이어야 함)
     * @return 연결 여부 (부모가 이미 종료되었으면 false)
     */
    public boolean attachChild(WorkUnit child) {
        if (child == null || !id.equals(child.parentId)) {
            throw new IllegalArgumentException("child must reference this unit as parent");
        }
        synchronized (this) {
            if (status.isTerminal()) {
                return false;
            }
            children.add(child);
            touch();
            return true;
        }
    }

    /**
     * state-load 단계가 불러온 대화 컨텍스트 기록. 핸들러는 {@link #getConversationState()}로 읽습니다.
     *
     * @param state 직렬화된 대화 컨텍스트 (없으면 빈 Payload)
     */
    public synchronized void recordConversationState(Payload state) {
        if (status.isTerminal()) {
            return;
        }
        this.conversationState = state == null ? Payload.empty() : state;
        touch();
    }

    public synchronized void assignHandler(String name) {
        this.handlerName = name;
        touch();
    }

    private void touch() {
        this.updatedAt = clock.instant();
    }

    // ===== 조회 =====

    public WorkUnitId getId() {
        return id;
    }

    public WorkKind getKind() {
        return kind;
    }

    public Payload getInput() {
        return input;
    }

    public Optional<WorkUnitId> getParentId() {
        return Optional.ofNullable(parentId);
    }

    public ConversationId getConversationId() {
        return conversationId;
    }

    public Optional<String> getTargetHint() {
        return Optional.ofNullable(targetHint);
    }

    public synchronized WorkStatus getStatus() {
        return status;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * 종료 시퀀스가 끝낸 실패인지 확인. 이런 기록은 같은 id의 재전달로 다시 실행될 수 있습니다.
     *
     * @return FAILED이고 오류 코드가 SHUTDOWN_INTERRUPTED이면 true
     */
    public synchronized boolean isInterruptedByShutdown() {
        return status == WorkStatus.FAILED && error != null && error.code() == ErrorCode.SHUTDOWN_INTERRUPTED;
    }

    public synchronized Optional<Payload> getOutput() {
        return Optional.ofNullable(output);
    }

    public synchronized Optional<WorkError> getError() {
        return Optional.ofNullable(error);
    }

    public synchronized BigDecimal getCost() {
        return cost;
    }

    /**
     * 이 WorkUnit과 모든 하위 위임의 비용 합계.
     *
     * @return 하위 트리 전체 비용
     */
    public BigDecimal getSubtreeCost() {
        BigDecimal total = getCost();
        for (WorkUnit child : children) {
            total = total.add(child.getSubtreeCost());
        }
        return total;
    }

    public synchronized List<TraceEntry> getTrace() {
        return List.copyOf(trace);
    }

    public List<WorkUnit> getChildren() {
        return List.copyOf(children);
    }

    public synchronized Payload getConversationState() {
        return conversationState;
    }

    public synchronized Optional<String> getHandlerName() {
        return Optional.ofNullable(handlerName);
    }

    public synchronized boolean isApproved() {
        return approved;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    @Override
    public synchronized String toString() {
        return "WorkUnit{id=" + id + ", kind=" + kind + ", status=" + status
            + (handlerName == null ? "" : ", handler=" + handlerName)
            + (error == null ? "" : ", error=" + error.code()) + "}";
    }

    /**
     * WorkUnit Builder.
     */
    public static final class Builder {

        private WorkUnitId id;
        private WorkKind kind;
        private Payload input;
        private WorkUnitId parentId;
        private ConversationId conversationId;
        private String targetHint;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder id(WorkUnitId id) {
            this.id = id;
            return this;
        }

        public Builder kind(WorkKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder input(Payload input) {
            this.input = input;
            return this;
        }

        public Builder parentId(WorkUnitId parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder conversationId(ConversationId conversationId) {
            this.conversationId = conversationId;
            return this;
        }

        public Builder targetHint(String targetHint) {
            this.targetHint = targetHint;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public WorkUnit build() {
            return new WorkUnit(this);
        }
    }
}
