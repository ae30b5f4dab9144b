package com.ryuqq.conductor.core.delegation;

import com.ryuqq.conductor.core.model.WorkUnitId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 하나의 루트 실행과 그 위임 하위 트리에 속한 위임 컨텍스트.
 *
 * <p>불변 값 객체이며 위임마다 {@link #enter(String)}로 깊이가 1 증가한 새 인스턴스가 만들어집니다.
 * 예산 장부와 취소 신호는 루트 단위로 공유되는 가변 객체로, 모든 하위 컨텍스트가 같은 인스턴스를 참조합니다.</p>
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>depth: 현재 경로에서 실행된 핸들러 수 (루트 접수 시 0)</li>
 *   <li>visitedHandlers: 현재 경로의 조상 핸들러 (순서 유지, 순환 탐지용)</li>
 *   <li>correlationId: 추적용 상관관계 ID</li>
 *   <li>deadline: 루트 WorkUnit의 절대 마감 시각 (null이면 무제한)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DelegationContext {

    private final WorkUnitId rootId;
    private final int depth;
    private final List<String> visitedHandlers;
    private final String correlationId;
    private final Instant deadline;
    private final BudgetLedger ledger;
    private final CancellationSignal cancellation;

    private DelegationContext(WorkUnitId rootId, int depth, List<String> visitedHandlers, String correlationId,
                              Instant deadline, BudgetLedger ledger, CancellationSignal cancellation) {
        this.rootId = rootId;
        this.depth = depth;
        this.visitedHandlers = visitedHandlers;
        this.correlationId = correlationId;
        this.deadline = deadline;
        this.ledger = ledger;
        this.cancellation = cancellation;
    }

    /**
     * 루트 WorkUnit 접수 시 depth 0 컨텍스트 생성.
     *
     * @param rootId 루트 WorkUnit ID
     * @param correlationId 상관관계 ID
     * @param ledger 예산 장부
     * @param deadline 절대 마감 시각 (null이면 무제한)
     * @return depth 0 컨텍스트
     */
    public static DelegationContext root(WorkUnitId rootId, String correlationId, BudgetLedger ledger,
                                         Instant deadline) {
        if (rootId == null) {
            throw new IllegalArgumentException("rootId cannot be null");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        return new DelegationContext(rootId, 0, List.of(), correlationId, deadline, ledger,
            new CancellationSignal());
    }

    /**
     * 핸들러 실행 진입. depth를 1 증가시키고 핸들러를 방문 경로에 추가한 새 컨텍스트를 반환합니다.
     *
     * @param handlerName 실행할 핸들러 이름
     * @return 증가된 컨텍스트
     */
    public DelegationContext enter(String handlerName) {
        if (handlerName == null || handlerName.isBlank()) {
            throw new IllegalArgumentException("handlerName cannot be null or blank");
        }
        List<String> path = new ArrayList<>(visitedHandlers);
        path.add(handlerName);
        return new DelegationContext(rootId, depth + 1, Collections.unmodifiableList(path), correlationId,
            deadline, ledger, cancellation);
    }

    public boolean hasVisited(String handlerName) {
        return visitedHandlers.contains(handlerName);
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * 마감 시각 경과 여부.
     *
     * @param now 현재 시각
     * @return 마감 시각이 있고 now가 그 이후이면 true
     */
    public boolean isExpired(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }

    public BigDecimal budgetRemaining() {
        return ledger.remaining();
    }

    public WorkUnitId getRootId() {
        return rootId;
    }

    public int getDepth() {
        return depth;
    }

    public List<String> getVisitedHandlers() {
        return visitedHandlers;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public BudgetLedger getLedger() {
        return ledger;
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }

    @Override
    public String toString() {
        return "DelegationContext{root=" + rootId + ", depth=" + depth + ", path=" + visitedHandlers
            + ", correlationId=" + correlationId + "}";
    }
}
