package com.ryuqq.conductor.application.gate;

import com.ryuqq.conductor.core.delegation.DelegationContext;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.model.WorkUnitId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 엔진 수락 게이트와 in-flight 루트 WorkUnit 추적.
 *
 * <p><strong>상태:</strong></p>
 * <ul>
 *   <li>healthy: 상위 intake가 새 작업을 보낼지 판단하는 readiness 신호</li>
 *   <li>accepting: false면 새 루트 WorkUnit을 거부</li>
 * </ul>
 *
 * <p>종료 시 Lifecycle Manager가 {@link #awaitDrain(long)}로 in-flight 작업이 끝나기를 기다리고,
 * 남은 작업은 {@link #inFlight()}로 찾아 실패 처리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EngineGate {

    private final Map<WorkUnitId, InFlight> inFlight = new LinkedHashMap<>();
    private boolean healthy;
    private boolean accepting;

    /**
     * in-flight 루트 WorkUnit과 그 위임 컨텍스트.
     *
     * @param workUnit 루트 WorkUnit
     * @param context 루트 위임 컨텍스트
     */
    public record InFlight(WorkUnit workUnit, DelegationContext context) {
    }

    public synchronized boolean isHealthy() {
        return healthy;
    }

    public synchronized boolean isAccepting() {
        return accepting;
    }

    public synchronized void markHealthy() {
        healthy = true;
    }

    public synchronized void markUnhealthy() {
        healthy = false;
    }

    public synchronized void startAccepting() {
        accepting = true;
    }

    public synchronized void stopAccepting() {
        accepting = false;
    }

    /**
     * 루트 WorkUnit 진입.
     *
     * @param workUnit 루트 WorkUnit
     * @param context 루트 위임 컨텍스트
     * @return 수락하면 true (수락 중지 또는 같은 id가 이미 실행 중이면 false)
     */
    public synchronized boolean tryEnter(WorkUnit workUnit, DelegationContext context) {
        if (!accepting || inFlight.containsKey(workUnit.getId())) {
            return false;
        }
        inFlight.put(workUnit.getId(), new InFlight(workUnit, context));
        return true;
    }

    public synchronized void exit(WorkUnitId id) {
        if (inFlight.remove(id) != null && inFlight.isEmpty()) {
            notifyAll();
        }
    }

    public synchronized Optional<InFlight> find(WorkUnitId id) {
        return Optional.ofNullable(inFlight.get(id));
    }

    public synchronized List<InFlight> inFlight() {
        return new ArrayList<>(inFlight.values());
    }

    public synchronized int inFlightCount() {
        return inFlight.size();
    }

    /**
     * in-flight 작업이 모두 끝날 때까지 대기.
     *
     * @param timeoutMs 최대 대기 시간
     * @return 시간 내에 비었으면 true
     * @throws InterruptedException 대기 중 인터럽트
     */
    public synchronized boolean awaitDrain(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!inFlight.isEmpty()) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }
}
