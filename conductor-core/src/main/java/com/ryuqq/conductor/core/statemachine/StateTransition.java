package com.ryuqq.conductor.core.statemachine;

/**
 * WorkUnit 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING, FAILED, CANCELLED</li>
 *   <li>RUNNING → AWAITING_APPROVAL, COMPLETED, FAILED, CANCELLED</li>
 *   <li>AWAITING_APPROVAL → RUNNING, FAILED, CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 가능 여부 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이면 true
     */
    public static boolean isAllowed(WorkStatus from, WorkStatus to) {
        if (from == null || to == null || from.isTerminal()) {
            return false;
        }
        return switch (from) {
            case PENDING -> to == WorkStatus.RUNNING || to == WorkStatus.FAILED || to == WorkStatus.CANCELLED;
            case RUNNING -> to == WorkStatus.AWAITING_APPROVAL || to.isTerminal();
            case AWAITING_APPROVAL -> to == WorkStatus.RUNNING || to == WorkStatus.FAILED || to == WorkStatus.CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public static void validate(WorkStatus from, WorkStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }
}
