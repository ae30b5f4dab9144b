package com.ryuqq.conductor.core.event;

/**
 * 관측 이벤트 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventOutcome {
    SUCCESS,
    FAILURE,
    REJECTED,
    SKIPPED
}
