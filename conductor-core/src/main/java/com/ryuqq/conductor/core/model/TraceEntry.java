package com.ryuqq.conductor.core.model;

import java.time.Instant;

/**
 * WorkUnit 실행 중 기록되는 중간 단계 (reasoning/trace).
 *
 * @param at 기록 시각
 * @param step 단계 이름 (예: routed, handler.completed, delegation.rejected)
 * @param detail 상세 내용 (null 불가, 빈 문자열 허용)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TraceEntry(Instant at, String step, String detail) {

    public TraceEntry {
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        if (step == null || step.isBlank()) {
            throw new IllegalArgumentException("step cannot be null or blank");
        }
        if (detail == null) {
            detail = "";
        }
    }
}
