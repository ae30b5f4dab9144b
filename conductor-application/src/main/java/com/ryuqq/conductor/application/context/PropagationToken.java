package com.ryuqq.conductor.application.context;

import java.util.Map;

/**
 * 캡처된 요청 범위 상관관계 정보.
 *
 * @param correlationId 상관관계 ID (없으면 null)
 * @param traceId 트레이스 ID (없으면 null)
 * @param baggage 그 외 바인딩된 키/값
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PropagationToken(String correlationId, String traceId, Map<String, String> baggage) {

    private static final PropagationToken EMPTY = new PropagationToken(null, null, Map.of());

    public PropagationToken {
        baggage = baggage == null ? Map.of() : Map.copyOf(baggage);
    }

    public static PropagationToken empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return correlationId == null && traceId == null && baggage.isEmpty();
    }
}
