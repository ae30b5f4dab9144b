package com.ryuqq.conductor.core.event;

import java.util.Map;

/**
 * 구조화된 관측 이벤트.
 *
 * <p>모든 미들웨어 단계, 모든 resilience 계층 전이, 모든 Coordinator 결정(라우팅, 위임, 예산/마감 거부)이
 * 하나씩 발생시킵니다.</p>
 *
 * @param workUnitId WorkUnit ID (컨텍스트 밖이면 "-")
 * @param conversationId 대화 ID (컨텍스트 밖이면 "-")
 * @param name 단계/이벤트 이름 (예: stage.safety-check, breaker.open)
 * @param outcome 결과
 * @param durationMs 소요 시간 (밀리초)
 * @param attributes 추가 속성
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EngineEvent(
    String workUnitId,
    String conversationId,
    String name,
    EventOutcome outcome,
    long durationMs,
    Map<String, String> attributes
) {

    public static final String NONE = "-";

    public EngineEvent {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs cannot be negative");
        }
        workUnitId = workUnitId == null ? NONE : workUnitId;
        conversationId = conversationId == null ? NONE : conversationId;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
