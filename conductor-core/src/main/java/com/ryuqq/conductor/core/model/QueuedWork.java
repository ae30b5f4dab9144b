package com.ryuqq.conductor.core.model;

import java.util.Map;

/**
 * 큐를 통해 다른 워커로 넘어가는 WorkUnit 요청.
 *
 * <p>큐 경계는 메모리를 공유하지 않으므로 상관관계(correlation) 컨텍스트가
 * 자동으로 전파되지 않습니다. 발행 측이 캡처한 전파 토큰의 필드를
 * {@code context}에 명시적으로 담아야 하며, 소비 측은 로깅이나 위임 전에
 * 이를 복원해야 합니다.</p>
 *
 * @param id 발행 시점에 확정된 WorkUnit ID (재전달 시 멱등성 키)
 * @param kind 요청 유형
 * @param conversationId 대화 식별자
 * @param input 입력 Payload
 * @param targetHint 대상 핸들러 힌트 (null 허용)
 * @param context 직렬화된 전파 토큰 필드
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueuedWork(
    WorkUnitId id,
    WorkKind kind,
    ConversationId conversationId,
    Payload input,
    String targetHint,
    Map<String, String> context
) {

    public QueuedWork {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (conversationId == null) {
            throw new IllegalArgumentException("conversationId cannot be null");
        }
        input = input == null ? Payload.empty() : input;
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
