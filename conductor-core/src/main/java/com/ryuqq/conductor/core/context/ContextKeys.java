package com.ryuqq.conductor.core.context;

/**
 * 요청 범위 상관관계 정보를 담는 MDC 키.
 *
 * <p>큐 메시지의 전파 토큰 직렬화 시에도 같은 키를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ContextKeys {

    public static final String CORRELATION_ID = "correlationId";
    public static final String TRACE_ID = "traceId";
    public static final String WORK_UNIT_ID = "workUnitId";
    public static final String CONVERSATION_ID = "conversationId";

    /** 큐 메시지에서 사용자 정의 baggage 키에 붙는 접두사. */
    public static final String BAGGAGE_PREFIX = "baggage.";

    private ContextKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
