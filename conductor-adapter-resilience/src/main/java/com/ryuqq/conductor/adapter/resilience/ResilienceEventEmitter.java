package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.context.ContextKeys;
import com.ryuqq.conductor.core.event.EngineEvent;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.spi.EventSink;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;

/**
 * resilience 계층 이벤트 발행기.
 *
 * <p>WorkUnit ID와 대화 ID는 MDC에서 읽습니다. Coordinator가 WorkUnit 실행 동안 MDC에 바인딩하므로
 * 호출 경로에 식별자를 넘길 필요가 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResilienceEventEmitter {

    public static final String DEPENDENCY = "dependency";

    private final EventSink sink;

    public ResilienceEventEmitter(EventSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
    }

    public void emit(String dependencyName, String name, EventOutcome outcome, long durationMs) {
        emit(dependencyName, name, outcome, durationMs, Map.of());
    }

    public void emit(String dependencyName, String name, EventOutcome outcome, long durationMs,
                     Map<String, String> extra) {
        Map<String, String> attributes = new HashMap<>(extra);
        attributes.put(DEPENDENCY, dependencyName);
        sink.emit(new EngineEvent(
            MDC.get(ContextKeys.WORK_UNIT_ID),
            MDC.get(ContextKeys.CONVERSATION_ID),
            name,
            outcome,
            Math.max(0, durationMs),
            attributes
        ));
    }
}
