package com.ryuqq.conductor.application.observability;

import com.ryuqq.conductor.core.event.EngineEvent;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.model.WorkUnit;

import java.util.Map;

/**
 * WorkUnit 기준 {@link EngineEvent} 생성 헬퍼.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EngineEvents {

    private EngineEvents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static EngineEvent of(WorkUnit unit, String name, EventOutcome outcome, long durationMs) {
        return of(unit, name, outcome, durationMs, Map.of());
    }

    public static EngineEvent of(WorkUnit unit, String name, EventOutcome outcome, long durationMs,
                                 Map<String, String> attributes) {
        return new EngineEvent(
            unit.getId().getValue(),
            unit.getConversationId().getValue(),
            name,
            outcome,
            Math.max(0, durationMs),
            attributes
        );
    }
}
