package com.ryuqq.conductor.application.middleware;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.core.model.Payload;
import com.ryuqq.conductor.core.spi.KeyValueStore;
import com.ryuqq.conductor.core.spi.ResilientCaller;

import java.util.Optional;

/**
 * 대화 컨텍스트 로드 단계.
 *
 * <p>저장소 호출은 "state-store" 의존성으로 resilience pipeline을 거칩니다. 실패하면 체인이 로그만 남기고
 * 빈 컨텍스트로 진행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateLoadStage implements Stage {

    public static final String NAME = "state-load";
    public static final String DEPENDENCY = "state-store";

    private final KeyValueStore store;
    private final ResilientCaller caller;
    private final ObjectMapper objectMapper;

    public StateLoadStage(KeyValueStore store, ResilientCaller caller, ObjectMapper objectMapper) {
        this.store = store;
        this.caller = caller;
        this.objectMapper = objectMapper;
    }

    static String key(Invocation invocation) {
        return "conversation:" + invocation.workUnit().getConversationId().getValue();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StagePhase phase() {
        return StagePhase.BEFORE;
    }

    @Override
    public void apply(Invocation invocation) throws Exception {
        Optional<String> stored = caller.execute(DEPENDENCY, () -> store.get(key(invocation)));
        if (stored.isEmpty()) {
            return;
        }
        ConversationMemory memory = ConversationMemory.fromJson(objectMapper, stored.get());
        invocation.memory(memory);
        invocation.workUnit().recordConversationState(Payload.of(stored.get()));
    }
}
