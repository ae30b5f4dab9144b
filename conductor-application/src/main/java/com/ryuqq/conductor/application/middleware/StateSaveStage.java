package com.ryuqq.conductor.application.middleware;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.core.spi.KeyValueStore;
import com.ryuqq.conductor.core.spi.ResilientCaller;

import java.time.Clock;

/**
 * 대화 컨텍스트 저장 단계. 실패해도 완료된 WorkUnit에는 영향이 없습니다.
 *
 * <p>저장 직전에 현재 값을 다시 읽어 기록을 추가합니다. state-load 결과는 사용하지 않으므로 로드 실패나
 * 핸들러 안에서 위임된 하위 작업이 먼저 저장한 기록을 덮어쓰지 않습니다. 다시 읽기가 실패하면 저장도
 * 하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateSaveStage implements Stage {

    public static final String NAME = "state-save";

    private final KeyValueStore store;
    private final ResilientCaller caller;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxTurns;

    public StateSaveStage(KeyValueStore store, ResilientCaller caller, ObjectMapper objectMapper, Clock clock,
                          int maxTurns) {
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be positive");
        }
        this.store = store;
        this.caller = caller;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxTurns = maxTurns;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StagePhase phase() {
        return StagePhase.AFTER;
    }

    @Override
    public void apply(Invocation invocation) throws Exception {
        ConversationTurn turn = new ConversationTurn(
            invocation.workUnit().getId().getValue(),
            invocation.handlerName(),
            invocation.workUnit().getInput().asText(),
            invocation.result().output().asText(),
            clock.instant().toString()
        );
        String key = StateLoadStage.key(invocation);
        ConversationMemory updated = caller.execute(StateLoadStage.DEPENDENCY, () -> {
            ConversationMemory current = ConversationMemory.fromJson(objectMapper, store.get(key).orElse(null));
            ConversationMemory next = current.append(turn, maxTurns);
            store.put(key, next.toJson(objectMapper));
            return next;
        });
        invocation.memory(updated);
    }
}
