package com.ryuqq.conductor.application.middleware;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * conversationId별로 저장되는 최근 실행 기록.
 *
 * <p>저장 형식은 {@link ConversationTurn} 배열의 JSON입니다. 최대 개수를 넘으면 오래된 기록부터 버립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConversationMemory {

    private static final TypeReference<List<ConversationTurn>> TURNS = new TypeReference<>() {
    };
    private static final ConversationMemory EMPTY = new ConversationMemory(List.of());

    private final List<ConversationTurn> turns;

    private ConversationMemory(List<ConversationTurn> turns) {
        this.turns = List.copyOf(turns);
    }

    public static ConversationMemory empty() {
        return EMPTY;
    }

    /**
     * JSON에서 복원.
     *
     * @param mapper Jackson ObjectMapper
     * @param json 저장된 JSON
     * @return ConversationMemory
     * @throws JsonProcessingException 형식 오류
     */
    public static ConversationMemory fromJson(ObjectMapper mapper, String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        List<ConversationTurn> parsed = mapper.readValue(json, TURNS);
        return parsed == null ? EMPTY : new ConversationMemory(parsed);
    }

    public String toJson(ObjectMapper mapper) throws JsonProcessingException {
        return mapper.writeValueAsString(turns);
    }

    /**
     * 기록을 추가한 새 인스턴스.
     *
     * @param turn 추가할 기록
     * @param maxTurns 보관할 최대 개수
     * @return 새 ConversationMemory
     */
    public ConversationMemory append(ConversationTurn turn, int maxTurns) {
        List<ConversationTurn> next = new ArrayList<>(turns);
        next.add(turn);
        while (next.size() > maxTurns) {
            next.remove(0);
        }
        return new ConversationMemory(next);
    }

    public List<ConversationTurn> turns() {
        return turns;
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }
}
