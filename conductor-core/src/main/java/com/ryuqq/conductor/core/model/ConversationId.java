package com.ryuqq.conductor.core.model;

import java.util.UUID;

/**
 * 루트 WorkUnit과 그 모든 하위 위임 WorkUnit을 묶는 대화(conversation) 식별자.
 *
 * <p>intake 측이 생성하여 Coordinator에 전달하며, state-load/state-save 단계에서
 * 대화 메모리를 조회하는 키로 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConversationId {

    private final String value;

    private ConversationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ConversationId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("ConversationId length cannot exceed 128 characters");
        }
        this.value = value;
    }

    public static ConversationId of(String value) {
        return new ConversationId(value);
    }

    public static ConversationId generate() {
        return new ConversationId("conv-" + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConversationId that = (ConversationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
