package com.ryuqq.conductor.core.model;

import java.util.UUID;

/**
 * WorkUnit의 전역 고유 식별자.
 *
 * <p>Coordinator가 intake 시점에 발급하며, 위임 트리(parent → child) 추적과
 * 종료된 WorkUnit의 재처리(replay) 감지에 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 콜론(:)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkUnitId {

    private static final int MAX_LENGTH = 128;

    private final String value;

    private WorkUnitId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WorkUnitId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("WorkUnitId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_:]+$")) {
            throw new IllegalArgumentException(
                "WorkUnitId contains invalid characters. Only alphanumeric, hyphen, underscore and colon are allowed");
        }
        this.value = value;
    }

    /**
     * 주어진 값으로 WorkUnitId 생성.
     *
     * @param value 식별자 값
     * @return WorkUnitId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static WorkUnitId of(String value) {
        return new WorkUnitId(value);
    }

    /**
     * UUID 기반 신규 식별자 발급.
     *
     * @return 새 WorkUnitId
     */
    public static WorkUnitId generate() {
        return new WorkUnitId("wu-" + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkUnitId that = (WorkUnitId) o;
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
