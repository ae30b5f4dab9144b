package com.ryuqq.conductor.core.model;

/**
 * WorkUnit 입력/출력의 직렬화된 형태.
 *
 * <p>엔진은 Payload의 내용을 해석하지 않습니다. 형식(일반 텍스트, JSON 등)은
 * 핸들러와 출력 계약(output contract)이 결정합니다. safety-check 단계만
 * {@link #asText()}로 원문을 검사합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. null 값은 빈 Payload로 취급됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload("");

    private final String value;

    private Payload(String value) {
        this.value = value;
    }

    /**
     * Payload 생성.
     *
     * @param value 직렬화된 값 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload of(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY;
        }
        return new Payload(value);
    }

    public static Payload empty() {
        return EMPTY;
    }

    public String getValue() {
        return value;
    }

    /**
     * 검사/로깅용 원문 (null 대신 빈 문자열).
     *
     * @return 원문 텍스트
     */
    public String asText() {
        return value == null ? "" : value;
    }

    public boolean isEmpty() {
        return value == null || value.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return asText().equals(((Payload) o).asText());
    }

    @Override
    public int hashCode() {
        return asText().hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + asText().length() + " chars}";
    }
}
