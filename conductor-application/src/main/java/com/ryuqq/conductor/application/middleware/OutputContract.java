package com.ryuqq.conductor.application.middleware;

import com.ryuqq.conductor.core.error.ValidationFailureException;
import com.ryuqq.conductor.core.model.Payload;

/**
 * 핸들러 출력 계약.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OutputContract {

    /**
     * 원본 출력을 검증하고 정규화.
     *
     * @param raw 핸들러 원본 출력
     * @return 정규화된 출력
     * @throws ValidationFailureException 계약 위반
     */
    Payload normalize(Payload raw);

    /**
     * 출력을 그대로 통과시키는 계약.
     *
     * @return pass-through 계약
     */
    static OutputContract passThrough() {
        return raw -> raw;
    }

    /**
     * 앞뒤 공백을 제거하고 빈 출력을 거부하는 텍스트 계약.
     *
     * @return 텍스트 계약
     */
    static OutputContract nonBlankText() {
        return raw -> {
            String trimmed = raw.asText().strip();
            if (trimmed.isEmpty()) {
                throw new ValidationFailureException("Output is blank");
            }
            return Payload.of(trimmed);
        };
    }
}
