package com.ryuqq.conductor.core.error;

import java.time.Instant;

/**
 * 루트 WorkUnit의 절대 마감 시각이 지났을 때 발생. 하위 트리 전체가 실패 처리됩니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DeadlineExceededException extends ConductorException {

    public DeadlineExceededException(Instant deadline) {
        super(ErrorCode.DEADLINE_EXCEEDED, "Deadline exceeded: " + deadline);
    }
}
