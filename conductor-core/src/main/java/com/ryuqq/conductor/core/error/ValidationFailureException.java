package com.ryuqq.conductor.core.error;

/**
 * 핸들러 출력이 출력 계약을 만족하지 않을 때 발생.
 *
 * <p>output-normalization 단계가 잡아서 로그만 남기며, WorkUnit을 실패시키지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationFailureException extends ConductorException {

    public ValidationFailureException(String message) {
        super(ErrorCode.VALIDATION_FAILURE, message);
    }

    public ValidationFailureException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_FAILURE, message, cause);
    }
}
