package com.ryuqq.conductor.core.error;

/**
 * 위임 깊이가 설정된 최대값을 넘을 때 발생. 핸들러는 호출되지 않습니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DelegationDepthExceededException extends ConductorException {

    public DelegationDepthExceededException(int attemptedDepth, int maxDepth) {
        super(ErrorCode.DELEGATION_DEPTH_EXCEEDED,
            "Delegation depth " + attemptedDepth + " exceeds maximum " + maxDepth);
    }
}
