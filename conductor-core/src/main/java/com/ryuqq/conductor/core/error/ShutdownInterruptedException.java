package com.ryuqq.conductor.core.error;

/**
 * 종료 과정에서 drain 타임아웃 안에 끝나지 못했거나, 수락이 중단된 뒤 들어온 작업에 사용.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ShutdownInterruptedException extends ConductorException {

    public ShutdownInterruptedException(String message) {
        super(ErrorCode.SHUTDOWN_INTERRUPTED, message);
    }
}
