package com.ryuqq.conductor.core.error;

import java.util.List;

/**
 * 위임 경로상의 조상 핸들러로 다시 위임하려 할 때 발생.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DelegationCycleDetectedException extends ConductorException {

    private final String handlerName;

    public DelegationCycleDetectedException(String handlerName, List<String> path) {
        super(ErrorCode.DELEGATION_CYCLE_DETECTED,
            "Handler '" + handlerName + "' is already on the delegation path " + path);
        this.handlerName = handlerName;
    }

    public String getHandlerName() {
        return handlerName;
    }
}
