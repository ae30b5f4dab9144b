package com.ryuqq.conductor.core.error;

/**
 * safety-check 단계가 입력을 차단했을 때 발생. 재시도 불가.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BlockedInputException extends ConductorException {

    private final String ruleName;

    public BlockedInputException(String ruleName) {
        super(ErrorCode.BLOCKED_INPUT, "Input blocked by safety rule: " + ruleName);
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }
}
