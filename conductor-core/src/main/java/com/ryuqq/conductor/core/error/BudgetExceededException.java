package com.ryuqq.conductor.core.error;

import java.math.BigDecimal;

/**
 * 루트 WorkUnit의 예산이 소진되어 위임이 거부될 때 발생.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BudgetExceededException extends ConductorException {

    public BudgetExceededException(BigDecimal remaining) {
        super(ErrorCode.BUDGET_EXCEEDED, "Budget exhausted (remaining: " + remaining.toPlainString() + ")");
    }
}
