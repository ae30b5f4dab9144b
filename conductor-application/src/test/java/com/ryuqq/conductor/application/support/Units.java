package com.ryuqq.conductor.application.support;

import com.ryuqq.conductor.core.delegation.BudgetLedger;
import com.ryuqq.conductor.core.delegation.DelegationContext;
import com.ryuqq.conductor.core.model.ConversationId;
import com.ryuqq.conductor.core.model.Payload;
import com.ryuqq.conductor.core.model.WorkKind;
import com.ryuqq.conductor.core.model.WorkUnit;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * 테스트용 WorkUnit/DelegationContext 팩토리.
 */
public final class Units {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    private Units() {
    }

    public static WorkUnit running(String input) {
        WorkUnit unit = WorkUnit.root(WorkKind.USER_REQUEST, ConversationId.of("conv-1"), Payload.of(input), CLOCK);
        unit.start();
        return unit;
    }

    public static DelegationContext context(WorkUnit unit, long budget) {
        return DelegationContext.root(unit.getId(), "corr-1", BudgetLedger.of(BigDecimal.valueOf(budget)), null);
    }
}
