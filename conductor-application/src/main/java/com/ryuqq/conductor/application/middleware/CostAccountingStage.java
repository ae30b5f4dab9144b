package com.ryuqq.conductor.application.middleware;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.conductor.core.delegation.BudgetLedger;
import com.ryuqq.conductor.core.handler.Usage;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.spi.KeyValueStore;
import com.ryuqq.conductor.core.spi.ResilientCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * 비용/사용량 집계 단계.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>핸들러 결과의 비용을 WorkUnit.cost에 누적</li>
 *   <li>루트 예산 장부에서 차감, 잔액이 음수이면 예산 초과로 표시</li>
 *   <li>"cost-store" 의존성으로 비용 기록 저장 (실패해도 위 두 단계는 되돌리지 않음)</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CostAccountingStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(CostAccountingStage.class);

    public static final String NAME = "cost-accounting";
    public static final String DEPENDENCY = "cost-store";

    private final KeyValueStore store;
    private final ResilientCaller caller;
    private final ObjectMapper objectMapper;

    public CostAccountingStage(KeyValueStore store, ResilientCaller caller, ObjectMapper objectMapper) {
        this.store = store;
        this.caller = caller;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StagePhase phase() {
        return StagePhase.AFTER;
    }

    @Override
    public void apply(Invocation invocation) throws Exception {
        WorkUnit unit = invocation.workUnit();
        Usage usage = invocation.result().usage();
        BudgetLedger ledger = invocation.context().getLedger();

        // 1. WorkUnit 누적
        unit.addCost(usage.cost());

        // 2. 예산 차감 및 확인
        BigDecimal remaining = ledger.charge(usage.cost());
        if (ledger.isOverdrawn()) {
            invocation.markBudgetExceeded();
            log.warn("Budget exceeded: workUnitId={}, handler={}, cost={}, remaining={}",
                unit.getId(), invocation.handlerName(), usage.cost(), remaining);
        }

        // 3. 비용 기록 저장
        ObjectNode record = objectMapper.createObjectNode()
            .put("workUnitId", unit.getId().getValue())
            .put("rootId", invocation.context().getRootId().getValue())
            .put("handler", invocation.handlerName())
            .put("cost", usage.cost())
            .put("inputTokens", usage.inputTokens())
            .put("outputTokens", usage.outputTokens())
            .put("rootSpent", ledger.spent());
        String json = objectMapper.writeValueAsString(record);
        caller.execute(DEPENDENCY, () -> {
            store.put("cost:" + unit.getId().getValue(), json);
            return null;
        });
    }
}
