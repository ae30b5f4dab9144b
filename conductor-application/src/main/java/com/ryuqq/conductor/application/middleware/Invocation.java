package com.ryuqq.conductor.application.middleware;

import com.ryuqq.conductor.core.delegation.DelegationContext;
import com.ryuqq.conductor.core.handler.HandlerResult;
import com.ryuqq.conductor.core.model.WorkUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * 핸들러 실행 한 번에 대한 미들웨어 체인 상태.
 *
 * <p>한 스레드에서만 사용되며 체인 실행이 끝나면 Coordinator가 결과를 읽습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Invocation {

    private final WorkUnit workUnit;
    private final DelegationContext context;
    private final String handlerName;
    private final List<MiddlewareOutcome> outcomes = new ArrayList<>();
    private ConversationMemory memory = ConversationMemory.empty();
    private HandlerResult result;
    private boolean budgetExceeded;

    public Invocation(WorkUnit workUnit, DelegationContext context, String handlerName) {
        if (workUnit == null) {
            throw new IllegalArgumentException("workUnit cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (handlerName == null || handlerName.isBlank()) {
            throw new IllegalArgumentException("handlerName cannot be null or blank");
        }
        this.workUnit = workUnit;
        this.context = context;
        this.handlerName = handlerName;
    }

    public WorkUnit workUnit() {
        return workUnit;
    }

    public DelegationContext context() {
        return context;
    }

    public String handlerName() {
        return handlerName;
    }

    public ConversationMemory memory() {
        return memory;
    }

    public void memory(ConversationMemory loaded) {
        this.memory = loaded == null ? ConversationMemory.empty() : loaded;
    }

    public HandlerResult result() {
        return result;
    }

    public boolean hasResult() {
        return result != null;
    }

    public void result(HandlerResult value) {
        this.result = value;
    }

    public boolean isBudgetExceeded() {
        return budgetExceeded;
    }

    public void markBudgetExceeded() {
        this.budgetExceeded = true;
    }

    void record(MiddlewareOutcome outcome) {
        outcomes.add(outcome);
    }

    public List<MiddlewareOutcome> outcomes() {
        return List.copyOf(outcomes);
    }
}
