package com.ryuqq.conductor.adapter.runner;

import java.math.BigDecimal;

/**
 * DelegatingCoordinator 설정.
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxDepth: 한 경로에서 실행될 수 있는 최대 핸들러 수 (기본값: 5)</li>
 *   <li>defaultBudget: 루트 WorkUnit 기본 예산 (null이면 무제한)</li>
 *   <li>defaultDeadlineMs: 루트 WorkUnit 기본 마감 (0이면 없음)</li>
 *   <li>defaultHandler: 라우팅 폴백 핸들러 (기본값: "general")</li>
 *   <li>budgetPolicy: 예산 초과 시 형제 위임 정책 (기본값: BLOCK_NEW)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CoordinatorConfig(
    int maxDepth,
    BigDecimal defaultBudget,
    long defaultDeadlineMs,
    String defaultHandler,
    BudgetPolicy budgetPolicy
) {

    /**
     * 기본 설정 생성자.
     */
    public CoordinatorConfig() {
        this(5, null, 0, "general", BudgetPolicy.BLOCK_NEW);
    }

    public CoordinatorConfig {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive (current: " + maxDepth + ")");
        }
        if (defaultBudget != null && defaultBudget.signum() < 0) {
            throw new IllegalArgumentException("defaultBudget cannot be negative (current: " + defaultBudget + ")");
        }
        if (defaultDeadlineMs < 0) {
            throw new IllegalArgumentException(
                "defaultDeadlineMs cannot be negative (current: " + defaultDeadlineMs + ")");
        }
        if (defaultHandler == null || defaultHandler.isBlank()) {
            throw new IllegalArgumentException("defaultHandler cannot be null or blank");
        }
        if (budgetPolicy == null) {
            throw new IllegalArgumentException("budgetPolicy cannot be null");
        }
    }

    public CoordinatorConfig withMaxDepth(int maxDepth) {
        return new CoordinatorConfig(maxDepth, defaultBudget, defaultDeadlineMs, defaultHandler, budgetPolicy);
    }

    public CoordinatorConfig withDefaultBudget(BigDecimal defaultBudget) {
        return new CoordinatorConfig(maxDepth, defaultBudget, defaultDeadlineMs, defaultHandler, budgetPolicy);
    }

    public CoordinatorConfig withDefaultDeadlineMs(long defaultDeadlineMs) {
        return new CoordinatorConfig(maxDepth, defaultBudget, defaultDeadlineMs, defaultHandler, budgetPolicy);
    }

    public CoordinatorConfig withDefaultHandler(String defaultHandler) {
        return new CoordinatorConfig(maxDepth, defaultBudget, defaultDeadlineMs, defaultHandler, budgetPolicy);
    }

    public CoordinatorConfig withBudgetPolicy(BudgetPolicy budgetPolicy) {
        return new CoordinatorConfig(maxDepth, defaultBudget, defaultDeadlineMs, defaultHandler, budgetPolicy);
    }
}
