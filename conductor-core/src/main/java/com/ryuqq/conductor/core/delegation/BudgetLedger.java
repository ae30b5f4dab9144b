package com.ryuqq.conductor.core.delegation;

import java.math.BigDecimal;

/**
 * 루트 WorkUnit과 그 위임 하위 트리 전체가 공유하는 예산 장부.
 *
 * <p>병렬 형제 위임이 동시에 차감할 수 있으므로 모든 연산은 동기화됩니다.
 * 잔액은 음수가 될 수 있으며, 음수 잔액은 초과 사용을 의미합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BudgetLedger {

    private final BigDecimal limit;
    private BigDecimal spent = BigDecimal.ZERO;

    private BudgetLedger(BigDecimal limit) {
        this.limit = limit;
    }

    /**
     * 한도가 있는 장부 생성.
     *
     * @param limit 예산 한도 (음수 불가)
     * @return BudgetLedger
     */
    public static BudgetLedger of(BigDecimal limit) {
        if (limit == null || limit.signum() < 0) {
            throw new IllegalArgumentException("limit cannot be null or negative");
        }
        return new BudgetLedger(limit);
    }

    /**
     * 한도 없는 장부. 잔액은 항상 양수로 보고됩니다.
     *
     * @return 무제한 BudgetLedger
     */
    public static BudgetLedger unlimited() {
        return new BudgetLedger(null);
    }

    /**
     * 비용 차감.
     *
     * @param amount 차감할 비용 (음수 불가)
     * @return 차감 후 잔액
     */
    public synchronized BigDecimal charge(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount cannot be null or negative");
        }
        spent = spent.add(amount);
        return remaining();
    }

    public synchronized BigDecimal remaining() {
        if (limit == null) {
            return BigDecimal.valueOf(Long.MAX_VALUE);
        }
        return limit.subtract(spent);
    }

    public synchronized BigDecimal spent() {
        return spent;
    }

    /**
     * 새로운 위임을 거부해야 하는지 (잔액 ≤ 0).
     *
     * @return 소진 여부
     */
    public synchronized boolean isExhausted() {
        return limit != null && remaining().signum() <= 0;
    }

    /**
     * 한도를 넘어 사용했는지 (잔액 &lt; 0).
     *
     * @return 초과 여부
     */
    public synchronized boolean isOverdrawn() {
        return limit != null && remaining().signum() < 0;
    }

    public boolean isUnlimited() {
        return limit == null;
    }
}
