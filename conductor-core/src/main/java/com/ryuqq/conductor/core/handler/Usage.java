package com.ryuqq.conductor.core.handler;

import java.math.BigDecimal;

/**
 * 핸들러 실행의 비용/사용량 메타데이터.
 *
 * @param cost 비용 (예산 단위)
 * @param inputTokens 입력 토큰 수
 * @param outputTokens 출력 토큰 수
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Usage(BigDecimal cost, long inputTokens, long outputTokens) {

    private static final Usage NONE = new Usage(BigDecimal.ZERO, 0, 0);

    public Usage {
        if (cost == null || cost.signum() < 0) {
            throw new IllegalArgumentException("cost cannot be null or negative");
        }
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("token counts cannot be negative");
        }
    }

    public static Usage none() {
        return NONE;
    }

    public static Usage ofCost(long cost) {
        return new Usage(BigDecimal.valueOf(cost), 0, 0);
    }
}
