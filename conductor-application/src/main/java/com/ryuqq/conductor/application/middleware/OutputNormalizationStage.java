package com.ryuqq.conductor.application.middleware;

import java.util.function.Function;

/**
 * 출력 정규화 단계.
 *
 * <p>핸들러별 {@link OutputContract}로 결과를 검증합니다. 계약 위반({@code ValidationFailureException})은
 * 체인이 로그로 남기고 원본 출력을 그대로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OutputNormalizationStage implements Stage {

    public static final String NAME = "output-normalization";

    private final Function<String, OutputContract> contracts;

    /**
     * @param contracts 핸들러 이름 → 출력 계약 (null 반환 시 pass-through)
     */
    public OutputNormalizationStage(Function<String, OutputContract> contracts) {
        if (contracts == null) {
            throw new IllegalArgumentException("contracts cannot be null");
        }
        this.contracts = contracts;
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
    public void apply(Invocation invocation) {
        OutputContract contract = contracts.apply(invocation.handlerName());
        if (contract == null) {
            return;
        }
        invocation.result(invocation.result().withOutput(contract.normalize(invocation.result().output())));
    }
}
