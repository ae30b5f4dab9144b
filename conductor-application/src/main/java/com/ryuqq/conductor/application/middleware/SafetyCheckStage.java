package com.ryuqq.conductor.application.middleware;

import com.ryuqq.conductor.core.error.BlockedInputException;

import java.util.List;

/**
 * 입력 안전성 검사 단계.
 *
 * <p>규칙에 걸리면 {@link BlockedInputException}으로 실행을 중단하므로, 핸들러와 그 안의 유료 외부 호출은
 * 일어나지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SafetyCheckStage implements Stage {

    public static final String NAME = "safety-check";

    private final List<SafetyRule> rules;

    public SafetyCheckStage(List<SafetyRule> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        this.rules = List.copyOf(rules);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StagePhase phase() {
        return StagePhase.BEFORE;
    }

    @Override
    public boolean abortsOnFailure() {
        return true;
    }

    @Override
    public void apply(Invocation invocation) {
        String text = invocation.workUnit().getInput().asText();
        for (SafetyRule rule : rules) {
            if (rule.matches(text)) {
                throw new BlockedInputException(rule.name());
            }
        }
    }
}
