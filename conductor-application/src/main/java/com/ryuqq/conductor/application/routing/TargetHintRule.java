package com.ryuqq.conductor.application.routing;

import com.ryuqq.conductor.core.model.WorkUnit;

import java.util.Optional;

/**
 * 위임 요청이 지정한 대상 핸들러를 그대로 사용. 미등록 이름이면 다음 규칙으로 넘어갑니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TargetHintRule implements RoutingRule {

    public static final String NAME = "target-hint";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<String> match(WorkUnit workUnit, HandlerRegistry registry) {
        return workUnit.getTargetHint().filter(registry::contains);
    }
}
