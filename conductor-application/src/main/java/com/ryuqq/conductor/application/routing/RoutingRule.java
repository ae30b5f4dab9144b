package com.ryuqq.conductor.application.routing;

import com.ryuqq.conductor.core.model.WorkUnit;

import java.util.Optional;

/**
 * 결정적 라우팅 규칙. 외부 호출 없이 빠르게 판단해야 합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RoutingRule {

    String name();

    /**
     * @param workUnit 라우팅 대상
     * @param registry 핸들러 레지스트리
     * @return 등록된 핸들러 이름 (판단 불가면 empty)
     */
    Optional<String> match(WorkUnit workUnit, HandlerRegistry registry);
}
