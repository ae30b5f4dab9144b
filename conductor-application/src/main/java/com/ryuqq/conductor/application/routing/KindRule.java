package com.ryuqq.conductor.application.routing;

import com.ryuqq.conductor.core.model.WorkKind;
import com.ryuqq.conductor.core.model.WorkUnit;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * WorkKind별 고정 핸들러 매핑 (예: SCHEDULED_JOB → "scheduler").
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class KindRule implements RoutingRule {

    public static final String NAME = "kind";

    private final Map<WorkKind, String> handlersByKind;

    public KindRule(Map<WorkKind, String> handlersByKind) {
        if (handlersByKind == null) {
            throw new IllegalArgumentException("handlersByKind cannot be null");
        }
        this.handlersByKind = handlersByKind.isEmpty()
            ? new EnumMap<>(WorkKind.class)
            : new EnumMap<>(handlersByKind);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<String> match(WorkUnit workUnit, HandlerRegistry registry) {
        return Optional.ofNullable(handlersByKind.get(workUnit.getKind())).filter(registry::contains);
    }
}
