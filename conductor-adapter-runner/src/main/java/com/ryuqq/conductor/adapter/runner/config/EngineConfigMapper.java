package com.ryuqq.conductor.adapter.runner.config;

import com.ryuqq.conductor.adapter.resilience.DependencyConfig;
import com.ryuqq.conductor.adapter.resilience.RetryConfig;
import com.ryuqq.conductor.adapter.runner.BudgetPolicy;
import com.ryuqq.conductor.adapter.runner.CoordinatorConfig;
import com.ryuqq.conductor.adapter.runner.QueueWorkerConfig;
import com.ryuqq.conductor.adapter.runner.lifecycle.LifecycleConfig;
import com.ryuqq.conductor.application.middleware.SafetyRule;
import com.ryuqq.conductor.core.protection.BulkheadConfig;
import com.ryuqq.conductor.core.model.WorkKind;
import com.ryuqq.conductor.core.protection.CircuitBreakerConfig;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 검증된 {@link EngineProperties}를 불변 설정 record로 변환.
 *
 * <p>{@link StartupValidator}를 통과한 설정만 넘겨야 합니다. 검증 전 값이 들어오면
 * 각 record의 compact constructor가 IllegalArgumentException을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EngineConfigMapper {

    private EngineConfigMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static List<DependencyConfig> dependencies(EngineProperties properties) {
        List<DependencyConfig> configs = new ArrayList<>();
        for (EngineProperties.DependencySection section : properties.getDependencies()) {
            configs.add(dependency(section));
        }
        return configs;
    }

    /**
     * 의존성 하나 변환. 재시도 값은 지정된 항목만 기본값을 덮어씁니다.
     */
    public static DependencyConfig dependency(EngineProperties.DependencySection section) {
        RetryConfig defaults = new RetryConfig();
        RetryConfig retry = new RetryConfig(
            section.getMaxAttempts() != null ? section.getMaxAttempts() : defaults.maxAttempts(),
            section.getBaseDelayMs() != null ? section.getBaseDelayMs() : defaults.baseDelayMs(),
            section.getMaxDelayMs() != null ? section.getMaxDelayMs()
                : Math.max(defaults.maxDelayMs(), section.getBaseDelayMs() != null ? section.getBaseDelayMs() : 0L),
            section.getJitterFactor() != null ? section.getJitterFactor() : defaults.jitterFactor(),
            section.getTransientErrors() != null
                ? new LinkedHashSet<>(section.getTransientErrors())
                : defaults.transientErrors()
        );
        return new DependencyConfig(
            section.getName(),
            new CircuitBreakerConfig(section.getFailureThreshold(), section.getOpenDurationMs()),
            retry,
            new BulkheadConfig(section.getBulkheadCapacity(), section.getBulkheadMaxWaitMs()),
            section.getAttemptTimeoutMs()
        );
    }

    public static CoordinatorConfig coordinator(EngineProperties properties) {
        EngineProperties.EngineSection engine = properties.getEngine();
        BigDecimal budget = engine.getDefaultBudget() == null ? null : BigDecimal.valueOf(engine.getDefaultBudget());
        return new CoordinatorConfig(
            engine.getMaxDepth(),
            budget,
            engine.getDefaultDeadlineMs(),
            engine.getDefaultHandler(),
            BudgetPolicy.valueOf(engine.getBudgetExceededPolicy())
        );
    }

    public static LifecycleConfig lifecycle(EngineProperties properties) {
        EngineProperties.LifecycleSection section = properties.getLifecycle();
        return new LifecycleConfig(section.getPropagationDelayMs(), section.getDrainTimeoutMs());
    }

    public static QueueWorkerConfig queue(EngineProperties properties) {
        EngineProperties.QueueSection section = properties.getQueue();
        return new QueueWorkerConfig(section.getPollingIntervalMs(), section.getBatchSize(), section.getRetryDelayMs());
    }

    public static List<SafetyRule> safetyRules(EngineProperties properties) {
        List<SafetyRule> rules = new ArrayList<>();
        if (properties.getSafety() == null || properties.getSafety().getRules() == null) {
            return rules;
        }
        for (EngineProperties.SafetyRuleSection section : properties.getSafety().getRules()) {
            rules.add(SafetyRule.of(section.getName(), section.getPattern()));
        }
        return rules;
    }

    public static Map<WorkKind, String> handlersByKind(EngineProperties properties) {
        Map<WorkKind, String> handlers = new EnumMap<>(WorkKind.class);
        if (properties.getRouting() == null || properties.getRouting().getKinds() == null) {
            return handlers;
        }
        properties.getRouting().getKinds().forEach((kind, handler) -> handlers.put(WorkKind.valueOf(kind), handler));
        return handlers;
    }
}
