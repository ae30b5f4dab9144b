package com.ryuqq.conductor.adapter.runner.config;

import com.ryuqq.conductor.adapter.runner.BudgetPolicy;
import com.ryuqq.conductor.adapter.runner.lifecycle.StartupCheck;
import com.ryuqq.conductor.adapter.runner.lifecycle.StartupValidationException;
import com.ryuqq.conductor.application.middleware.CostAccountingStage;
import com.ryuqq.conductor.application.middleware.StateLoadStage;
import com.ryuqq.conductor.application.routing.HandlerRegistry;
import com.ryuqq.conductor.application.routing.Router;
import com.ryuqq.conductor.core.model.WorkKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 시작 검증기 (fail-closed).
 *
 * <p>설정된 모든 의존성이 실제 보호 파라미터를 갖고 있는지 확인합니다. 누락되거나 0 이하인 값은
 * 자리표시자로 간주하며, 위반을 모두 모아 한 번에 {@link StartupValidationException}으로 던집니다.</p>
 *
 * <p><strong>검증 항목:</strong></p>
 * <ul>
 *   <li>의존성: name, failureThreshold, openDurationMs, bulkheadCapacity, bulkheadMaxWaitMs, attemptTimeoutMs</li>
 *   <li>재시도 값은 선택이지만, 지정했다면 범위가 맞아야 함</li>
 *   <li>필수 의존성: state-store, cost-store (분류기 사용 시 classifier)</li>
 *   <li>engine: maxDepth, defaultBudget, budgetExceededPolicy, defaultHandler 등록 여부</li>
 *   <li>routing.kinds: 알려진 WorkKind, 등록된 핸들러</li>
 *   <li>safety 규칙 정규식, lifecycle/workers/queue 범위</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StartupValidator implements StartupCheck {

    private static final Logger log = LoggerFactory.getLogger(StartupValidator.class);

    private final EngineProperties properties;
    private final HandlerRegistry handlers;

    public StartupValidator(EngineProperties properties, HandlerRegistry handlers) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        this.properties = properties;
        this.handlers = handlers;
    }

    /**
     * 필수 의존성 이름.
     *
     * @param classifierEnabled 분류기 사용 여부
     * @return 반드시 설정되어야 하는 의존성 이름
     */
    public static Set<String> requiredDependencies(boolean classifierEnabled) {
        Set<String> required = new LinkedHashSet<>();
        required.add(StateLoadStage.DEPENDENCY);
        required.add(CostAccountingStage.DEPENDENCY);
        if (classifierEnabled) {
            required.add(Router.CLASSIFIER_DEPENDENCY);
        }
        return required;
    }

    /**
     * 위반 목록 계산 (예외 없음).
     *
     * @return 위반 메시지 목록, 문제가 없으면 빈 목록
     */
    public List<String> validate() {
        List<String> violations = new ArrayList<>();
        EngineProperties.EngineSection engine = properties.getEngine();
        if (engine == null) {
            violations.add("engine section is missing");
        } else {
            validateEngine(engine, violations);
        }
        validateDependencies(engine, violations);
        validateRouting(violations);
        validateSafety(violations);
        validateRuntime(violations);
        return violations;
    }

    @Override
    public void verify() {
        List<String> violations = validate();
        if (violations.isEmpty()) {
            log.info("Startup validation passed: dependencies={}, handlers={}",
                properties.getDependencies() == null ? 0 : properties.getDependencies().size(), handlers.names());
            return;
        }
        for (String violation : violations) {
            log.error("Startup validation violation: {}", violation);
        }
        throw new StartupValidationException(violations);
    }

    private void validateEngine(EngineProperties.EngineSection engine, List<String> violations) {
        if (engine.getMaxDepth() < 1) {
            violations.add("engine.maxDepth must be >= 1 (current: " + engine.getMaxDepth() + ")");
        }
        if (engine.getDefaultBudget() != null && engine.getDefaultBudget() < 0) {
            violations.add("engine.defaultBudget cannot be negative (current: " + engine.getDefaultBudget() + ")");
        }
        if (engine.getDefaultDeadlineMs() < 0) {
            violations.add("engine.defaultDeadlineMs cannot be negative (current: " + engine.getDefaultDeadlineMs() + ")");
        }
        if (engine.getMaxConversationTurns() < 1) {
            violations.add("engine.maxConversationTurns must be >= 1 (current: " + engine.getMaxConversationTurns() + ")");
        }
        try {
            BudgetPolicy.valueOf(String.valueOf(engine.getBudgetExceededPolicy()));
        } catch (IllegalArgumentException e) {
            violations.add("engine.budgetExceededPolicy is invalid: " + engine.getBudgetExceededPolicy());
        }
        String defaultHandler = engine.getDefaultHandler();
        if (defaultHandler == null || defaultHandler.isBlank()) {
            violations.add("engine.defaultHandler is missing");
        } else if (!handlers.contains(defaultHandler)) {
            violations.add("engine.defaultHandler is not registered: " + defaultHandler);
        }
    }

    private void validateDependencies(EngineProperties.EngineSection engine, List<String> violations) {
        List<EngineProperties.DependencySection> dependencies = properties.getDependencies() == null
            ? List.of()
            : properties.getDependencies();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < dependencies.size(); i++) {
            EngineProperties.DependencySection dependency = dependencies.get(i);
            if (dependency == null) {
                violations.add("dependencies[" + i + "] is empty");
                continue;
            }
            String name = dependency.getName();
            if (name == null || name.isBlank()) {
                violations.add("dependencies[" + i + "].name is missing");
                continue;
            }
            if (!seen.add(name)) {
                violations.add("dependency '" + name + "' is configured more than once");
                continue;
            }
            String prefix = "dependency '" + name + "' ";
            requirePositive(violations, prefix + "failureThreshold", dependency.getFailureThreshold());
            requirePositive(violations, prefix + "openDurationMs", dependency.getOpenDurationMs());
            requirePositive(violations, prefix + "bulkheadCapacity", dependency.getBulkheadCapacity());
            requirePositive(violations, prefix + "bulkheadMaxWaitMs", dependency.getBulkheadMaxWaitMs());
            requirePositive(violations, prefix + "attemptTimeoutMs", dependency.getAttemptTimeoutMs());
            validateRetry(prefix, dependency, violations);
        }

        boolean classifierEnabled = engine != null && engine.isClassifierEnabled();
        for (String required : requiredDependencies(classifierEnabled)) {
            if (!seen.contains(required)) {
                violations.add("required dependency '" + required + "' is not configured");
            }
        }
    }

    private void validateRetry(String prefix, EngineProperties.DependencySection dependency, List<String> violations) {
        if (dependency.getMaxAttempts() != null && dependency.getMaxAttempts() < 1) {
            violations.add(prefix + "maxAttempts must be >= 1 (current: " + dependency.getMaxAttempts() + ")");
        }
        if (dependency.getBaseDelayMs() != null && dependency.getBaseDelayMs() <= 0) {
            violations.add(prefix + "baseDelayMs must be positive (current: " + dependency.getBaseDelayMs() + ")");
        }
        if (dependency.getBaseDelayMs() != null && dependency.getMaxDelayMs() != null
            && dependency.getMaxDelayMs() < dependency.getBaseDelayMs()) {
            violations.add(prefix + "maxDelayMs must be >= baseDelayMs");
        }
        Double jitter = dependency.getJitterFactor();
        if (jitter != null && (jitter < 0.0 || jitter > 1.0)) {
            violations.add(prefix + "jitterFactor must be between 0.0 and 1.0 (current: " + jitter + ")");
        }
    }

    private void validateRouting(List<String> violations) {
        EngineProperties.RoutingSection routing = properties.getRouting();
        if (routing == null || routing.getKinds() == null) {
            return;
        }
        routing.getKinds().forEach((kind, handler) -> {
            try {
                WorkKind.valueOf(String.valueOf(kind));
            } catch (IllegalArgumentException e) {
                violations.add("routing.kinds has an unknown work kind: " + kind);
            }
            if (handler == null || handler.isBlank()) {
                violations.add("routing.kinds." + kind + " has no handler");
            } else if (!handlers.contains(handler)) {
                violations.add("routing.kinds." + kind + " handler is not registered: " + handler);
            }
        });
    }

    private void validateSafety(List<String> violations) {
        EngineProperties.SafetySection safety = properties.getSafety();
        if (safety == null || safety.getRules() == null) {
            return;
        }
        for (EngineProperties.SafetyRuleSection rule : safety.getRules()) {
            if (rule == null || rule.getName() == null || rule.getName().isBlank()) {
                violations.add("safety rule name is missing");
                continue;
            }
            if (rule.getPattern() == null || rule.getPattern().isBlank()) {
                violations.add("safety rule '" + rule.getName() + "' has no pattern");
                continue;
            }
            try {
                Pattern.compile(rule.getPattern());
            } catch (PatternSyntaxException e) {
                violations.add("safety rule '" + rule.getName() + "' has an invalid pattern: " + e.getDescription());
            }
        }
    }

    private void validateRuntime(List<String> violations) {
        EngineProperties.LifecycleSection lifecycle = properties.getLifecycle();
        if (lifecycle != null) {
            if (lifecycle.getPropagationDelayMs() < 0) {
                violations.add("lifecycle.propagationDelayMs cannot be negative");
            }
            if (lifecycle.getDrainTimeoutMs() < 0) {
                violations.add("lifecycle.drainTimeoutMs cannot be negative");
            }
        }
        EngineProperties.WorkersSection workers = properties.getWorkers();
        if (workers != null) {
            requirePositive(violations, "workers.ioThreads", workers.getIoThreads());
            requirePositive(violations, "workers.cpuThreads", workers.getCpuThreads());
            requirePositive(violations, "workers.cpuQueueCapacity", workers.getCpuQueueCapacity());
        }
        EngineProperties.QueueSection queue = properties.getQueue();
        if (queue != null) {
            requirePositive(violations, "queue.batchSize", queue.getBatchSize());
            requirePositive(violations, "queue.pollingIntervalMs", queue.getPollingIntervalMs());
            if (queue.getRetryDelayMs() < 0) {
                violations.add("queue.retryDelayMs cannot be negative");
            }
        }
    }

    private static void requirePositive(List<String> violations, String field, Number value) {
        if (value == null) {
            violations.add(field + " is missing");
        } else if (value.doubleValue() <= 0) {
            violations.add(field + " must be positive (current: " + value + ")");
        }
    }
}
