package com.ryuqq.conductor.adapter.runner.config;

import com.ryuqq.conductor.adapter.runner.lifecycle.StartupValidationException;
import com.ryuqq.conductor.application.routing.HandlerRegistration;
import com.ryuqq.conductor.application.routing.HandlerRegistry;
import com.ryuqq.conductor.core.handler.HandlerResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StartupValidator 테스트 (fail-closed).
 */
class StartupValidatorTest {

    private HandlerRegistry handlers;
    private EngineProperties properties;

    @BeforeEach
    void setUp() {
        handlers = new HandlerRegistry().register(HandlerRegistration.of("general", (u, c) -> HandlerResult.of("ok")));
        properties = new EngineProperties();
        List<EngineProperties.DependencySection> dependencies = new ArrayList<>();
        dependencies.add(dependency("state-store"));
        dependencies.add(dependency("cost-store"));
        properties.setDependencies(dependencies);
    }

    private static EngineProperties.DependencySection dependency(String name) {
        EngineProperties.DependencySection section = new EngineProperties.DependencySection();
        section.setName(name);
        section.setFailureThreshold(5);
        section.setOpenDurationMs(30_000L);
        section.setBulkheadCapacity(10);
        section.setBulkheadMaxWaitMs(500L);
        section.setAttemptTimeoutMs(2_000L);
        return section;
    }

    @Test
    void 완전한_설정은_위반_없음() {
        // when
        StartupValidator validator = new StartupValidator(properties, handlers);

        // then
        assertThat(validator.validate()).isEmpty();
        validator.verify();
    }

    @Test
    void 누락되거나_자리표시자인_보호_파라미터를_모두_모아서_한번에_거부() {
        // given
        EngineProperties.DependencySection stateStore = properties.getDependencies().get(0);
        stateStore.setFailureThreshold(null);
        stateStore.setBulkheadCapacity(0);
        properties.getDependencies().get(1).setAttemptTimeoutMs(null);

        // when & then
        assertThatThrownBy(() -> new StartupValidator(properties, handlers).verify())
            .isInstanceOfSatisfying(StartupValidationException.class, e -> assertThat(e.getViolations()).containsExactly(
                "dependency 'state-store' failureThreshold is missing",
                "dependency 'state-store' bulkheadCapacity must be positive (current: 0)",
                "dependency 'cost-store' attemptTimeoutMs is missing"
            ));
    }

    @Test
    void 필수_의존성이_없으면_위반() {
        // given
        properties.getDependencies().remove(1);

        // when
        List<String> violations = new StartupValidator(properties, handlers).validate();

        // then
        assertThat(violations).containsExactly("required dependency 'cost-store' is not configured");
    }

    @Test
    void 분류기를_쓰면_classifier_의존성도_필수() {
        // given
        properties.getEngine().setClassifierEnabled(true);

        // when
        List<String> violations = new StartupValidator(properties, handlers).validate();

        // then
        assertThat(violations).containsExactly("required dependency 'classifier' is not configured");
    }

    @Test
    void 기본_핸들러가_등록되지_않으면_위반() {
        // given
        properties.getEngine().setDefaultHandler("triage");

        // when
        List<String> violations = new StartupValidator(properties, handlers).validate();

        // then
        assertThat(violations).containsExactly("engine.defaultHandler is not registered: triage");
    }

    @Test
    void 중복_의존성과_잘못된_재시도_값은_위반() {
        // given
        properties.getDependencies().add(dependency("state-store"));
        EngineProperties.DependencySection costStore = properties.getDependencies().get(1);
        costStore.setBaseDelayMs(500L);
        costStore.setMaxDelayMs(100L);
        costStore.setJitterFactor(1.5);

        // when
        List<String> violations = new StartupValidator(properties, handlers).validate();

        // then
        assertThat(violations).containsExactlyInAnyOrder(
            "dependency 'state-store' is configured more than once",
            "dependency 'cost-store' maxDelayMs must be >= baseDelayMs",
            "dependency 'cost-store' jitterFactor must be between 0.0 and 1.0 (current: 1.5)"
        );
    }

    @Test
    void 잘못된_정책과_정규식은_위반() {
        // given
        properties.getEngine().setBudgetExceededPolicy("DROP_ALL");
        EngineProperties.SafetyRuleSection rule = new EngineProperties.SafetyRuleSection();
        rule.setName("broken");
        rule.setPattern("([a-z");
        properties.getSafety().getRules().add(rule);

        // when
        List<String> violations = new StartupValidator(properties, handlers).validate();

        // then
        assertThat(violations).hasSize(2);
        assertThat(violations.get(0)).isEqualTo("engine.budgetExceededPolicy is invalid: DROP_ALL");
        assertThat(violations.get(1)).startsWith("safety rule 'broken' has an invalid pattern");
    }

    @Test
    void routing_kinds의_알_수_없는_kind와_미등록_핸들러는_위반() {
        // given
        properties.getRouting().getKinds().put("NIGHTLY", "general");
        properties.getRouting().getKinds().put("SCHEDULED_JOB", "scheduler");

        // when
        List<String> violations = new StartupValidator(properties, handlers).validate();

        // then
        assertThat(violations).containsExactly(
            "routing.kinds has an unknown work kind: NIGHTLY",
            "routing.kinds.SCHEDULED_JOB handler is not registered: scheduler"
        );
    }
}
