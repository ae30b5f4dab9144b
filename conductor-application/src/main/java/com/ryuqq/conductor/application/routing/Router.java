package com.ryuqq.conductor.application.routing;

import com.ryuqq.conductor.application.observability.EngineEvents;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.model.WorkKind;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.spi.Classifier;
import com.ryuqq.conductor.core.spi.EventSink;
import com.ryuqq.conductor.core.spi.ResilientCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 규칙 우선, 분류기 폴백 라우터.
 *
 * <p><strong>결정 순서:</strong></p>
 * <ol>
 *   <li>규칙 목록을 순서대로 평가, 처음 일치한 규칙 채택</li>
 *   <li>일치 없음 → 분류기 호출 ("classifier" 의존성, resilience pipeline 경유)</li>
 *   <li>분류기 미설정, 실패, 미등록 이름 반환 → 기본 핸들러</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    public static final String CLASSIFIER_DEPENDENCY = "classifier";

    private final List<RoutingRule> rules;
    private final HandlerRegistry registry;
    private final Classifier classifier;
    private final ResilientCaller caller;
    private final String defaultHandler;
    private final EventSink events;

    /**
     * @param rules 우선순위 순 규칙
     * @param registry 핸들러 레지스트리
     * @param classifier 폴백 분류기 (null이면 사용 안 함)
     * @param caller 분류기 호출용 resilience pipeline
     * @param defaultHandler 기본 핸들러 이름
     * @param events 이벤트 Sink
     */
    public Router(List<RoutingRule> rules, HandlerRegistry registry, Classifier classifier,
                  ResilientCaller caller, String defaultHandler, EventSink events) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (classifier != null && caller == null) {
            throw new IllegalArgumentException("caller cannot be null when a classifier is configured");
        }
        if (defaultHandler == null || defaultHandler.isBlank()) {
            throw new IllegalArgumentException("defaultHandler cannot be null or blank");
        }
        this.rules = List.copyOf(rules);
        this.registry = registry;
        this.classifier = classifier;
        this.caller = caller;
        this.defaultHandler = defaultHandler;
        this.events = events == null ? EventSink.noop() : events;
    }

    /**
     * 기본 규칙 구성: target hint → keyword → kind.
     *
     * @param registry 핸들러 레지스트리
     * @param handlersByKind WorkKind별 고정 핸들러 (비어 있으면 kind 규칙은 일치하지 않음)
     * @param classifier 폴백 분류기 (nullable)
     * @param caller resilience pipeline
     * @param defaultHandler 기본 핸들러
     * @param events 이벤트 Sink
     * @return Router
     */
    public static Router standard(HandlerRegistry registry, Map<WorkKind, String> handlersByKind,
                                  Classifier classifier, ResilientCaller caller, String defaultHandler,
                                  EventSink events) {
        return new Router(List.of(new TargetHintRule(), new KeywordRule(), new KindRule(handlersByKind)),
            registry, classifier, caller, defaultHandler, events);
    }

    public HandlerRegistry registry() {
        return registry;
    }

    public boolean usesClassifier() {
        return classifier != null;
    }

    public String defaultHandler() {
        return defaultHandler;
    }

    /**
     * 핸들러 선택.
     *
     * @param workUnit 라우팅 대상
     * @return 라우팅 결과
     * @throws IllegalStateException 기본 핸들러까지 미등록인 경우
     */
    public RoutingDecision route(WorkUnit workUnit) {
        long start = System.currentTimeMillis();

        // 1. 결정적 규칙
        for (RoutingRule rule : rules) {
            Optional<String> matched = rule.match(workUnit, registry);
            if (matched.isPresent()) {
                return decided(workUnit, new RoutingDecision(matched.get(), rule.name()), start);
            }
        }

        // 2. 분류기 폴백
        if (classifier != null) {
            try {
                String chosen = caller.execute(CLASSIFIER_DEPENDENCY,
                    () -> classifier.classify(workUnit, registry.names()));
                if (registry.contains(chosen)) {
                    return decided(workUnit, new RoutingDecision(chosen, RoutingDecision.CLASSIFIER), start);
                }
                log.warn("Classifier returned unknown handler, using default: workUnitId={}, handler={}",
                    workUnit.getId(), chosen);
            } catch (RuntimeException e) {
                log.warn("Classifier failed, using default: workUnitId={}, error={}",
                    workUnit.getId(), e.toString());
            }
        }

        // 3. 기본 핸들러
        if (!registry.contains(defaultHandler)) {
            throw new IllegalStateException("Default handler is not registered: " + defaultHandler);
        }
        return decided(workUnit, new RoutingDecision(defaultHandler, RoutingDecision.DEFAULT), start);
    }

    private RoutingDecision decided(WorkUnit workUnit, RoutingDecision decision, long start) {
        log.info("Routed work unit: workUnitId={}, handler={}, source={}",
            workUnit.getId(), decision.handlerName(), decision.source());
        events.emit(EngineEvents.of(workUnit, "coordinator.route", EventOutcome.SUCCESS,
            System.currentTimeMillis() - start,
            Map.of("handler", decision.handlerName(), "source", decision.source())));
        return decision;
    }
}
