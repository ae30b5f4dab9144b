package com.ryuqq.conductor.application.routing;

/**
 * 라우팅 결과.
 *
 * @param handlerName 선택된 핸들러
 * @param source 결정 근거 (규칙 이름, "classifier", "default", "direct")
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RoutingDecision(String handlerName, String source) {

    public static final String CLASSIFIER = "classifier";
    public static final String DEFAULT = "default";
    public static final String DIRECT = "direct";

    public RoutingDecision {
        if (handlerName == null || handlerName.isBlank()) {
            throw new IllegalArgumentException("handlerName cannot be null or blank");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
    }

    public static RoutingDecision direct(String handlerName) {
        return new RoutingDecision(handlerName, DIRECT);
    }
}
