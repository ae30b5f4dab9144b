package com.ryuqq.conductor.application.routing;

import com.ryuqq.conductor.core.model.WorkUnit;

import java.util.Locale;
import java.util.Optional;

/**
 * 입력 텍스트에 핸들러 키워드가 포함되면 해당 핸들러 선택.
 *
 * <p>대소문자를 구분하지 않으며 레지스트리 등록 순서상 처음 일치한 핸들러가 선택됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class KeywordRule implements RoutingRule {

    public static final String NAME = "keyword";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<String> match(WorkUnit workUnit, HandlerRegistry registry) {
        String text = workUnit.getInput().asText().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (HandlerRegistration registration : registry.list()) {
            for (String keyword : registration.keywords()) {
                if (!keyword.isBlank() && text.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return Optional.of(registration.name());
                }
            }
        }
        return Optional.empty();
    }
}
