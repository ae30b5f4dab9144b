package com.ryuqq.conductor.application.routing;

import com.ryuqq.conductor.application.middleware.OutputContract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 핸들러 레지스트리.
 *
 * <p>등록 순서를 유지합니다. 키워드 규칙은 이 순서대로 평가됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HandlerRegistry {

    private final Map<String, HandlerRegistration> registrations = new LinkedHashMap<>();

    public synchronized HandlerRegistry register(HandlerRegistration registration) {
        if (registration == null) {
            throw new IllegalArgumentException("registration cannot be null");
        }
        if (registrations.containsKey(registration.name())) {
            throw new IllegalArgumentException("Handler already registered: " + registration.name());
        }
        registrations.put(registration.name(), registration);
        return this;
    }

    public synchronized Optional<HandlerRegistration> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registrations.get(name));
    }

    public synchronized boolean contains(String name) {
        return name != null && registrations.containsKey(name);
    }

    public synchronized Set<String> names() {
        return new LinkedHashSet<>(registrations.keySet());
    }

    /**
     * 등록된 전체 핸들러 카탈로그 (등록 순서).
     *
     * @return 등록 정보 목록
     */
    public synchronized List<HandlerRegistration> list() {
        return List.copyOf(new ArrayList<>(registrations.values()));
    }

    /**
     * output-normalization 단계에 넘기는 계약 조회.
     *
     * @param name 핸들러 이름
     * @return 출력 계약 (미등록이면 null)
     */
    public synchronized OutputContract contract(String name) {
        HandlerRegistration registration = registrations.get(name);
        return registration == null ? null : registration.contract();
    }
}
