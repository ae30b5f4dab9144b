package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.error.DependencyTimeoutException;

import java.util.HashSet;
import java.util.Set;

/**
 * 오류가 재시도 대상(일시적)인지 판정.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>시도당 타임아웃({@link DependencyTimeoutException})은 항상 일시적</li>
 *   <li>그 외에는 원인 체인의 어느 예외든 설정된 클래스(또는 그 하위 클래스)이면 일시적</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransientErrorClassifier {

    private final Set<String> transientClassNames;

    public TransientErrorClassifier(Set<String> transientClassNames) {
        if (transientClassNames == null) {
            throw new IllegalArgumentException("transientClassNames cannot be null");
        }
        this.transientClassNames = Set.copyOf(transientClassNames);
    }

    public boolean isTransient(Throwable error) {
        if (error instanceof DependencyTimeoutException) {
            return true;
        }
        Set<Throwable> seen = new HashSet<>();
        Throwable current = error;
        while (current != null && seen.add(current)) {
            if (matches(current.getClass())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private boolean matches(Class<?> type) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            if (transientClassNames.contains(c.getName())) {
                return true;
            }
        }
        return false;
    }
}
