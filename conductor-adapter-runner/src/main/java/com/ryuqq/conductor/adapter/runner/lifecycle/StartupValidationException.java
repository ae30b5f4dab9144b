package com.ryuqq.conductor.adapter.runner.lifecycle;

import java.util.List;

/**
 * 시작 검증 실패. 발견된 위반을 모두 담습니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StartupValidationException extends RuntimeException {

    private final List<String> violations;

    public StartupValidationException(List<String> violations) {
        super("Startup validation failed with " + violations.size() + " violation(s): " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
