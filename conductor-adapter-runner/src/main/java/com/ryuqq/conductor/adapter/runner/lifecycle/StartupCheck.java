package com.ryuqq.conductor.adapter.runner.lifecycle;

/**
 * 작업 수락 전 실행되는 시작 검증.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StartupCheck {

    /**
     * 검증 실행.
     *
     * @throws StartupValidationException 위반이 하나라도 있는 경우
     */
    void verify();

    static StartupCheck none() {
        return () -> { };
    }
}
