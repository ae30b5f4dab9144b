package com.ryuqq.conductor.adapter.resilience;

/**
 * 재시도 대기 추상화. 테스트에서 실제 대기 없이 지연 값을 검증할 때 교체합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
