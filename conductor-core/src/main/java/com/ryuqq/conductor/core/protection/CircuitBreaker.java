package com.ryuqq.conductor.core.protection;

/**
 * 의존성 하나에 대한 Circuit Breaker SPI.
 *
 * <p>연속 실패를 추적하고, 임계값에 도달하면 호출을 시도하지 않고 빠르게 실패(Fail-Fast)하여
 * 장애가 전파되는 것을 막습니다. 인스턴스는 의존성 이름마다 하나이며 모든 호출자가 공유합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CallPermission permission = breaker.tryAcquire();
 * if (!permission.isGranted()) {
 *     throw new DependencyUnavailableException(breaker.getDependencyName());
 * }
 * try {
 *     T result = op.call();
 *     breaker.recordSuccess(permission);
 *     return result;
 * } catch (Exception e) {
 *     breaker.recordFailure(permission, e);
 *     throw e;
 * }
 * }</pre>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 여러 스레드가 동시에 호출 가능</li>
 *   <li>HALF_OPEN에서는 동시에 하나의 시험 호출만 허용</li>
 *   <li>오래된 PERMITTED 결과는 HALF_OPEN/OPEN 상태를 바꾸지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 보호 대상 의존성 이름.
     *
     * @return 의존성 이름
     */
    String getDependencyName();

    /**
     * 호출 허가 요청.
     *
     * <p>OPEN 상태에서 open 유지 시간이 지났다면 HALF_OPEN으로 전이하고 {@link CallPermission#TRIAL}을
     * 반환합니다.</p>
     *
     * @return 호출 허가 결과
     */
    CallPermission tryAcquire();

    /**
     * 상태를 바꾸지 않고 현재 호출이 허용되는지 확인.
     *
     * <p>재시도 사이에 회로가 열렸는지 확인할 때 사용합니다.</p>
     *
     * @return CLOSED 상태이면 true
     */
    boolean isCallPermitted();

    /**
     * 성공 기록.
     *
     * @param permission tryAcquire에서 받은 허가
     */
    void recordSuccess(CallPermission permission);

    /**
     * 실패 기록.
     *
     * @param permission tryAcquire에서 받은 허가
     * @param error 발생한 오류
     */
    void recordFailure(CallPermission permission, Throwable error);

    /**
     * 결과 없이 허가 반납.
     *
     * <p>시험 호출이 Bulkhead 대기 초과처럼 의존성 자체와 무관한 이유로 실행되지 못했을 때
     * 다음 시험 호출이 가능하도록 반납합니다.</p>
     *
     * @param permission tryAcquire에서 받은 허가
     */
    void releasePermission(CallPermission permission);

    CircuitBreakerState getState();

    /**
     * 현재 상태 스냅샷.
     *
     * @return 상태 스냅샷
     */
    DependencyBreakerState snapshot();

    /**
     * CLOSED 상태로 강제 초기화 (테스트/운영 도구용).
     */
    void reset();
}
