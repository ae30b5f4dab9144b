package com.ryuqq.conductor.core.spi;

import java.util.concurrent.Callable;

/**
 * 외부 의존성 호출 SPI.
 *
 * <p>핸들러와 미들웨어의 모든 외부 호출은 이 인터페이스를 거칩니다. 구현은 의존성 이름별로
 * circuit breaker → retry → bulkhead → timeout 순서의 보호 계층을 적용합니다.</p>
 *
 * <p><strong>실패 의미:</strong></p>
 * <ul>
 *   <li>DependencyUnavailableException: 회로 OPEN, operation 미호출</li>
 *   <li>BulkheadTimeoutException: 슬롯 대기 초과, operation 미호출</li>
 *   <li>DependencyExhaustedException: 일시적 오류로 재시도 소진</li>
 *   <li>그 외: 일시적이지 않은 오류는 재시도 없이 전파 (checked 예외는 DependencyFailedException으로 감쌈)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResilientCaller {

    /**
     * 보호 계층을 거쳐 operation 실행.
     *
     * @param dependencyName 설정된 의존성 이름
     * @param operation 인자 없는 호출
     * @param <T> 결과 타입
     * @return operation 결과
     */
    <T> T execute(String dependencyName, Callable<T> operation);
}
