package com.ryuqq.conductor.adapter.resilience;

import java.util.Set;

/**
 * 의존성별 재시도 설정.
 *
 * <p>어떤 오류를 일시적(transient)으로 볼지는 코드가 아니라 설정 입력입니다.
 * {@code transientErrors}에는 예외 클래스의 정규 이름을 넣으며, 하위 클래스도 일치합니다.</p>
 *
 * @param maxAttempts 최초 시도를 포함한 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 첫 재시도 전 지연 (밀리초)
 * @param maxDelayMs 최대 지연 (밀리초)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param transientErrors 일시적 오류로 분류할 예외 클래스 이름
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetryConfig(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor,
    Set<String> transientErrors
) {

    /** 기본 일시적 오류: 네트워크 I/O, 타임아웃. */
    public static final Set<String> DEFAULT_TRANSIENT_ERRORS = Set.of(
        "java.io.IOException",
        "java.util.concurrent.TimeoutException",
        "java.net.http.HttpTimeoutException"
    );

    public RetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        transientErrors = transientErrors == null ? Set.of() : Set.copyOf(transientErrors);
    }

    /**
     * 기본 설정: 3회 시도, 1초 → 최대 10초, jitter 0.1.
     */
    public RetryConfig() {
        this(3, 1_000L, 10_000L, 0.1, DEFAULT_TRANSIENT_ERRORS);
    }

    public RetryConfig withMaxAttempts(int attempts) {
        return new RetryConfig(attempts, baseDelayMs, maxDelayMs, jitterFactor, transientErrors);
    }

    public RetryConfig withTransientErrors(Set<String> errors) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, errors);
    }
}
