package com.ryuqq.conductor.adapter.resilience;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키고, 같은 의존성을 재시도하는 호출자들이
 * 동시에 몰리지 않도록 무작위 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(retryNumber-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 재시도 설정으로 생성.
     *
     * @param config 재시도 설정
     */
    public BackoffCalculator(RetryConfig config) {
        this(config.baseDelayMs(), config.maxDelayMs(), config.jitterFactor());
    }

    /**
     * @param baseDelayMs 첫 재시도 전 지연 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param retryNumber 몇 번째 재시도인지 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryNumber가 양수가 아닌 경우
     */
    public long calculate(int retryNumber) {
        if (retryNumber <= 0) {
            throw new IllegalArgumentException("retryNumber must be positive (current: " + retryNumber + ")");
        }

        // 1. 지수 백오프 (shift overflow 방지)
        int shift = Math.min(retryNumber - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);

        // 2. Jitter
        long jitter = (long) (exponential * jitterFactor * Math.random());

        // 3. 상한
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
