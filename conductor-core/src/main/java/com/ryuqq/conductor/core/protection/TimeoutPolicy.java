package com.ryuqq.conductor.core.protection;

/**
 * 시도당(per-attempt) 타임아웃 정책 SPI.
 *
 * <p>재시도 루프 안쪽에 적용되므로 각 시도가 독립적으로 제한됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TimeoutPolicy {

    /**
     * 시도당 타임아웃 조회.
     *
     * @return 타임아웃 (밀리초), 0이면 타임아웃 없음
     */
    long getAttemptTimeoutMs();

    /**
     * 타임아웃 발생 기록.
     *
     * @param elapsedMs 실제 경과 시간 (밀리초)
     */
    void recordTimeout(long elapsedMs);

    /**
     * 기록된 타임아웃 횟수.
     *
     * @return 타임아웃 횟수
     */
    long getTimeoutCount();
}
