package com.ryuqq.conductor.application.middleware;

/**
 * 미들웨어 단계 하나의 실행 결과 (관측 전용, 저장하지 않음).
 *
 * @param stageName 단계 이름
 * @param durationMs 소요 시간 (밀리초)
 * @param success 성공 여부
 * @param skipped 앞 단계 실패로 실행되지 않았는지
 * @param error 실패 사유 (성공이면 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MiddlewareOutcome(String stageName, long durationMs, boolean success, boolean skipped, String error) {

    public static MiddlewareOutcome succeeded(String stageName, long durationMs) {
        return new MiddlewareOutcome(stageName, durationMs, true, false, null);
    }

    public static MiddlewareOutcome failed(String stageName, long durationMs, Throwable error) {
        return new MiddlewareOutcome(stageName, durationMs, false, false, error.toString());
    }

    public static MiddlewareOutcome skippedStage(String stageName) {
        return new MiddlewareOutcome(stageName, 0, false, true, null);
    }
}
