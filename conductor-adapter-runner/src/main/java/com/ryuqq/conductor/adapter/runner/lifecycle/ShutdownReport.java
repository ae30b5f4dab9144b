package com.ryuqq.conductor.adapter.runner.lifecycle;

import com.ryuqq.conductor.core.model.WorkUnitId;

import java.util.List;

/**
 * 종료 시퀀스 결과.
 *
 * @param drained drain timeout 안에 in-flight 작업이 모두 끝났는지
 * @param interrupted SHUTDOWN_INTERRUPTED로 종료 처리된 루트 WorkUnit id
 * @param resourcesReleased 의존성/워커 풀 해제가 모두 성공했는지
 * @param durationMs 종료 시퀀스 소요 시간
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ShutdownReport(
    boolean drained,
    List<WorkUnitId> interrupted,
    boolean resourcesReleased,
    long durationMs
) {

    public ShutdownReport {
        interrupted = interrupted == null ? List.of() : List.copyOf(interrupted);
    }

    public boolean isClean() {
        return drained && resourcesReleased;
    }
}
