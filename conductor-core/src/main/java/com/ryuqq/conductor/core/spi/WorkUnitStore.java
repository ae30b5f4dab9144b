package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.model.WorkUnitId;

import java.util.Optional;

/**
 * 종료된 WorkUnit 저장소 SPI.
 *
 * <p>Coordinator는 종료 상태에 도달한 WorkUnit을 저장하고, 같은 ID가 다시 들어오면
 * 저장된 레코드를 변경 없이 반환합니다. SHUTDOWN_INTERRUPTED로 끝난 레코드만 같은 id의 새 실행 결과로
 * 교체될 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkUnitStore {

    Optional<WorkUnit> find(WorkUnitId id);

    /**
     * 종료된 WorkUnit 저장.
     *
     * @param workUnit 종료 상태의 WorkUnit
     * @throws IllegalArgumentException 종료 상태가 아닌 경우
     */
    void save(WorkUnit workUnit);
}
