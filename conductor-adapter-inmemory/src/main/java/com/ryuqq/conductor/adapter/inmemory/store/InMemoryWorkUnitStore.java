package com.ryuqq.conductor.adapter.inmemory.store;

import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.model.WorkUnitId;
import com.ryuqq.conductor.core.spi.WorkUnitStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-Memory WorkUnitStore 구현체.
 *
 * <p><strong>불변식:</strong> 종료된 WorkUnit만 저장하며, 한 번 저장된 기록은 덮어쓰지 않습니다.
 * 같은 id의 재실행이 저장된 종료 기록을 바꾸지 못하도록 첫 번째 저장이 유지됩니다.
 * 종료 시퀀스가 끝낸 기록({@link WorkUnit#isInterruptedByShutdown()})만 재전달된 실행의 기록으로 교체됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryWorkUnitStore implements WorkUnitStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkUnitStore.class);

    private final Map<WorkUnitId, WorkUnit> units = new ConcurrentHashMap<>();

    @Override
    public Optional<WorkUnit> find(WorkUnitId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return Optional.ofNullable(units.get(id));
    }

    @Override
    public void save(WorkUnit workUnit) {
        if (workUnit == null) {
            throw new IllegalArgumentException("workUnit cannot be null");
        }
        if (!workUnit.isTerminal()) {
            throw new IllegalArgumentException(
                "Only terminal work units can be saved: " + workUnit.getId() + " is " + workUnit.getStatus());
        }
        WorkUnit stored = units.compute(workUnit.getId(), (id, existing) ->
            existing == null || (existing != workUnit && existing.isInterruptedByShutdown()) ? workUnit : existing);
        if (stored != workUnit) {
            log.warn("Ignoring save of already stored work unit: workUnitId={}", workUnit.getId());
        }
    }

    public int size() {
        return units.size();
    }

    public void clear() {
        units.clear();
    }
}
