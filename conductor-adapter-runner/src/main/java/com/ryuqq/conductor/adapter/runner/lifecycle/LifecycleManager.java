package com.ryuqq.conductor.adapter.runner.lifecycle;

import com.ryuqq.conductor.adapter.resilience.Sleeper;
import com.ryuqq.conductor.application.gate.EngineGate;
import com.ryuqq.conductor.application.observability.EngineEvents;
import com.ryuqq.conductor.core.error.ErrorCode;
import com.ryuqq.conductor.core.error.ShutdownInterruptedException;
import com.ryuqq.conductor.core.error.WorkError;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.model.WorkUnit;
import com.ryuqq.conductor.core.model.WorkUnitId;
import com.ryuqq.conductor.core.spi.EventSink;
import com.ryuqq.conductor.core.spi.WorkUnitStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 엔진 시작/종료 순서 관리.
 *
 * <p><strong>시작:</strong> {@link StartupCheck}가 통과해야만 healthy 표시 후 작업을 수락합니다 (fail-closed).</p>
 *
 * <p><strong>종료 시퀀스:</strong></p>
 * <ol>
 *   <li>unhealthy 표시 (upstream이 새 작업을 보내지 않도록)</li>
 *   <li>propagationDelayMs 대기</li>
 *   <li>새 작업 수락 중단</li>
 *   <li>in-flight 작업 drain (drainTimeoutMs). 남은 작업과 하위 작업은 FAILED(SHUTDOWN_INTERRUPTED)로 저장</li>
 *   <li>버퍼링된 이벤트 flush</li>
 *   <li>의존성 및 워커 풀 해제</li>
 *   <li>종료 콜백 실행</li>
 * </ol>
 *
 * <p>shutdown은 멱등이며, 두 번째 호출부터는 첫 번째 결과를 그대로 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private final LifecycleConfig config;
    private final EngineGate gate;
    private final EventSink events;
    private final WorkUnitStore store;
    private final StartupCheck startupCheck;
    private final List<AutoCloseable> resources;
    private final Sleeper sleeper;
    private final Runnable exitAction;

    private boolean started;
    private ShutdownReport report;
    private Thread shutdownHook;

    /**
     * 생성자.
     *
     * @param config 종료 설정
     * @param gate 엔진 게이트
     * @param events 이벤트 Sink (5단계에서 flush)
     * @param store 중단된 WorkUnit 저장소
     * @param startupCheck 시작 검증
     * @param resources 6단계에서 등록 순서대로 닫을 자원
     * @param sleeper 전파 지연 대기
     * @param exitAction 7단계 종료 콜백
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LifecycleManager(LifecycleConfig config, EngineGate gate, EventSink events, WorkUnitStore store,
                            StartupCheck startupCheck, List<? extends AutoCloseable> resources, Sleeper sleeper,
                            Runnable exitAction) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (startupCheck == null) {
            throw new IllegalArgumentException("startupCheck cannot be null");
        }
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.gate = gate;
        this.events = events;
        this.store = store;
        this.startupCheck = startupCheck;
        this.resources = List.copyOf(resources);
        this.sleeper = sleeper;
        this.exitAction = exitAction == null ? () -> { } : exitAction;
    }

    /**
     * 시작 검증 후 작업 수락 시작.
     *
     * @throws StartupValidationException 검증 실패 시 (엔진은 수락하지 않은 상태로 남음)
     * @throws IllegalStateException 이미 종료된 경우
     */
    public synchronized void start() {
        if (report != null) {
            throw new IllegalStateException("Engine has already been shut down");
        }
        if (started) {
            return;
        }
        startupCheck.verify();
        gate.markHealthy();
        gate.startAccepting();
        started = true;
        log.info("Engine started: accepting work");
    }

    public synchronized boolean isStarted() {
        return started && report == null;
    }

    /**
     * 종료 시퀀스 실행.
     *
     * @return 종료 결과 (반복 호출 시 첫 결과)
     */
    public synchronized ShutdownReport shutdown() {
        if (report != null) {
            return report;
        }
        long startedAt = System.currentTimeMillis();
        log.info("Shutdown sequence started: propagationDelayMs={}, drainTimeoutMs={}",
            config.propagationDelayMs(), config.drainTimeoutMs());

        // 1. unhealthy
        gate.markUnhealthy();

        // 2. 전파 지연
        boolean interruptedWhileWaiting = pause(config.propagationDelayMs());

        // 3. 수락 중단
        gate.stopAccepting();

        // 4. drain
        boolean drained = !interruptedWhileWaiting && drain();
        List<WorkUnitId> interrupted = drained ? List.of() : interruptRemaining();

        // 5. 이벤트 flush
        flushEvents();

        // 6. 자원 해제
        boolean released = releaseResources();

        report = new ShutdownReport(drained, interrupted, released, System.currentTimeMillis() - startedAt);
        log.info("Shutdown sequence finished: drained={}, interrupted={}, resourcesReleased={}, durationMs={}",
            drained, interrupted.size(), released, report.durationMs());

        // 7. 종료
        exitAction.run();
        return report;
    }

    /**
     * JVM 종료 시 shutdown을 실행하는 hook 등록.
     */
    public synchronized void registerShutdownHook() {
        if (shutdownHook != null) {
            return;
        }
        shutdownHook = new Thread(this::shutdown, "conductor-shutdown");
        java.lang.Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    private boolean pause(long millis) {
        if (millis <= 0) {
            return false;
        }
        try {
            sleeper.sleep(millis);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during propagation delay, continuing shutdown");
            return true;
        }
    }

    private boolean drain() {
        try {
            return gate.awaitDrain(config.drainTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining in-flight work");
            return false;
        }
    }

    /**
     * drain 후 남은 루트와 하위 작업을 SHUTDOWN_INTERRUPTED로 종료.
     */
    private List<WorkUnitId> interruptRemaining() {
        List<WorkUnitId> interrupted = new ArrayList<>();
        WorkError error = new ShutdownInterruptedException(
            "Drain timeout of " + config.drainTimeoutMs() + "ms elapsed before completion").toWorkError();
        for (EngineGate.InFlight inFlight : gate.inFlight()) {
            WorkUnit root = inFlight.workUnit();
            interruptTree(root, error);
            inFlight.context().getCancellation().cancel(ErrorCode.SHUTDOWN_INTERRUPTED.name());
            interrupted.add(root.getId());
            log.warn("Work unit interrupted by shutdown: workUnitId={}, status={}", root.getId(), root.getStatus());
            events.emit(EngineEvents.of(root, "lifecycle.interrupted", EventOutcome.FAILURE, 0,
                Map.of("code", ErrorCode.SHUTDOWN_INTERRUPTED.code())));
            try {
                store.save(root);
            } catch (RuntimeException e) {
                log.warn("Failed to save interrupted work unit: workUnitId={}, error={}", root.getId(), e.toString());
            }
        }
        return interrupted;
    }

    private void interruptTree(WorkUnit unit, WorkError error) {
        for (WorkUnit child : unit.getChildren()) {
            interruptTree(child, error);
        }
        unit.fail(error);
    }

    private void flushEvents() {
        try {
            events.flush();
        } catch (RuntimeException e) {
            log.warn("Failed to flush events during shutdown: {}", e.toString());
        }
    }

    private boolean releaseResources() {
        boolean released = true;
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                released = false;
                log.warn("Failed to release resource during shutdown: resource={}, error={}",
                    resource.getClass().getSimpleName(), e.toString());
            }
        }
        return released;
    }
}
