package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.protection.DependencyBreakerState;
import com.ryuqq.conductor.core.spi.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 엔진 인스턴스가 소유하는 의존성 보호 상태 레지스트리.
 *
 * <p>Circuit Breaker와 Bulkhead 상태는 프로세스 전역 싱글톤이 아니라 이 인스턴스에 속하므로,
 * 여러 엔진 인스턴스가 한 JVM(예: 테스트)에서 독립적으로 공존할 수 있습니다.</p>
 *
 * <p>시도당 타임아웃을 적용하기 위한 attempt 실행 스레드 풀도 소유하며,
 * Lifecycle Manager가 종료 시 {@link #close()}로 해제합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DependencyRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DependencyRegistry.class);

    private static final long CLOSE_AWAIT_MS = 1_000L;

    private final Map<String, DependencyGuard> guards;
    private final ExecutorService attemptExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DependencyRegistry(Collection<DependencyConfig> configs, EventSink eventSink, Clock clock) {
        if (configs == null) {
            throw new IllegalArgumentException("configs cannot be null");
        }
        ResilienceEventEmitter events = new ResilienceEventEmitter(eventSink);
        Map<String, DependencyGuard> map = new LinkedHashMap<>();
        for (DependencyConfig config : configs) {
            if (map.containsKey(config.name())) {
                throw new IllegalArgumentException("Duplicate dependency: " + config.name());
            }
            map.put(config.name(), new DependencyGuard(
                config,
                new CountingCircuitBreaker(config.name(), config.breaker(), clock, events),
                new SemaphoreBulkhead(config.bulkhead()),
                new FixedTimeoutPolicy(config.attemptTimeoutMs())
            ));
        }
        this.guards = Collections.unmodifiableMap(map);
        this.attemptExecutor = Executors.newCachedThreadPool(new AttemptThreadFactory());
        log.info("DependencyRegistry initialized: dependencies={}", guards.keySet());
    }

    public DependencyRegistry(List<DependencyConfig> configs, EventSink eventSink) {
        this(configs, eventSink, Clock.systemUTC());
    }

    /**
     * 의존성 보호 계층 조회.
     *
     * @param name 의존성 이름
     * @return 보호 계층
     * @throws IllegalArgumentException 등록되지 않은 의존성
     */
    public DependencyGuard get(String name) {
        DependencyGuard guard = guards.get(name);
        if (guard == null) {
            throw new IllegalArgumentException("Unknown dependency: " + name + " (configured: " + guards.keySet() + ")");
        }
        return guard;
    }

    public boolean contains(String name) {
        return guards.containsKey(name);
    }

    public Set<String> names() {
        return guards.keySet();
    }

    public DependencyBreakerState snapshot(String name) {
        return get(name).breaker().snapshot();
    }

    /**
     * Circuit Breaker를 강제로 CLOSED로 되돌림 (운영 도구용).
     *
     * @param name 의존성 이름
     */
    public void reset(String name) {
        get(name).breaker().reset();
    }

    ExecutorService attemptExecutor() {
        return attemptExecutor;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * attempt 실행 풀 해제. 진행 중인 시도는 짧게 기다린 뒤 인터럽트합니다.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        attemptExecutor.shutdown();
        try {
            if (!attemptExecutor.awaitTermination(CLOSE_AWAIT_MS, TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = attemptExecutor.shutdownNow();
                log.warn("DependencyRegistry forced shutdown: pendingAttempts={}", dropped.size());
            }
        } catch (InterruptedException e) {
            attemptExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("DependencyRegistry closed: dependencies={}", guards.keySet());
    }

    private static final class AttemptThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "conductor-attempt-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
