package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.error.BulkheadTimeoutException;
import com.ryuqq.conductor.core.error.DependencyExhaustedException;
import com.ryuqq.conductor.core.error.DependencyFailedException;
import com.ryuqq.conductor.core.error.DependencyTimeoutException;
import com.ryuqq.conductor.core.error.DependencyUnavailableException;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.protection.Bulkhead;
import com.ryuqq.conductor.core.protection.CallPermission;
import com.ryuqq.conductor.core.protection.CircuitBreaker;
import com.ryuqq.conductor.core.spi.EventSink;
import com.ryuqq.conductor.core.spi.ResilientCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * circuit breaker → retry → bulkhead → timeout 순서의 resilience pipeline.
 *
 * <p><strong>계층별 동작:</strong></p>
 * <ol>
 *   <li>Circuit breaker: 호출 하나(재시도 포함)의 최종 결과를 한 번 기록. OPEN이면 operation 미호출.
 *       HALF_OPEN 시험 호출은 재시도 없이 단 한 번만 실행.</li>
 *   <li>Retry: 일시적 오류만 재시도. 대기 전에 로그/이벤트를 남기고, 대기 전 회로가 열렸으면 중단.</li>
 *   <li>Bulkhead: 시도마다 슬롯 획득. 대기 초과 시 operation 미호출, 재시도/회로 집계 대상 아님.
 *       슬롯은 operation이 실제로 끝날 때 반납.</li>
 *   <li>Timeout: 시도마다 독립적으로 적용. 초과 시 시도를 인터럽트하고 일시적 오류로 취급.</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResiliencePipeline implements ResilientCaller {

    private static final Logger log = LoggerFactory.getLogger(ResiliencePipeline.class);

    private final DependencyRegistry registry;
    private final ResilienceEventEmitter events;
    private final Sleeper sleeper;

    public ResiliencePipeline(DependencyRegistry registry, EventSink eventSink) {
        this(registry, eventSink, Sleeper.THREAD);
    }

    public ResiliencePipeline(DependencyRegistry registry, EventSink eventSink, Sleeper sleeper) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.registry = registry;
        this.events = new ResilienceEventEmitter(eventSink);
        this.sleeper = sleeper;
    }

    @Override
    public <T> T execute(String dependencyName, Callable<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        DependencyGuard guard = registry.get(dependencyName);
        CircuitBreaker breaker = guard.breaker();

        // 1. Circuit breaker
        CallPermission permission = breaker.tryAcquire();
        if (!permission.isGranted()) {
            log.debug("Call rejected by open circuit: dependency={}", dependencyName);
            events.emit(dependencyName, "breaker.rejected", EventOutcome.REJECTED, 0);
            throw new DependencyUnavailableException(dependencyName);
        }

        long start = System.nanoTime();
        try {
            T result = permission == CallPermission.TRIAL
                ? runTrial(guard, operation)
                : runWithRetry(guard, operation);
            breaker.recordSuccess(permission);
            events.emit(dependencyName, "dependency.call", EventOutcome.SUCCESS, elapsedMs(start));
            return result;
        } catch (BulkheadTimeoutException | DependencyUnavailableException e) {
            // 의존성 자체의 실패가 아니므로 회로 집계에서 제외
            breaker.releasePermission(permission);
            events.emit(dependencyName, "dependency.call", EventOutcome.REJECTED, elapsedMs(start),
                Map.of("error", e.getErrorCode().name()));
            throw e;
        } catch (RuntimeException e) {
            breaker.recordFailure(permission, e);
            events.emit(dependencyName, "dependency.call", EventOutcome.FAILURE, elapsedMs(start),
                Map.of("error", e.getClass().getSimpleName()));
            throw e;
        } catch (Error e) {
            breaker.recordFailure(permission, e);
            throw e;
        }
    }

    /**
     * HALF_OPEN 시험 호출. 재시도하지 않습니다.
     */
    private <T> T runTrial(DependencyGuard guard, Callable<T> operation) {
        log.info("Running half-open trial call: dependency={}", guard.name());
        try {
            return attempt(guard, operation);
        } catch (BulkheadTimeoutException e) {
            throw e;
        } catch (Exception e) {
            if (guard.classifier().isTransient(e)) {
                throw new DependencyExhaustedException(guard.name(), 1, e);
            }
            throw propagate(guard.name(), e);
        }
    }

    private <T> T runWithRetry(DependencyGuard guard, Callable<T> operation) {
        String name = guard.name();
        int maxAttempts = guard.config().retry().maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return attempt(guard, operation);
            } catch (BulkheadTimeoutException e) {
                throw e;
            } catch (Exception e) {
                if (!guard.classifier().isTransient(e)) {
                    throw propagate(name, e);
                }
                if (attempt >= maxAttempts) {
                    log.warn("Retries exhausted: dependency={}, attempts={}, lastError={}", name, attempt, e.toString());
                    throw new DependencyExhaustedException(name, attempt, e);
                }

                // 2. Retry: 대기 전에 관측 가능해야 함
                long delayMs = guard.backoff().calculate(attempt);
                log.warn("Retrying dependency call: dependency={}, attempt={}/{}, delayMs={}, error={}",
                    name, attempt, maxAttempts, delayMs, e.toString());
                events.emit(name, "retry.scheduled", EventOutcome.FAILURE, 0, Map.of(
                    "attempt", String.valueOf(attempt),
                    "delayMs", String.valueOf(delayMs),
                    "error", e.getClass().getSimpleName()));

                if (!guard.breaker().isCallPermitted()) {
                    log.warn("Circuit opened during retries, aborting: dependency={}", name);
                    throw new DependencyUnavailableException(name, e);
                }
                sleep(name, delayMs);
            }
        }
    }

    /**
     * 단일 시도: bulkhead 슬롯 획득 후 timeout 적용.
     */
    private <T> T attempt(DependencyGuard guard, Callable<T> operation) throws Exception {
        String name = guard.name();
        Bulkhead bulkhead = guard.bulkhead();

        // 3. Bulkhead
        if (!bulkhead.tryAcquire()) {
            long maxWaitMs = bulkhead.getConfig().maxWaitMs();
            log.warn("Bulkhead contention: dependency={}, inFlight={}, capacity={}, maxWaitMs={}",
                name, bulkhead.getCurrentConcurrency(), bulkhead.getConfig().capacity(), maxWaitMs);
            long waitStart = System.nanoTime();
            boolean acquired;
            try {
                acquired = bulkhead.tryAcquire(maxWaitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DependencyFailedException(name, e);
            }
            events.emit(name, "bulkhead.wait", acquired ? EventOutcome.SUCCESS : EventOutcome.REJECTED,
                elapsedMs(waitStart));
            if (!acquired) {
                throw new BulkheadTimeoutException(name, maxWaitMs);
            }
        }
        return withTimeout(guard, operation);
    }

    /**
     * 획득한 bulkhead 슬롯은 operation이 실제로 끝날 때 반납됩니다. 시간 초과로 포기한 시도가
     * 인터럽트를 무시하고 계속 실행되는 동안에는 슬롯을 점유합니다.
     */
    private <T> T withTimeout(DependencyGuard guard, Callable<T> operation) throws Exception {
        Bulkhead bulkhead = guard.bulkhead();
        long timeoutMs = guard.timeout().getAttemptTimeoutMs();
        if (timeoutMs == 0) {
            try {
                return operation.call();
            } finally {
                bulkhead.release();
            }
        }

        // 4. Timeout: 시도 스레드에도 MDC를 이어서 로그 상관관계 유지
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        AtomicBoolean claimed = new AtomicBoolean();
        Future<T> future;
        try {
            future = registry.attemptExecutor().submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return operation.call();
                } finally {
                    MDC.clear();
                    bulkhead.release();
                }
            });
        } catch (RejectedExecutionException e) {
            bulkhead.release();
            throw new DependencyFailedException(guard.name(), e);
        }

        long start = System.nanoTime();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(future, claimed, bulkhead);
            long elapsed = elapsedMs(start);
            guard.timeout().recordTimeout(elapsed);
            log.warn("Attempt timed out: dependency={}, timeoutMs={}, elapsedMs={}", guard.name(), timeoutMs, elapsed);
            events.emit(guard.name(), "attempt.timeout", EventOutcome.FAILURE, elapsed,
                Map.of("timeoutMs", String.valueOf(timeoutMs)));
            throw new DependencyTimeoutException(guard.name(), timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new DependencyFailedException(guard.name(), cause);
        } catch (InterruptedException e) {
            abandon(future, claimed, bulkhead);
            Thread.currentThread().interrupt();
            throw new DependencyFailedException(guard.name(), e);
        }
    }

    /**
     * 시도를 취소합니다. 아직 시작하지 않은 시도라면 슬롯을 여기서 반납합니다.
     */
    private static void abandon(Future<?> future, AtomicBoolean claimed, Bulkhead bulkhead) {
        if (claimed.compareAndSet(false, true)) {
            bulkhead.release();
        }
        future.cancel(true);
    }

    private void sleep(String name, long delayMs) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DependencyFailedException(name, e);
        }
    }

    private static RuntimeException propagate(String name, Exception e) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new DependencyFailedException(name, e);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
