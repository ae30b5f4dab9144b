package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.protection.CallPermission;
import com.ryuqq.conductor.core.protection.CircuitBreaker;
import com.ryuqq.conductor.core.protection.CircuitBreakerConfig;
import com.ryuqq.conductor.core.protection.CircuitBreakerState;
import com.ryuqq.conductor.core.protection.DependencyBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p>의존성 하나당 하나의 인스턴스를 모든 호출자가 공유합니다. 모든 상태 변경은
 * 인스턴스 락 안에서 일어나므로 의존성별 단일 writer가 보장됩니다.</p>
 *
 * <p><strong>상태별 동작:</strong></p>
 * <ul>
 *   <li>CLOSED: 실패 시 카운트 증가, 성공 시 0으로 초기화, 임계값 도달 시 OPEN</li>
 *   <li>OPEN: open 유지 시간 동안 DENIED, 경과 후 첫 요청에 HALF_OPEN 전이 및 TRIAL 허가</li>
 *   <li>HALF_OPEN: 진행 중인 시험 호출이 없을 때만 TRIAL 허가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CountingCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CountingCircuitBreaker.class);

    private final String dependencyName;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ResilienceEventEmitter events;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public CountingCircuitBreaker(String dependencyName, CircuitBreakerConfig config, Clock clock,
                                  ResilienceEventEmitter events) {
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependencyName cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        this.dependencyName = dependencyName;
        this.config = config;
        this.clock = clock;
        this.events = events;
    }

    @Override
    public String getDependencyName() {
        return dependencyName;
    }

    @Override
    public synchronized CallPermission tryAcquire() {
        switch (state) {
            case CLOSED:
                return CallPermission.PERMITTED;
            case OPEN:
                if (clock.instant().isBefore(openedAt.plusMillis(config.openDurationMs()))) {
                    return CallPermission.DENIED;
                }
                state = CircuitBreakerState.HALF_OPEN;
                trialInFlight = true;
                log.info("Circuit breaker HALF_OPEN: dependency={}, openedAt={}", dependencyName, openedAt);
                events.emit(dependencyName, "breaker.half-open", EventOutcome.SUCCESS, 0);
                return CallPermission.TRIAL;
            case HALF_OPEN:
                if (trialInFlight) {
                    return CallPermission.DENIED;
                }
                trialInFlight = true;
                return CallPermission.TRIAL;
            default:
                throw new IllegalStateException("Unknown breaker state: " + state);
        }
    }

    @Override
    public synchronized boolean isCallPermitted() {
        return state == CircuitBreakerState.CLOSED;
    }

    @Override
    public synchronized void recordSuccess(CallPermission permission) {
        if (permission == CallPermission.TRIAL && state == CircuitBreakerState.HALF_OPEN) {
            state = CircuitBreakerState.CLOSED;
            consecutiveFailures = 0;
            openedAt = null;
            trialInFlight = false;
            log.info("Circuit breaker CLOSED after successful trial: dependency={}", dependencyName);
            events.emit(dependencyName, "breaker.closed", EventOutcome.SUCCESS, 0);
        } else if (permission == CallPermission.PERMITTED && state == CircuitBreakerState.CLOSED) {
            consecutiveFailures = 0;
        }
    }

    @Override
    public synchronized void recordFailure(CallPermission permission, Throwable error) {
        if (permission == CallPermission.TRIAL && state == CircuitBreakerState.HALF_OPEN) {
            open("trial failed", error);
        } else if (permission == CallPermission.PERMITTED && state == CircuitBreakerState.CLOSED) {
            consecutiveFailures++;
            if (consecutiveFailures >= config.failureThreshold()) {
                open("failure threshold reached", error);
            }
        }
    }

    @Override
    public synchronized void releasePermission(CallPermission permission) {
        if (permission == CallPermission.TRIAL && state == CircuitBreakerState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    private void open(String reason, Throwable error) {
        state = CircuitBreakerState.OPEN;
        openedAt = clock.instant();
        trialInFlight = false;
        log.error("Circuit breaker OPEN: dependency={}, reason={}, consecutiveFailures={}, lastError={}",
            dependencyName, reason, consecutiveFailures, error == null ? null : error.toString());
        events.emit(dependencyName, "breaker.open", EventOutcome.FAILURE, 0);
    }

    @Override
    public synchronized CircuitBreakerState getState() {
        return state;
    }

    @Override
    public synchronized DependencyBreakerState snapshot() {
        return new DependencyBreakerState(dependencyName, state, consecutiveFailures, openedAt);
    }

    @Override
    public synchronized void reset() {
        CircuitBreakerState previous = state;
        state = CircuitBreakerState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
        log.info("Circuit breaker reset: dependency={}, previousState={}", dependencyName, previous);
    }

    @Override
    public synchronized String toString() {
        return "CountingCircuitBreaker{dependency=" + dependencyName + ", state=" + state
            + ", failures=" + consecutiveFailures + "}";
    }
}
