package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.protection.CallPermission;
import com.ryuqq.conductor.core.protection.CircuitBreakerConfig;
import com.ryuqq.conductor.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CountingCircuitBreaker 유닛 테스트.
 *
 * <ul>
 *   <li>CLOSED: 연속 실패 임계값 도달 시 OPEN</li>
 *   <li>OPEN: 유지 시간 동안 DENIED, 경과 후 단일 TRIAL</li>
 *   <li>HALF_OPEN: 시험 성공 → CLOSED, 실패 → OPEN (시각 재설정)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CountingCircuitBreakerTest {

    private static final IOException FAILURE = new IOException("boom");

    private TestClock clock;
    private RecordingSink sink;
    private CountingCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2026-01-01T00:00:00Z"));
        sink = new RecordingSink();
        breaker = new CountingCircuitBreaker("llm", new CircuitBreakerConfig(5, 30_000),
            clock, new ResilienceEventEmitter(sink));
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            CallPermission permission = breaker.tryAcquire();
            breaker.recordFailure(permission, FAILURE);
        }
    }

    // ============================================================
    // CLOSED
    // ============================================================

    @Test
    void 연속_실패가_임계값에_도달하면_OPEN으로_전이함() {
        // when
        fail(5);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.snapshot().consecutiveFailures()).isEqualTo(5);
        assertThat(breaker.snapshot().openedAt()).isEqualTo(clock.instant());
        assertThat(breaker.tryAcquire()).isEqualTo(CallPermission.DENIED);
        assertThat(sink.names()).containsExactly("breaker.open");
    }

    @Test
    void 성공하면_연속_실패_카운트가_초기화됨() {
        // given
        fail(4);

        // when
        breaker.recordSuccess(breaker.tryAcquire());
        fail(4);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.snapshot().consecutiveFailures()).isEqualTo(4);
    }

    // ============================================================
    // OPEN → HALF_OPEN
    // ============================================================

    @Test
    void 유지_시간_경과_후_단_하나의_TRIAL만_허가함() {
        // given
        fail(5);
        clock.advance(Duration.ofSeconds(30));

        // when
        CallPermission first = breaker.tryAcquire();
        CallPermission second = breaker.tryAcquire();

        // then
        assertThat(first).isEqualTo(CallPermission.TRIAL);
        assertThat(second).isEqualTo(CallPermission.DENIED);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(breaker.isCallPermitted()).isFalse();
    }

    @Test
    void 유지_시간_이전에는_DENIED() {
        // given
        fail(5);
        clock.advance(Duration.ofMillis(29_999));

        // when & then
        assertThat(breaker.tryAcquire()).isEqualTo(CallPermission.DENIED);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 시험_호출_성공_시_CLOSED로_전이하고_카운트_초기화() {
        // given
        fail(5);
        clock.advance(Duration.ofSeconds(31));
        CallPermission trial = breaker.tryAcquire();

        // when
        breaker.recordSuccess(trial);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.snapshot().consecutiveFailures()).isZero();
        assertThat(breaker.snapshot().openedAt()).isNull();
        assertThat(sink.names()).containsExactly("breaker.open", "breaker.half-open", "breaker.closed");
    }

    @Test
    void 시험_호출_실패_시_OPEN으로_돌아가고_유지_시간이_재설정됨() {
        // given
        fail(5);
        clock.advance(Duration.ofSeconds(31));
        CallPermission trial = breaker.tryAcquire();

        // when
        breaker.recordFailure(trial, FAILURE);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.snapshot().openedAt()).isEqualTo(clock.instant());
        clock.advance(Duration.ofSeconds(29));
        assertThat(breaker.tryAcquire()).isEqualTo(CallPermission.DENIED);
    }

    @Test
    void 반납된_TRIAL_이후에는_다시_TRIAL을_허가함() {
        // given
        fail(5);
        clock.advance(Duration.ofSeconds(31));
        CallPermission trial = breaker.tryAcquire();

        // when
        breaker.releasePermission(trial);

        // then
        assertThat(breaker.tryAcquire()).isEqualTo(CallPermission.TRIAL);
    }

    @Test
    void OPEN_상태에서_늦게_도착한_PERMITTED_결과는_무시됨() {
        // given
        CallPermission stale = breaker.tryAcquire();
        fail(5);
        clock.advance(Duration.ofSeconds(31));
        breaker.tryAcquire();

        // when
        breaker.recordSuccess(stale);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void reset_호출_시_CLOSED로_강제_전이() {
        // given
        fail(5);

        // when
        breaker.reset();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.tryAcquire()).isEqualTo(CallPermission.PERMITTED);
    }
}
