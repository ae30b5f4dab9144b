package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.event.EngineEvent;

/**
 * 관측 이벤트 출력 SPI.
 *
 * <p>엔진이 외부에 노출하는 유일한 인터페이스입니다. 구현은 버퍼링할 수 있으며,
 * Lifecycle Manager가 종료 과정에서 {@link #flush()}를 호출합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventSink {

    /**
     * 이벤트 기록. 호출자를 실패시키지 않아야 합니다.
     *
     * @param event 이벤트
     */
    void emit(EngineEvent event);

    void flush();

    /**
     * 아무것도 하지 않는 Sink.
     *
     * @return no-op EventSink
     */
    static EventSink noop() {
        return new EventSink() {
            @Override
            public void emit(EngineEvent event) {
            }

            @Override
            public void flush() {
            }
        };
    }
}
