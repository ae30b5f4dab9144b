package com.ryuqq.conductor.application.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.application.support.Units;
import com.ryuqq.conductor.core.event.EngineEvent;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.model.WorkUnit;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BufferedLogEventSink 테스트.
 */
class BufferedLogEventSinkTest {

    @Test
    void emit_용량_전까지는_버퍼에_보관하고_flush_시_비운다() {
        // given
        BufferedLogEventSink sink = new BufferedLogEventSink(new ObjectMapper(), 10);
        WorkUnit unit = Units.running("x");

        // when
        sink.emit(EngineEvents.of(unit, "stage.safety-check", EventOutcome.SUCCESS, 1));
        sink.emit(EngineEvents.of(unit, "stage.state-load", EventOutcome.SUCCESS, 2, Map.of("handler", "h")));

        // then
        assertThat(sink.pendingCount()).isEqualTo(2);
        sink.flush();
        assertThat(sink.pendingCount()).isZero();
        assertThat(sink.flushedCount()).isEqualTo(2);
    }

    @Test
    void emit_용량에_도달하면_자동_flush() {
        BufferedLogEventSink sink = new BufferedLogEventSink(new ObjectMapper(), 2);

        sink.emit(new EngineEvent(null, null, "a", EventOutcome.SUCCESS, 0, null));
        sink.emit(new EngineEvent(null, null, "b", EventOutcome.SUCCESS, 0, null));

        assertThat(sink.pendingCount()).isZero();
        assertThat(sink.flushedCount()).isEqualTo(2);
    }

    @Test
    void EngineEvents_WorkUnit_식별자를_채운다() {
        WorkUnit unit = Units.running("x");

        EngineEvent event = EngineEvents.of(unit, "coordinator.route", EventOutcome.SUCCESS, -5);

        assertThat(event.workUnitId()).isEqualTo(unit.getId().getValue());
        assertThat(event.conversationId()).isEqualTo("conv-1");
        assertThat(event.durationMs()).isZero();
    }

    @Test
    void 생성자_용량_검증() {
        assertThatThrownBy(() -> new BufferedLogEventSink(new ObjectMapper(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
