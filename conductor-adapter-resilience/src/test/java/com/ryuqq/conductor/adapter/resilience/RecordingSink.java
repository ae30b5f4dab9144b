package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.event.EngineEvent;
import com.ryuqq.conductor.core.spi.EventSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 발행된 이벤트를 보관하는 테스트용 Sink.
 */
final class RecordingSink implements EventSink {

    private final List<EngineEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void emit(EngineEvent event) {
        events.add(event);
    }

    @Override
    public void flush() {
    }

    List<String> names() {
        return events.stream().map(EngineEvent::name).collect(Collectors.toList());
    }

    List<EngineEvent> named(String name) {
        return events.stream().filter(e -> e.name().equals(name)).collect(Collectors.toList());
    }
}
