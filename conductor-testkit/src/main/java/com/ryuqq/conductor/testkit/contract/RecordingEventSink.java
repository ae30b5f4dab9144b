package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.core.event.EngineEvent;
import com.ryuqq.conductor.core.event.EventOutcome;
import com.ryuqq.conductor.core.spi.EventSink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Event sink that keeps every emitted event in memory.
 *
 * <p><strong>Thread-safety:</strong> events may be emitted from worker pools and attempt threads,
 * so the backing list is a {@link CopyOnWriteArrayList}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingEventSink implements EventSink {

    private final List<EngineEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger flushes = new AtomicInteger();

    @Override
    public void emit(EngineEvent event) {
        events.add(event);
    }

    @Override
    public void flush() {
        flushes.incrementAndGet();
    }

    public List<EngineEvent> all() {
        return new ArrayList<>(events);
    }

    /**
     * Events with the given name, in emission order.
     *
     * @param name event name (e.g. "retry.scheduled")
     * @return matching events
     */
    public List<EngineEvent> named(String name) {
        return events.stream()
            .filter(event -> event.name().equals(name))
            .collect(Collectors.toList());
    }

    public long count(String name, EventOutcome outcome) {
        return events.stream()
            .filter(event -> event.name().equals(name) && event.outcome() == outcome)
            .count();
    }

    public int flushCount() {
        return flushes.get();
    }

    public void clear() {
        events.clear();
        flushes.set(0);
    }
}
