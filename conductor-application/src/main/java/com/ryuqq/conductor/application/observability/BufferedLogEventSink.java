package com.ryuqq.conductor.application.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.core.event.EngineEvent;
import com.ryuqq.conductor.core.spi.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 이벤트를 모아 두었다가 JSON 한 줄씩 SLF4J로 출력하는 기본 EventSink.
 *
 * <p>버퍼가 가득 차거나 {@link #flush()}가 호출되면 출력합니다. 종료 시 Lifecycle Manager가 flush합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BufferedLogEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(BufferedLogEventSink.class);

    public static final int DEFAULT_CAPACITY = 256;

    private final ObjectMapper objectMapper;
    private final int capacity;
    private final List<EngineEvent> buffer = new ArrayList<>();
    private long flushedCount;

    public BufferedLogEventSink(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_CAPACITY);
    }

    public BufferedLogEventSink(ObjectMapper objectMapper, int capacity) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.objectMapper = objectMapper;
        this.capacity = capacity;
    }

    @Override
    public void emit(EngineEvent event) {
        List<EngineEvent> drained = null;
        synchronized (this) {
            buffer.add(event);
            if (buffer.size() >= capacity) {
                drained = drain();
            }
        }
        if (drained != null) {
            write(drained);
        }
    }

    @Override
    public void flush() {
        List<EngineEvent> drained;
        synchronized (this) {
            drained = drain();
        }
        write(drained);
    }

    private List<EngineEvent> drain() {
        List<EngineEvent> drained = new ArrayList<>(buffer);
        buffer.clear();
        flushedCount += drained.size();
        return drained;
    }

    private void write(List<EngineEvent> events) {
        for (EngineEvent event : events) {
            try {
                log.info("engine_event {}", objectMapper.writeValueAsString(event));
            } catch (JsonProcessingException e) {
                log.warn("Failed to serialize engine event: name={}, error={}", event.name(), e.getMessage());
            }
        }
    }

    public synchronized int pendingCount() {
        return buffer.size();
    }

    public synchronized long flushedCount() {
        return flushedCount;
    }
}
