package com.ryuqq.conductor.adapter.inmemory.store;

import com.ryuqq.conductor.core.spi.KeyValueStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-Memory KeyValueStore 구현체.
 *
 * <p>대화 상태(state-store)와 비용 기록(cost-store)의 기본 저장소입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, String value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        entries.put(key, value);
    }

    public int size() {
        return entries.size();
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(entries);
    }

    public void clear() {
        entries.clear();
    }
}
