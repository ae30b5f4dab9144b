package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.adapter.inmemory.store.InMemoryKeyValueStore;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory store whose next reads can be made to fail.
 *
 * <p>Failures are {@link IllegalStateException}s, which the default retry configuration does not retry.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FlakyKeyValueStore extends InMemoryKeyValueStore {

    private final AtomicInteger failingReads = new AtomicInteger();

    /**
     * Makes the next {@code count} calls to {@link #get(String)} throw.
     */
    public void failNextReads(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative");
        }
        failingReads.set(count);
    }

    @Override
    public Optional<String> get(String key) {
        if (failingReads.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("store read failed for " + key);
        }
        return super.get(key);
    }

    @Override
    public void clear() {
        failingReads.set(0);
        super.clear();
    }
}
