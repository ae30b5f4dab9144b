package com.ryuqq.conductor.testkit.contract;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A dependency call that fails a fixed number of times before succeeding.
 *
 * <p>Failures are {@link IOException}s, which the default retry configuration treats as transient.
 * Use {@link #alwaysFailing(RuntimeException)} for a permanent failure.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FlakyOperation implements Callable<String> {

    private final int failuresBeforeSuccess;
    private final RuntimeException permanentFailure;
    private final String result;
    private final AtomicInteger attempts = new AtomicInteger();

    private FlakyOperation(int failuresBeforeSuccess, RuntimeException permanentFailure, String result) {
        this.failuresBeforeSuccess = failuresBeforeSuccess;
        this.permanentFailure = permanentFailure;
        this.result = result;
    }

    /**
     * Fails with an IOException {@code failures} times, then returns {@code result}.
     */
    public static FlakyOperation failingTimes(int failures, String result) {
        if (failures < 0) {
            throw new IllegalArgumentException("failures cannot be negative");
        }
        return new FlakyOperation(failures, null, result);
    }

    public static FlakyOperation alwaysFailing(RuntimeException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return new FlakyOperation(Integer.MAX_VALUE, failure, null);
    }

    @Override
    public String call() throws Exception {
        int attempt = attempts.incrementAndGet();
        if (permanentFailure != null) {
            throw permanentFailure;
        }
        if (attempt <= failuresBeforeSuccess) {
            throw new IOException("transient failure #" + attempt);
        }
        return result;
    }

    public int attempts() {
        return attempts.get();
    }
}
