package com.ryuqq.conductor.adapter.resilience;

import com.ryuqq.conductor.core.protection.Bulkhead;
import com.ryuqq.conductor.core.protection.BulkheadConfig;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 공정(fair) Semaphore 기반 Bulkhead.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SemaphoreBulkhead implements Bulkhead {

    private final BulkheadConfig config;
    private final Semaphore permits;

    public SemaphoreBulkhead(BulkheadConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.permits = new Semaphore(config.capacity(), true);
    }

    @Override
    public boolean tryAcquire() {
        return permits.tryAcquire();
    }

    @Override
    public boolean tryAcquire(long timeoutMs) throws InterruptedException {
        return permits.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void release() {
        permits.release();
    }

    @Override
    public int getCurrentConcurrency() {
        return config.capacity() - permits.availablePermits();
    }

    @Override
    public BulkheadConfig getConfig() {
        return config;
    }
}
