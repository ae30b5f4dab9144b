package com.ryuqq.conductor.application.context;

import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 제출 시점의 상관관계 정보를 작업 스레드로 자동 전파하는 ExecutorService.
 *
 * <p>submit/invokeAll 등은 모두 {@link #execute(Runnable)}를 거치므로 제출 스레드에서 캡처됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ContextPropagatingExecutorService extends AbstractExecutorService {

    private final ExecutorService delegate;
    private final ContextPropagator propagator;

    public ContextPropagatingExecutorService(ExecutorService delegate, ContextPropagator propagator) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (propagator == null) {
            throw new IllegalArgumentException("propagator cannot be null");
        }
        this.delegate = delegate;
        this.propagator = propagator;
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(propagator.wrap(command));
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    @Override
    public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    @Override
    public boolean isTerminated() {
        return delegate.isTerminated();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return delegate.awaitTermination(timeout, unit);
    }
}
