package com.ryuqq.conductor.application.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 핸들러가 사용하는 워커 풀.
 *
 * <ul>
 *   <li>I/O 풀: 형제 위임, 블로킹 I/O 오프로드</li>
 *   <li>CPU 풀: 크기와 대기열이 제한된 CPU 바운드 작업용. 대기열이 가득 차면 호출 스레드에서 실행</li>
 * </ul>
 *
 * <p>두 풀 모두 상관관계 정보를 자동 전파합니다. Lifecycle Manager가 종료 시 {@link #shutdown(long)}을 호출합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkerPools {

    private static final Logger log = LoggerFactory.getLogger(WorkerPools.class);

    private final ExecutorService io;
    private final ExecutorService cpu;

    public WorkerPools(int ioThreads, int cpuThreads, int cpuQueueCapacity, ContextPropagator propagator) {
        if (ioThreads <= 0 || cpuThreads <= 0 || cpuQueueCapacity <= 0) {
            throw new IllegalArgumentException("pool sizes must be positive");
        }
        this.io = new ContextPropagatingExecutorService(
            Executors.newFixedThreadPool(ioThreads, named("conductor-io")), propagator);
        this.cpu = new ContextPropagatingExecutorService(
            new ThreadPoolExecutor(cpuThreads, cpuThreads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(cpuQueueCapacity), named("conductor-cpu"),
                new ThreadPoolExecutor.CallerRunsPolicy()),
            propagator);
    }

    public ExecutorService io() {
        return io;
    }

    public ExecutorService cpu() {
        return cpu;
    }

    /**
     * 두 풀 종료.
     *
     * @param timeoutMs 풀마다 기다릴 최대 시간
     * @return 두 풀 모두 제한 시간 안에 종료되었으면 true
     */
    public boolean shutdown(long timeoutMs) {
        io.shutdown();
        cpu.shutdown();
        try {
            boolean ioDone = io.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
            boolean cpuDone = cpu.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
            if (!ioDone || !cpuDone) {
                log.warn("Worker pools did not terminate in time, interrupting: io={}, cpu={}", ioDone, cpuDone);
                io.shutdownNow();
                cpu.shutdownNow();
            }
            return ioDone && cpuDone;
        } catch (InterruptedException e) {
            io.shutdownNow();
            cpu.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
