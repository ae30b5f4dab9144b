package com.ryuqq.conductor.application.runtime;

/**
 * Queued work runtime.
 *
 * <p>Work that crosses a queue boundary does not share memory with its producer, so the runtime restores the
 * serialized propagation context of every dequeued item before handing it to the coordinator.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * 1. Dequeue a batch of QueuedWork from the WorkQueue
 * 2. For each item:
 *    a. Restore correlation/trace context from the item
 *    b. Build a root WorkUnit and hand it to the Coordinator
 *    c. Terminal COMPLETED/CANCELLED → ack
 *       Terminal FAILED with retryable code → nack
 *       Terminal FAILED otherwise → dead-letter
 * 3. Return (caller decides the polling cadence)
 * </pre>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
 * scheduler.scheduleWithFixedDelay(runtime::pump, 0, 100, TimeUnit.MILLISECONDS);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single pump cycle: dequeue, process, acknowledge.
     *
     * <p>Per-item failures are recorded on the item's WorkUnit and never escape this method.</p>
     *
     * @return number of items processed in this cycle
     * @throws IllegalStateException if the runtime has been stopped
     */
    int pump();
}
