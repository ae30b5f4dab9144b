/**
 * In-memory work queue adapter.
 *
 * <p>Delayed publish, visibility timeout and dead-letter storage for single-process runs and tests.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.adapter.inmemory.queue;
