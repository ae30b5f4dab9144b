/**
 * Service Provider Interface package.
 *
 * <p>External collaborators the engine consumes but does not implement:</p>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.spi.ResilientCaller}: the only sanctioned path to external systems</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.KeyValueStore}: conversation state and cost records</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.WorkUnitStore}: terminal unit persistence</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.WorkQueue}: queued intake</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.EventSink}: structured observability events</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.Classifier}: fallback routing classification</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.spi;
