/**
 * Protection SPI package.
 *
 * <p>Per-dependency guards composed by the resilience pipeline:</p>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.protection.CircuitBreaker}: consecutive-failure breaker</li>
 *   <li>{@link com.ryuqq.conductor.core.protection.Bulkhead}: concurrency limit with bounded wait</li>
 *   <li>{@link com.ryuqq.conductor.core.protection.TimeoutPolicy}: per-attempt timeout</li>
 * </ul>
 *
 * <p>Implementations live in {@code conductor-adapter-resilience}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.protection;
