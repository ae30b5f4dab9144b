/**
 * Resilience adapter.
 *
 * <p>Implements {@link com.ryuqq.conductor.core.spi.ResilientCaller} on top of the protection SPI.
 * All breaker and bulkhead state hangs off one {@link com.ryuqq.conductor.adapter.resilience.DependencyRegistry}
 * per engine instance.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.adapter.resilience;
