/**
 * Domain model package.
 *
 * <p>{@link com.ryuqq.conductor.core.model.WorkUnit} is the single primitive flowing through the engine.
 * Identifiers and payloads are immutable value objects.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.model;
