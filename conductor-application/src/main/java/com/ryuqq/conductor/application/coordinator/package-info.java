/**
 * Coordinator contract.
 *
 * <p>The coordinator is the engine's single entry point for units of work. Implementations live in the runner
 * adapter.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.application.coordinator;
