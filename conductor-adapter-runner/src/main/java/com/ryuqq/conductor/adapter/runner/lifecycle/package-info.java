/**
 * Startup gating and the graceful shutdown sequence.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.adapter.runner.lifecycle;
