/**
 * Queued intake runtime contract.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.application.runtime;
