/**
 * WorkUnit state machine package.
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → RUNNING → {COMPLETED | FAILED | CANCELLED}
 * RUNNING → AWAITING_APPROVAL → RUNNING   (human confirmation detour)
 * PENDING / AWAITING_APPROVAL → {FAILED | CANCELLED}
 *
 * Forbidden:
 * - COMPLETED / FAILED / CANCELLED → * (terminal records are frozen)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.statemachine;
