/**
 * Middleware chain package.
 *
 * <p>The chain order is fixed at construction: safety-check, state-load, handler, cost-accounting,
 * output-normalization, state-save. Only safety-check aborts a unit of work; every other stage failure is
 * logged and recovered.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.application.middleware;
