/**
 * Delegation context package.
 *
 * <p>{@link com.ryuqq.conductor.core.delegation.DelegationContext} is threaded explicitly through
 * every Coordinator and handler call. Depth and visited handlers are per path; the budget ledger and
 * cancellation signal are shared by the whole tree under one root unit.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.delegation;
