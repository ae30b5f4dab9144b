/**
 * Context propagation package.
 *
 * <p>Correlation state lives in the SLF4J MDC. Worker pools propagate it automatically; queue and process
 * boundaries carry it explicitly as a serialized {@link com.ryuqq.conductor.application.context.PropagationToken}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.application.context;
