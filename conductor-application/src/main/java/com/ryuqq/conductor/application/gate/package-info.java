/**
 * Engine gate: readiness, intake acceptance and in-flight tracking used by graceful shutdown.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.application.gate;
