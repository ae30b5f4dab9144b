/**
 * Observability package: structured engine events and the default buffered sink.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.application.observability;
