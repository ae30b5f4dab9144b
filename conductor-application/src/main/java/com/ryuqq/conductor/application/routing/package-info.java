/**
 * Routing package: a prioritized list of deterministic rules with a single classifier fallback.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.application.routing;
